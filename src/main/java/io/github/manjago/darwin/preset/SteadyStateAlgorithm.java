package io.github.manjago.darwin.preset;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.replacement.SteadyStateReplacer;
import io.github.manjago.darwin.selection.TournamentSelector;
import io.github.manjago.darwin.variation.GaussianMutation;
import io.github.manjago.darwin.variation.HeuristicCrossover;

import java.util.List;

/**
 * Steady-state real-valued algorithm (DEA): two tournament winners are crossed
 * heuristically, mutated, and their children replace the worst members.
 */
public class SteadyStateAlgorithm extends EvolutionEngine<List<Double>> {

    public SteadyStateAlgorithm(EvolutionRandom random) {
        super(random);
        setSelector(new TournamentSelector<>());
        setVariators(List.of(new HeuristicCrossover(), new GaussianMutation()));
        setReplacer(new SteadyStateReplacer<>());
    }

    @Override
    protected EvolutionConfig applyDefaults(EvolutionConfig config, int popSize) {
        if (config.numSelected() > 0) {
            return config;
        }
        return config.toBuilder().numSelected(2).build();
    }
}
