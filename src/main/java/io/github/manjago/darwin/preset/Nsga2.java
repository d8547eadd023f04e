package io.github.manjago.darwin.preset;

import io.github.manjago.darwin.archive.BestArchiver;
import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.emo.NsgaReplacer;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.selection.TournamentSelector;

/**
 * NSGA-II: binary tournaments over a full population of parents, survivor
 * selection by non-dominated sorting and crowding distance, and an archive of
 * the non-dominated front. Variators are left to the caller.
 */
public class Nsga2<C> extends EvolutionEngine<C> {

    public Nsga2(EvolutionRandom random) {
        super(random);
        setSelector(new TournamentSelector<>());
        setReplacer(new NsgaReplacer<>());
        setArchiver(new BestArchiver<>());
    }

    @Override
    protected EvolutionConfig applyDefaults(EvolutionConfig config, int popSize) {
        if (config.numSelected() > 0) {
            return config;
        }
        return config.toBuilder().numSelected(popSize).build();
    }
}
