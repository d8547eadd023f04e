package io.github.manjago.darwin.preset;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.replacement.SimulatedAnnealingReplacer;
import io.github.manjago.darwin.variation.GaussianMutation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Simulated annealing over real vectors: a single solution, Gaussian moves and
 * Metropolis acceptance. The requested population size is ignored.
 */
public class SimulatedAnnealing extends EvolutionEngine<List<Double>> {

    private static final Logger log = LoggerFactory.getLogger(SimulatedAnnealing.class);

    public SimulatedAnnealing(EvolutionRandom random) {
        super(random);
        setVariator(new GaussianMutation());
        setReplacer(new SimulatedAnnealingReplacer<>());
    }

    @Override
    protected int effectivePopulationSize(int requested) {
        if (requested != 1) {
            log.debug("Simulated annealing uses a population of 1, ignoring {}", requested);
        }
        return 1;
    }
}
