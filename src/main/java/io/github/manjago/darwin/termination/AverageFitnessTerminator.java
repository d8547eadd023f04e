package io.github.manjago.darwin.termination;

import io.github.manjago.darwin.analysis.FitnessStatistics;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Terminator;

import java.util.List;

/**
 * Stops when the best fitness is within {@code tolerance} of the mean, i.e.
 * the population has converged. Needs scalar fitness.
 */
public final class AverageFitnessTerminator<C> implements Terminator<C> {

    @Override
    public boolean shouldTerminate(List<Individual<C>> population, EvolutionContext<C> context) {
        if (population.isEmpty()) {
            return false;
        }
        FitnessStatistics stats = FitnessStatistics.of(population);
        return Math.abs(stats.best() - stats.mean()) < context.config().tolerance();
    }
}
