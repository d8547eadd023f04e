package io.github.manjago.darwin.termination;

import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Terminator;

import java.util.List;

/**
 * Stops once {@code maxEvaluations} evaluations (default: population size) are spent.
 */
public final class EvaluationTerminator<C> implements Terminator<C> {

    @Override
    public boolean shouldTerminate(List<Individual<C>> population, EvolutionContext<C> context) {
        int maxEvaluations = context.config().maxEvaluationsOr(population.size());
        return context.engine().numEvaluations() >= maxEvaluations;
    }
}
