package io.github.manjago.darwin.evaluation;

import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Batch evaluator built from a function that scores one candidate.
 * The function may return null to exclude a candidate.
 */
public final class PerCandidateEvaluator<C> implements Evaluator<C> {

    private final Function<? super C, ? extends Fitness> fitness;

    public PerCandidateEvaluator(Function<? super C, ? extends Fitness> fitness) {
        this.fitness = Objects.requireNonNull(fitness, "fitness");
    }

    @Override
    public List<Fitness> evaluate(List<C> candidates, EvolutionContext<?> context) {
        List<Fitness> result = new ArrayList<>(candidates.size());
        for (C candidate : candidates) {
            result.add(fitness.apply(candidate));
        }
        return result;
    }
}
