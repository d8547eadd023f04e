package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.evaluation.PerCandidateEvaluator;

import java.util.List;
import java.util.function.Function;

/**
 * Scores a batch of candidates.
 *
 * The result holds one entry per candidate, in input order. A null entry
 * means the candidate is excluded from the population. Receiving the whole
 * batch lets an implementation score candidates in parallel.
 */
@FunctionalInterface
public interface Evaluator<C> {

    List<Fitness> evaluate(List<C> candidates, EvolutionContext<?> context);

    /**
     * Evaluator that scores candidates one at a time with {@code fitness}.
     */
    static <C> Evaluator<C> of(Function<? super C, ? extends Fitness> fitness) {
        return new PerCandidateEvaluator<>(fitness);
    }
}
