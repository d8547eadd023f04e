package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.Collections;
import java.util.List;

/**
 * With probability {@code mutationRate}, reverses a random segment of the candidate.
 */
public final class InversionMutation<E> extends Mutation<E> {

    @Override
    protected List<E> mutate(EvolutionRandom random, List<E> mutant, EvolutionContext<List<E>> context) {
        if (mutant.size() < 2 || !random.nextBoolean(context.config().mutationRate())) {
            return mutant;
        }
        int[] points = twoPoints(random, mutant.size());
        Collections.reverse(mutant.subList(points[0], points[1] + 1));
        return mutant;
    }
}
