package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * With probability {@code mutationRate}, shuffles a random segment of the candidate.
 */
public final class ScrambleMutation<E> extends Mutation<E> {

    @Override
    protected List<E> mutate(EvolutionRandom random, List<E> mutant, EvolutionContext<List<E>> context) {
        if (mutant.size() < 2 || !random.nextBoolean(context.config().mutationRate())) {
            return mutant;
        }
        int[] points = twoPoints(random, mutant.size());
        List<E> segment = new ArrayList<>(mutant.subList(points[0], points[1] + 1));
        random.shuffle(segment);
        for (int i = 0; i < segment.size(); i++) {
            mutant.set(points[0] + i, segment.get(i));
        }
        return mutant;
    }
}
