package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.List;

/**
 * Replaces each allele, with probability {@code mutationRate}, by a uniformly
 * chosen legal value.
 */
public final class RandomResetMutation<E> extends Mutation<E> {

    private final List<E> values;

    public RandomResetMutation(List<E> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("At least one legal value is required");
        }
        this.values = List.copyOf(values);
    }

    @Override
    protected List<E> mutate(EvolutionRandom random, List<E> mutant, EvolutionContext<List<E>> context) {
        double rate = context.config().mutationRate();
        for (int i = 0; i < mutant.size(); i++) {
            if (random.nextBoolean(rate)) {
                mutant.set(i, random.choice(values));
            }
        }
        return mutant;
    }
}
