package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.List;

/**
 * Flips each bit of a 0/1 candidate with probability {@code mutationRate}.
 */
public final class BitFlipMutation extends Mutation<Integer> {

    @Override
    protected List<Integer> mutate(EvolutionRandom random, List<Integer> mutant,
                                   EvolutionContext<List<Integer>> context) {
        double rate = context.config().mutationRate();
        for (int i = 0; i < mutant.size(); i++) {
            if (random.nextBoolean(rate)) {
                mutant.set(i, (mutant.get(i) + 1) % 2);
            }
        }
        return mutant;
    }
}
