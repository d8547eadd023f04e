package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Variator;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for mutations over sequence candidates: each candidate yields
 * exactly one mutant.
 *
 * @param <E> allele type
 */
public abstract class Mutation<E> implements Variator<List<E>> {

    @Override
    public final List<List<E>> vary(EvolutionRandom random, List<List<E>> candidates,
                                    EvolutionContext<List<E>> context) {
        List<List<E>> mutants = new ArrayList<>(candidates.size());
        for (List<E> candidate : candidates) {
            mutants.add(mutate(random, new ArrayList<>(candidate), context));
        }
        return mutants;
    }

    /**
     * Mutate {@code mutant}, a private copy of the parent, and return the result.
     */
    protected abstract List<E> mutate(EvolutionRandom random, List<E> mutant, EvolutionContext<List<E>> context);

    /**
     * Two distinct positions in ascending order.
     */
    protected static int[] twoPoints(EvolutionRandom random, int size) {
        int p = random.nextInt(size);
        int q = random.nextInt(size - 1);
        if (q >= p) {
            q++;
        }
        return new int[] {Math.min(p, q), Math.max(p, q)};
    }
}
