package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Variator;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for crossovers over sequence candidates.
 *
 * Candidates are paired in order (0 with 1, 2 with 3, ...). An odd trailing
 * candidate is dropped. Each pair is crossed with probability
 * {@code crossoverRate}; otherwise copies of the parents are passed on.
 *
 * @param <E> allele type
 */
public abstract class Crossover<E> implements Variator<List<E>> {

    @Override
    public final List<List<E>> vary(EvolutionRandom random, List<List<E>> candidates,
                                    EvolutionContext<List<E>> context) {
        double rate = context.config().crossoverRate();
        List<List<E>> children = new ArrayList<>(candidates.size());
        for (int i = 0; i + 1 < candidates.size(); i += 2) {
            List<E> mom = candidates.get(i);
            List<E> dad = candidates.get(i + 1);
            if (random.nextBoolean(rate)) {
                children.addAll(cross(random, mom, dad, context));
            } else {
                children.add(new ArrayList<>(mom));
                children.add(new ArrayList<>(dad));
            }
        }
        return children;
    }

    /**
     * Children of one pair. The parents must not be modified.
     */
    protected abstract List<List<E>> cross(EvolutionRandom random, List<E> mom, List<E> dad,
                                           EvolutionContext<List<E>> context);

    protected static void requireSameLength(List<?> mom, List<?> dad) {
        if (mom.size() != dad.size()) {
            throw new IllegalArgumentException(
                    "Parents differ in length: " + mom.size() + " vs " + dad.size());
        }
    }
}
