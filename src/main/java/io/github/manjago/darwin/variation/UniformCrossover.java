package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Swaps each allele between the parents with probability {@code uxBias}.
 */
public final class UniformCrossover<E> extends Crossover<E> {

    @Override
    protected List<List<E>> cross(EvolutionRandom random, List<E> mom, List<E> dad,
                                  EvolutionContext<List<E>> context) {
        requireSameLength(mom, dad);
        double bias = context.config().uxBias();
        List<E> bro = new ArrayList<>(dad);
        List<E> sis = new ArrayList<>(mom);
        for (int i = 0; i < mom.size(); i++) {
            if (random.nextBoolean(bias)) {
                bro.set(i, mom.get(i));
                sis.set(i, dad.get(i));
            }
        }
        return List.of(bro, sis);
    }
}
