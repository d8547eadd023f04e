package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Cuts both parents at {@code numCrossoverPoints} random positions and swaps
 * every other segment.
 */
public final class NPointCrossover<E> extends Crossover<E> {

    @Override
    protected List<List<E>> cross(EvolutionRandom random, List<E> mom, List<E> dad,
                                  EvolutionContext<List<E>> context) {
        requireSameLength(mom, dad);
        List<E> bro = new ArrayList<>(dad);
        List<E> sis = new ArrayList<>(mom);
        if (mom.size() < 2) {
            return List.of(bro, sis);
        }
        int numCuts = Math.min(mom.size() - 1, context.config().numCrossoverPoints());
        List<Integer> positions = IntStream.range(1, mom.size()).boxed().collect(Collectors.toList());
        Set<Integer> cuts = new HashSet<>(random.sample(positions, numCuts));

        boolean normal = true;
        for (int i = 0; i < mom.size(); i++) {
            if (cuts.contains(i)) {
                normal = !normal;
            }
            if (!normal) {
                bro.set(i, mom.get(i));
                sis.set(i, dad.get(i));
            }
        }
        return List.of(bro, sis);
    }
}
