package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * PMX for permutations. A random segment is exchanged between the parents and
 * the displaced values are relocated through the segment's mapping, so both
 * children stay permutations.
 */
public final class PartiallyMatchedCrossover<E> extends Crossover<E> {

    @Override
    protected List<List<E>> cross(EvolutionRandom random, List<E> mom, List<E> dad,
                                  EvolutionContext<List<E>> context) {
        requireSameLength(mom, dad);
        int size = mom.size();
        if (size < 2) {
            return List.of(new ArrayList<>(dad), new ArrayList<>(mom));
        }
        int[] points = Mutation.twoPoints(random, size);
        int x = points[0];
        int y = points[1];

        List<E> bro = new ArrayList<>(dad);
        List<E> sis = new ArrayList<>(mom);
        for (int i = x; i <= y; i++) {
            bro.set(i, mom.get(i));
            sis.set(i, dad.get(i));
        }
        repair(dad, bro, x, y);
        repair(mom, sis, x, y);
        return List.of(bro, sis);
    }

    private static <E> void repair(List<E> parent, List<E> child, int x, int y) {
        List<E> segment = child.subList(x, y + 1);
        for (int i = x; i <= y; i++) {
            E value = parent.get(i);
            if (segment.contains(value)) {
                continue;
            }
            int spot = i;
            while (spot >= x && spot <= y) {
                spot = parent.indexOf(child.get(spot));
            }
            child.set(spot, value);
        }
    }
}
