package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Offspring replace randomly chosen members; the best {@code numElites} are never replaced.
 */
public final class RandomReplacer<C> implements Replacer<C> {

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        List<Individual<C>> survivors = new ArrayList<>(population);
        survivors.sort(Collections.reverseOrder());
        int numElites = Math.min(context.config().numElites(), survivors.size());
        int count = Math.min(offspring.size(), survivors.size() - numElites);
        if (count <= 0) {
            return survivors;
        }
        List<Integer> replaceable = IntStream.range(numElites, survivors.size()).boxed().collect(Collectors.toList());
        List<Integer> slots = random.sample(replaceable, count);
        for (int i = 0; i < count; i++) {
            survivors.set(slots.get(i), offspring.get(i));
        }
        return survivors;
    }
}
