package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * (mu + lambda): the best of parents and offspring together survive.
 */
public final class PlusReplacer<C> implements Replacer<C> {

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        List<Individual<C>> pool = new ArrayList<>(offspring);
        pool.addAll(parents);
        pool.sort(Collections.reverseOrder());
        return new ArrayList<>(pool.subList(0, Math.min(population.size(), pool.size())));
    }
}
