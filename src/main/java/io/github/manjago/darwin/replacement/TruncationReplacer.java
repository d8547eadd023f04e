package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps the best of population and offspring together, at the current population size.
 */
public final class TruncationReplacer<C> implements Replacer<C> {

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        int size = population.size();
        List<Individual<C>> pool = new ArrayList<>(population);
        pool.addAll(offspring);
        pool.sort(Collections.reverseOrder());
        return new ArrayList<>(pool.subList(0, Math.min(size, pool.size())));
    }
}
