package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Offspring become the new population; the best {@code numElites} members of
 * the old population compete with them for a place.
 */
public final class GenerationalReplacer<C> implements Replacer<C> {

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        int numElites = Math.min(context.config().numElites(), population.size());
        List<Individual<C>> ranked = new ArrayList<>(population);
        ranked.sort(Collections.reverseOrder());

        List<Individual<C>> pool = new ArrayList<>(offspring);
        pool.addAll(ranked.subList(0, numElites));
        pool.sort(Collections.reverseOrder());
        return new ArrayList<>(pool.subList(0, Math.min(population.size(), pool.size())));
    }
}
