package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;

import java.util.ArrayList;
import java.util.List;

/**
 * Offspring replace the worst members of the population.
 */
public final class SteadyStateReplacer<C> implements Replacer<C> {

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        List<Individual<C>> survivors = new ArrayList<>(population);
        survivors.sort(null);
        int count = Math.min(offspring.size(), survivors.size());
        for (int i = 0; i < count; i++) {
            survivors.set(i, offspring.get(i));
        }
        return survivors;
    }
}
