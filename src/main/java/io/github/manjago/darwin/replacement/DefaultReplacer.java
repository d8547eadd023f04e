package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;

import java.util.List;

/**
 * Keeps the current population and discards the offspring.
 */
public final class DefaultReplacer<C> implements Replacer<C> {

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        return population;
    }
}
