package io.github.manjago.darwin.selection;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Selector;

import java.util.List;

/**
 * Selects the whole population.
 */
public final class DefaultSelector<C> implements Selector<C> {

    @Override
    public List<Individual<C>> select(EvolutionRandom random, List<Individual<C>> population,
                                      EvolutionContext<C> context) {
        return population;
    }
}
