package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;

import java.util.List;

/**
 * Chooses parents from the population.
 */
@FunctionalInterface
public interface Selector<C> {

    List<Individual<C>> select(EvolutionRandom random, List<Individual<C>> population, EvolutionContext<C> context);
}
