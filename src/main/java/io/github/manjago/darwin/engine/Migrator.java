package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;

import java.util.List;

/**
 * Exchanges individuals with other runs.
 */
@FunctionalInterface
public interface Migrator<C> {

    List<Individual<C>> migrate(EvolutionRandom random, List<Individual<C>> population, EvolutionContext<C> context);
}
