package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;

import java.util.List;

/**
 * Maintains the archive of individuals kept apart from the population.
 * Both lists are copies owned by the call.
 */
@FunctionalInterface
public interface Archiver<C> {

    List<Individual<C>> archive(EvolutionRandom random,
                                List<Individual<C>> population,
                                List<Individual<C>> archive,
                                EvolutionContext<C> context);
}
