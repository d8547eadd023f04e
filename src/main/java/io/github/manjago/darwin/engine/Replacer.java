package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;

import java.util.List;

/**
 * Builds the next population from the current one, the selected parents and
 * the evaluated offspring. The result size is up to the replacer.
 */
@FunctionalInterface
public interface Replacer<C> {

    List<Individual<C>> replace(EvolutionRandom random,
                                List<Individual<C>> population,
                                List<Individual<C>> parents,
                                List<Individual<C>> offspring,
                                EvolutionContext<C> context);
}
