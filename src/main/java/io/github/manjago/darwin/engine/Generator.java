package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.EvolutionRandom;

/**
 * Creates a random candidate.
 */
@FunctionalInterface
public interface Generator<C> {

    C generate(EvolutionRandom random, EvolutionContext<?> context);
}
