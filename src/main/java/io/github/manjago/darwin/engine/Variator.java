package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.EvolutionRandom;

import java.util.List;

/**
 * One stage of the variation pipeline: turns parent candidates into offspring.
 * Implementations must not modify the candidates they receive.
 */
@FunctionalInterface
public interface Variator<C> {

    List<C> vary(EvolutionRandom random, List<C> candidates, EvolutionContext<C> context);
}
