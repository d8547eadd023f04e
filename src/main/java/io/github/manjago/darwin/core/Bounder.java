package io.github.manjago.darwin.core;

import io.github.manjago.darwin.engine.EvolutionContext;

/**
 * Maps a candidate back into the legal search space.
 *
 * @param <C> candidate type
 */
@FunctionalInterface
public interface Bounder<C> {

    /**
     * Legal version of {@code candidate}. Must not modify the argument.
     */
    C bound(C candidate, EvolutionContext<?> context);

    static <C> Bounder<C> identity() {
        return (candidate, context) -> candidate;
    }
}
