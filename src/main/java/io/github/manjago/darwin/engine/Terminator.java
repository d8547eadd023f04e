package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.Individual;

import java.util.List;

/**
 * Decides whether the run stops before the next generation.
 */
@FunctionalInterface
public interface Terminator<C> {

    boolean shouldTerminate(List<Individual<C>> population, EvolutionContext<C> context);

    /**
     * Name recorded as the termination cause.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
