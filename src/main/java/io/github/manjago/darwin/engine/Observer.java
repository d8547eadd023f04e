package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.Individual;

import java.util.List;

/**
 * Called after initialization and after every generation.
 * Observers must not modify the population.
 */
@FunctionalInterface
public interface Observer<C> {

    void observe(List<Individual<C>> population, EvolutionContext<C> context);

    /**
     * Observer that does nothing.
     */
    static <C> Observer<C> noop() {
        return (population, context) -> { };
    }
}
