package io.github.manjago.darwin.core;

import org.jetbrains.annotations.NotNull;

/**
 * Quality value assigned to a candidate by an evaluator.
 *
 * Two implementations exist: {@link ScalarFitness} for single-objective problems
 * and {@link Pareto} for multi-objective ones. They are never comparable with
 * each other.
 */
public interface Fitness {

    /**
     * Number of objective values carried by this fitness.
     */
    int objectives();

    /**
     * Objective value at the given index.
     */
    double objective(int index);

    /**
     * Strict "less desirable than" in the natural polarity of this fitness.
     *
     * @throws IllegalArgumentException if the two values are of incompatible kinds
     */
    boolean isWorseThan(@NotNull Fitness other);
}
