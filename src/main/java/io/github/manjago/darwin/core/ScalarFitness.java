package io.github.manjago.darwin.core;

import org.jetbrains.annotations.NotNull;

/**
 * Single-objective fitness. Larger values are "greater"; the
 * {@link Individual} inverts this for minimization.
 */
public record ScalarFitness(double value) implements Fitness {

    public static ScalarFitness of(double value) {
        return new ScalarFitness(value);
    }

    @Override
    public int objectives() {
        return 1;
    }

    @Override
    public double objective(int index) {
        if (index != 0) {
            throw new IndexOutOfBoundsException("Scalar fitness has one objective, index " + index);
        }
        return value;
    }

    @Override
    public boolean isWorseThan(@NotNull Fitness other) {
        if (!(other instanceof ScalarFitness scalar)) {
            throw new IllegalArgumentException(
                    "Cannot compare scalar fitness with " + other.getClass().getSimpleName());
        }
        return value < scalar.value;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
