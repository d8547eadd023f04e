package io.github.manjago.darwin.core;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Multi-objective fitness compared by Pareto dominance.
 *
 * <p>{@code a.isWorseThan(b)} holds when {@code b} dominates {@code a}: {@code b} is
 * at least as good in every objective and strictly better in at least one. The
 * per-objective polarity of the receiver is used. Equality looks at the values only.
 */
public final class Pareto implements Fitness {

    private final double[] values;
    private final boolean[] maximize;

    /**
     * Pareto value whose objectives are all maximized.
     */
    public Pareto(double... values) {
        this(values, true);
    }

    /**
     * Pareto value with one polarity shared by every objective.
     */
    public Pareto(double[] values, boolean maximize) {
        this.values = values.clone();
        this.maximize = new boolean[values.length];
        Arrays.fill(this.maximize, maximize);
    }

    /**
     * Pareto value with per-objective polarity.
     */
    public Pareto(double[] values, boolean[] maximize) {
        if (values.length != maximize.length) {
            throw new IllegalArgumentException(
                    "Got " + values.length + " values but " + maximize.length + " polarity flags");
        }
        this.values = values.clone();
        this.maximize = maximize.clone();
    }

    @Override
    public int objectives() {
        return values.length;
    }

    @Override
    public double objective(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    public boolean maximizes(int index) {
        return maximize[index];
    }

    @Override
    public boolean isWorseThan(@NotNull Fitness other) {
        if (!(other instanceof Pareto that)) {
            throw new IllegalArgumentException(
                    "Cannot compare Pareto fitness with " + other.getClass().getSimpleName());
        }
        if (values.length != that.values.length) {
            throw new IllegalArgumentException(
                    "Pareto values differ in length: " + values.length + " vs " + that.values.length);
        }
        boolean strictlyBetter = false;
        for (int i = 0; i < values.length; i++) {
            double mine = values[i];
            double theirs = that.values[i];
            if (maximize[i]) {
                if (theirs < mine) {
                    return false;
                }
                if (theirs > mine) {
                    strictlyBetter = true;
                }
            } else {
                if (theirs > mine) {
                    return false;
                }
                if (theirs < mine) {
                    strictlyBetter = true;
                }
            }
        }
        return strictlyBetter;
    }

    /**
     * True when this value dominates {@code other}.
     */
    public boolean dominates(@NotNull Pareto other) {
        return other.isWorseThan(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pareto that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
