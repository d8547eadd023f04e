package io.github.manjago.darwin.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A candidate solution together with its fitness.
 *
 * <p>Ordering always means desirability: when {@code maximize} is false the
 * comparison of fitness values is inverted, so {@code a.isBetterThan(b)} is true
 * for the lower value. Comparing individuals whose fitness is unset throws
 * {@link IllegalStateException}.
 *
 * @param <C> candidate type
 */
public final class Individual<C> implements Comparable<Individual<C>> {

    private final C candidate;
    private final boolean maximize;
    private final long birthdate;
    private @Nullable Fitness fitness;

    /**
     * Create an individual with unset fitness.
     */
    public Individual(C candidate, boolean maximize) {
        this(candidate, null, maximize);
    }

    public Individual(C candidate, @Nullable Fitness fitness, boolean maximize) {
        this.candidate = candidate;
        this.fitness = fitness;
        this.maximize = maximize;
        this.birthdate = System.currentTimeMillis();
    }

    // ========== Accessors ==========

    public C candidate() {
        return candidate;
    }

    public @Nullable Fitness fitness() {
        return fitness;
    }

    public boolean hasFitness() {
        return fitness != null;
    }

    /**
     * Fitness that must already be set.
     *
     * @throws IllegalStateException if the fitness is unset
     */
    public @NotNull Fitness requireFitness() {
        if (fitness == null) {
            throw new IllegalStateException("Fitness is not set for candidate " + candidate);
        }
        return fitness;
    }

    public void setFitness(@Nullable Fitness fitness) {
        this.fitness = fitness;
    }

    public boolean maximize() {
        return maximize;
    }

    /**
     * Creation time in epoch milliseconds.
     */
    public long birthdate() {
        return birthdate;
    }

    // ========== Ordering ==========

    /**
     * Strictly less desirable than {@code other}.
     */
    public boolean isWorseThan(@NotNull Individual<?> other) {
        Fitness mine = requireFitness();
        Fitness theirs = other.requireFitness();
        return maximize ? mine.isWorseThan(theirs) : theirs.isWorseThan(mine);
    }

    public boolean isBetterThan(@NotNull Individual<?> other) {
        return other.isWorseThan(this);
    }

    public boolean isWorseOrEqual(@NotNull Individual<?> other) {
        return isWorseThan(other) || !other.isWorseThan(this);
    }

    public boolean isBetterOrEqual(@NotNull Individual<?> other) {
        return other.isWorseThan(this) || !isWorseThan(other);
    }

    /**
     * Ascending order is from worst to best. Mutually non-dominated Pareto
     * individuals compare as equal.
     */
    @Override
    public int compareTo(@NotNull Individual<C> other) {
        if (isWorseThan(other)) {
            return -1;
        }
        if (other.isWorseThan(this)) {
            return 1;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Individual<?> that)) return false;
        return maximize == that.maximize
                && Objects.equals(candidate, that.candidate)
                && Objects.equals(fitness, that.fitness);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, fitness, maximize);
    }

    @Override
    public String toString() {
        return candidate + " : " + fitness;
    }
}
