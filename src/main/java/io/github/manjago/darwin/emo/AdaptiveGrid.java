package io.github.manjago.darwin.emo;

import io.github.manjago.darwin.core.Fitness;

import java.util.Arrays;
import java.util.Collection;

/**
 * Recursive bisection of objective space into cells.
 *
 * Bounds are the per-objective minimum and maximum of the values given to
 * {@link #update}, each padded outward by 20% of its own magnitude. A location
 * packs one bit per objective per division, so every cell has a distinct id.
 */
public final class AdaptiveGrid {

    /** Location of a value outside the padded bounds. Never a real cell. */
    public static final long OUT_OF_RANGE = -1;

    private static final double PADDING = 0.2;
    private static final int MAX_BITS = 62;

    private final int divisions;
    private double[] smallest = new double[0];
    private double[] largest = new double[0];

    public AdaptiveGrid(int divisions) {
        if (divisions < 1) {
            throw new IllegalArgumentException("At least one grid division is required, got " + divisions);
        }
        this.divisions = divisions;
    }

    /**
     * Recompute the padded bounds from {@code values}.
     */
    public void update(Collection<? extends Fitness> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot size the grid from no values");
        }
        int objectives = values.iterator().next().objectives();
        if ((long) objectives * divisions > MAX_BITS) {
            throw new IllegalArgumentException(
                    objectives + " objectives with " + divisions + " divisions exceed the grid address space");
        }
        double[] min = new double[objectives];
        double[] max = new double[objectives];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
        for (Fitness f : values) {
            if (f.objectives() != objectives) {
                throw new IllegalArgumentException(
                        "Fitness values differ in objectives: " + f.objectives() + " vs " + objectives);
            }
            for (int i = 0; i < objectives; i++) {
                min[i] = Math.min(min[i], f.objective(i));
                max[i] = Math.max(max[i], f.objective(i));
            }
        }
        for (int i = 0; i < objectives; i++) {
            min[i] -= Math.abs(PADDING * min[i]);
            max[i] += Math.abs(PADDING * max[i]);
        }
        this.smallest = min;
        this.largest = max;
    }

    /**
     * Cell of {@code fitness}, or {@link #OUT_OF_RANGE}.
     */
    public long location(Fitness fitness) {
        int objectives = smallest.length;
        if (fitness.objectives() != objectives) {
            throw new IllegalArgumentException(
                    "Grid sized for " + objectives + " objectives, got " + fitness.objectives());
        }
        for (int i = 0; i < objectives; i++) {
            double f = fitness.objective(i);
            if (!(f >= smallest[i] && f <= largest[i])) {
                return OUT_OF_RANGE;
            }
        }

        double[] low = smallest.clone();
        double[] width = new double[objectives];
        for (int i = 0; i < objectives; i++) {
            width[i] = largest[i] - smallest[i];
        }
        long location = 0;
        for (int d = 0; d < divisions; d++) {
            for (int i = 0; i < objectives; i++) {
                double half = width[i] / 2.0;
                boolean lower = fitness.objective(i) < low[i] + half;
                if (!lower) {
                    low[i] += half;
                }
                location = location * 2 + (lower ? 1 : 0);
                width[i] = half;
            }
        }
        return location;
    }

    public int divisions() {
        return divisions;
    }

    public double smallest(int objective) {
        return smallest[objective];
    }

    public double largest(int objective) {
        return largest[objective];
    }
}
