package io.github.manjago.darwin.analysis;

import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Volume of objective space dominated by a set of points and bounded by a
 * reference point. All objectives are treated as minimized.
 *
 * Computed by slicing along the last objective and recursing on the rest,
 * which is exact and fine for the front sizes an archive holds.
 */
public final class Hypervolume {

    private Hypervolume() {
    }

    /**
     * Hypervolume of the archive's fitness values against the per-objective maximum.
     */
    public static double of(List<? extends Individual<?>> archive) {
        List<double[]> points = new ArrayList<>(archive.size());
        for (Individual<?> individual : archive) {
            points.add(toPoint(individual.requireFitness()));
        }
        return compute(points, null);
    }

    /**
     * Hypervolume of {@code points} against {@code reference}.
     * A null reference means the per-objective maximum of the points.
     */
    public static double compute(List<double[]> points, double[] reference) {
        if (points.isEmpty()) {
            return 0.0;
        }
        int dims = points.get(0).length;
        for (double[] p : points) {
            if (p.length != dims) {
                throw new IllegalArgumentException("Points differ in dimension: " + p.length + " vs " + dims);
            }
        }
        double[] ref = reference;
        if (ref == null) {
            ref = new double[dims];
            for (int d = 0; d < dims; d++) {
                double max = Double.NEGATIVE_INFINITY;
                for (double[] p : points) {
                    max = Math.max(max, p[d]);
                }
                ref[d] = max;
            }
        } else if (ref.length != dims) {
            throw new IllegalArgumentException("Reference has " + ref.length + " objectives, points have " + dims);
        }
        return slice(points, ref, dims);
    }

    private static double slice(List<double[]> points, double[] ref, int dims) {
        List<double[]> inside = new ArrayList<>();
        for (double[] p : points) {
            boolean below = true;
            for (int d = 0; d < dims; d++) {
                if (p[d] >= ref[d]) {
                    below = false;
                    break;
                }
            }
            if (below) {
                inside.add(p);
            }
        }
        if (inside.isEmpty()) {
            return 0.0;
        }
        int last = dims - 1;
        if (dims == 1) {
            double min = Double.POSITIVE_INFINITY;
            for (double[] p : inside) {
                min = Math.min(min, p[0]);
            }
            return ref[0] - min;
        }

        inside.sort(Comparator.comparingDouble(p -> p[last]));
        double volume = 0.0;
        for (int i = 0; i < inside.size(); i++) {
            double upper = i + 1 < inside.size() ? inside.get(i + 1)[last] : ref[last];
            double height = upper - inside.get(i)[last];
            if (height > 0) {
                volume += height * slice(inside.subList(0, i + 1), ref, last);
            }
        }
        return volume;
    }

    private static double[] toPoint(Fitness fitness) {
        double[] point = new double[fitness.objectives()];
        for (int i = 0; i < point.length; i++) {
            point[i] = fitness.objective(i);
        }
        return point;
    }
}
