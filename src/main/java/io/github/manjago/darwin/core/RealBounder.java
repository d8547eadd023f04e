package io.github.manjago.darwin.core;

import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Clamps each allele into [lower, upper]. Bounds are either shared by all
 * alleles or given per allele.
 */
public final class RealBounder implements RangeBounder {

    private final List<Double> lower;
    private final List<Double> upper;
    private final double sharedLower;
    private final double sharedUpper;

    public RealBounder(double lower, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException("Lower bound " + lower + " exceeds upper bound " + upper);
        }
        this.lower = null;
        this.upper = null;
        this.sharedLower = lower;
        this.sharedUpper = upper;
    }

    public RealBounder(List<Double> lower, List<Double> upper) {
        if (lower.size() != upper.size()) {
            throw new IllegalArgumentException(
                    "Got " + lower.size() + " lower bounds and " + upper.size() + " upper bounds");
        }
        for (int i = 0; i < lower.size(); i++) {
            if (lower.get(i) > upper.get(i)) {
                throw new IllegalArgumentException("Lower bound exceeds upper bound at allele " + i);
            }
        }
        this.lower = List.copyOf(lower);
        this.upper = List.copyOf(upper);
        this.sharedLower = Double.NaN;
        this.sharedUpper = Double.NaN;
    }

    @Override
    public double lowerBound(int index) {
        return lower == null ? sharedLower : lower.get(index);
    }

    @Override
    public double upperBound(int index) {
        return upper == null ? sharedUpper : upper.get(index);
    }

    @Override
    public List<Double> bound(List<Double> candidate, EvolutionContext<?> context) {
        if (lower != null && lower.size() != candidate.size()) {
            throw new IllegalArgumentException(
                    "Candidate has " + candidate.size() + " alleles but bounds cover " + lower.size());
        }
        List<Double> bounded = new ArrayList<>(candidate.size());
        for (int i = 0; i < candidate.size(); i++) {
            double value = candidate.get(i);
            bounded.add(Math.max(lowerBound(i), Math.min(upperBound(i), value)));
        }
        return bounded;
    }
}
