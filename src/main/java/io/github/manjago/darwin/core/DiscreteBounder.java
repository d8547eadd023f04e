package io.github.manjago.darwin.core;

import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Snaps each allele to the nearest legal value. On a tie the value listed
 * first wins.
 */
public final class DiscreteBounder implements RangeBounder {

    private final List<Double> values;
    private final double lowest;
    private final double highest;

    public DiscreteBounder(Collection<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("At least one legal value is required");
        }
        this.values = List.copyOf(values);
        this.lowest = this.values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        this.highest = this.values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
    }

    @Override
    public double lowerBound(int index) {
        return lowest;
    }

    @Override
    public double upperBound(int index) {
        return highest;
    }

    @Override
    public List<Double> bound(List<Double> candidate, EvolutionContext<?> context) {
        List<Double> bounded = new ArrayList<>(candidate.size());
        for (double c : candidate) {
            double nearest = values.get(0);
            for (double v : values) {
                if (Math.abs(v - c) < Math.abs(nearest - c)) {
                    nearest = v;
                }
            }
            bounded.add(nearest);
        }
        return bounded;
    }
}
