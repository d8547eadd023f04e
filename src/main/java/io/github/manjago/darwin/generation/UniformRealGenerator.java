package io.github.manjago.darwin.generation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.RangeBounder;
import io.github.manjago.darwin.core.RealBounder;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Real vectors drawn uniformly from the ranges of a {@link RangeBounder}.
 */
public final class UniformRealGenerator implements Generator<List<Double>> {

    private final int dimensions;
    private final RangeBounder ranges;

    public UniformRealGenerator(int dimensions, double lower, double upper) {
        this(dimensions, new RealBounder(lower, upper));
    }

    public UniformRealGenerator(int dimensions, RangeBounder ranges) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("At least one dimension is required, got " + dimensions);
        }
        this.dimensions = dimensions;
        this.ranges = Objects.requireNonNull(ranges, "ranges");
    }

    @Override
    public List<Double> generate(EvolutionRandom random, EvolutionContext<?> context) {
        List<Double> candidate = new ArrayList<>(dimensions);
        for (int i = 0; i < dimensions; i++) {
            candidate.add(random.nextDouble(ranges.lowerBound(i), ranges.upperBound(i)));
        }
        return candidate;
    }
}
