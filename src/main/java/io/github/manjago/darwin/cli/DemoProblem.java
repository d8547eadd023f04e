package io.github.manjago.darwin.cli;

import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Pareto;
import io.github.manjago.darwin.core.RealBounder;
import io.github.manjago.darwin.core.ScalarFitness;
import io.github.manjago.darwin.engine.Evaluator;
import io.github.manjago.darwin.engine.Generator;
import io.github.manjago.darwin.generation.UniformRealGenerator;

import java.util.List;

/**
 * Benchmark functions offered by {@code darwin run}. Both are minimized by
 * running the engine with {@code maximize = false}; Pareto values keep the
 * default polarity so the engine's inversion applies to every objective.
 */
public enum DemoProblem {

    /**
     * {@code 10n + sum(x^2 - 10 cos(2 pi x))} on [-5.12, 5.12]^n, optimum 0 at the origin.
     */
    RASTRIGIN(1, -5.12, 5.12) {
        @Override
        public Fitness evaluate(List<Double> x) {
            double sum = 10.0 * x.size();
            for (double xi : x) {
                sum += xi * xi - 10.0 * Math.cos(2.0 * Math.PI * xi);
            }
            return new ScalarFitness(sum);
        }
    },

    /**
     * Schaffer N.1: {@code (x^2, (x - 2)^2)} on [-10, 10], Pareto set [0, 2].
     */
    SCHAFFER(2, -10.0, 10.0) {
        @Override
        public Fitness evaluate(List<Double> x) {
            double v = x.get(0);
            return new Pareto(v * v, (v - 2.0) * (v - 2.0));
        }

        @Override
        public int dimensions(int requested) {
            return 1;
        }
    };

    private final int objectives;
    private final double lower;
    private final double upper;

    DemoProblem(int objectives, double lower, double upper) {
        this.objectives = objectives;
        this.lower = lower;
        this.upper = upper;
    }

    public abstract Fitness evaluate(List<Double> x);

    public int objectives() {
        return objectives;
    }

    public boolean isMultiObjective() {
        return objectives > 1;
    }

    public int dimensions(int requested) {
        return requested;
    }

    public RealBounder bounder() {
        return new RealBounder(lower, upper);
    }

    public Generator<List<Double>> generator(int requestedDimensions) {
        return new UniformRealGenerator(dimensions(requestedDimensions), bounder());
    }

    public Evaluator<List<Double>> evaluator() {
        return Evaluator.of(this::evaluate);
    }
}
