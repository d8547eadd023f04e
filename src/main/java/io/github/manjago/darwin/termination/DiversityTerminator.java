package io.github.manjago.darwin.termination;

import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Terminator;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleBiFunction;

/**
 * Stops when the largest distance between any two candidates drops below
 * {@code minDiversity}.
 */
public final class DiversityTerminator<C> implements Terminator<C> {

    private final ToDoubleBiFunction<C, C> distance;

    public DiversityTerminator(ToDoubleBiFunction<C, C> distance) {
        this.distance = Objects.requireNonNull(distance, "distance");
    }

    /**
     * Diversity over real vectors with Euclidean distance.
     */
    public static DiversityTerminator<List<Double>> euclidean() {
        return new DiversityTerminator<>((a, b) -> {
            double sum = 0;
            for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
                double d = a.get(i) - b.get(i);
                sum += d * d;
            }
            return Math.sqrt(sum);
        });
    }

    @Override
    public boolean shouldTerminate(List<Individual<C>> population, EvolutionContext<C> context) {
        double widest = 0;
        for (int i = 0; i < population.size(); i++) {
            for (int j = i + 1; j < population.size(); j++) {
                widest = Math.max(widest,
                        distance.applyAsDouble(population.get(i).candidate(), population.get(j).candidate()));
            }
        }
        return widest < context.config().minDiversity();
    }
}
