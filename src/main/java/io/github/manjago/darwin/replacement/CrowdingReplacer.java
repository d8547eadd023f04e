package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleBiFunction;

/**
 * De Jong crowding: each offspring is compared with the closest of
 * {@code crowdingDistance} randomly sampled survivors and replaces it if better.
 */
public final class CrowdingReplacer<C> implements Replacer<C> {

    private final ToDoubleBiFunction<C, C> distance;

    public CrowdingReplacer(ToDoubleBiFunction<C, C> distance) {
        this.distance = Objects.requireNonNull(distance, "distance");
    }

    /**
     * Crowding replacement over real vectors with Euclidean distance.
     */
    public static CrowdingReplacer<List<Double>> euclidean() {
        return new CrowdingReplacer<>(CrowdingReplacer::euclideanDistance);
    }

    static double euclideanDistance(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Candidates differ in length: " + a.size() + " vs " + b.size());
        }
        double sum = 0;
        for (int i = 0; i < a.size(); i++) {
            double d = a.get(i) - b.get(i);
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        List<Individual<C>> survivors = new ArrayList<>(population);
        for (Individual<C> child : offspring) {
            if (survivors.isEmpty()) {
                survivors.add(child);
                continue;
            }
            int sampleSize = Math.min(context.config().crowdingDistance(), survivors.size());
            Individual<C> closest = null;
            double closestDistance = Double.POSITIVE_INFINITY;
            for (Individual<C> member : random.sample(survivors, sampleSize)) {
                double d = distance.applyAsDouble(child.candidate(), member.candidate());
                if (closest == null || d < closestDistance) {
                    closest = member;
                    closestDistance = d;
                }
            }
            if (child.isBetterThan(closest)) {
                survivors.remove(closest);
                survivors.add(child);
            }
        }
        return survivors;
    }
}
