package io.github.manjago.darwin.analysis;

import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.ScalarFitness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary of the scalar fitness values of a population.
 * Best and worst follow the population's polarity; std is the sample standard deviation.
 */
public record FitnessStatistics(double best, double worst, double mean, double median, double std) {

    /**
     * Statistics of a non-empty population with scalar fitness.
     *
     * @throws IllegalArgumentException if the population is empty or carries non-scalar fitness
     */
    public static FitnessStatistics of(List<? extends Individual<?>> population) {
        if (population.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute statistics of an empty population");
        }
        List<Double> values = new ArrayList<>(population.size());
        for (Individual<?> individual : population) {
            if (!(individual.requireFitness() instanceof ScalarFitness scalar)) {
                throw new IllegalArgumentException("Statistics need scalar fitness, got " + individual.fitness());
            }
            values.add(scalar.value());
        }
        Collections.sort(values);

        int n = values.size();
        double min = values.get(0);
        double max = values.get(n - 1);
        boolean maximize = population.get(0).maximize();

        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        double median = n % 2 == 1
                ? values.get(n / 2)
                : (values.get(n / 2 - 1) + values.get(n / 2)) / 2.0;

        double std = 0;
        if (n > 1) {
            double squares = 0;
            for (double v : values) {
                squares += (v - mean) * (v - mean);
            }
            std = Math.sqrt(squares / (n - 1));
        }

        return new FitnessStatistics(maximize ? max : min, maximize ? min : max, mean, median, std);
    }

    /**
     * True when every individual carries a scalar fitness.
     */
    public static boolean supports(List<? extends Individual<?>> population) {
        if (population.isEmpty()) {
            return false;
        }
        for (Individual<?> individual : population) {
            if (!(individual.fitness() instanceof ScalarFitness)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("best %.6g, worst %.6g, mean %.6g, median %.6g, std %.6g",
                best, worst, mean, median, std);
    }
}
