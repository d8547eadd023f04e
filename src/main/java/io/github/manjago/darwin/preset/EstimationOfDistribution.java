package io.github.manjago.darwin.preset;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.engine.Variator;
import io.github.manjago.darwin.replacement.GenerationalReplacer;
import io.github.manjago.darwin.selection.TruncationSelector;

import java.util.ArrayList;
import java.util.List;

/**
 * Gaussian estimation of distribution algorithm: the best half of the
 * population is fitted with one normal distribution per allele and
 * {@code numOffspring} (default: population size) new vectors are sampled from it.
 */
public class EstimationOfDistribution extends EvolutionEngine<List<Double>> {

    public EstimationOfDistribution(EvolutionRandom random) {
        super(random);
        setSelector(new TruncationSelector<>());
        setVariator(new DistributionSampler());
        setReplacer(new GenerationalReplacer<>());
    }

    @Override
    protected EvolutionConfig applyDefaults(EvolutionConfig config, int popSize) {
        EvolutionConfig.Builder builder = config.toBuilder();
        if (config.numSelected() == 0) {
            builder.numSelected(Math.max(1, popSize / 2));
        }
        if (config.numOffspring() == 0) {
            builder.numOffspring(popSize);
        }
        return builder.build();
    }

    /**
     * Samples offspring from per-allele normal distributions fitted to the parents.
     * Fewer than two parents give a zero standard deviation.
     */
    public static final class DistributionSampler implements Variator<List<Double>> {

        @Override
        public List<List<Double>> vary(EvolutionRandom random, List<List<Double>> candidates,
                                       EvolutionContext<List<Double>> context) {
            List<List<Double>> offspring = new ArrayList<>();
            if (candidates.isEmpty()) {
                return offspring;
            }
            int genes = candidates.get(0).size();
            int samples = candidates.size();
            double[] mean = new double[genes];
            double[] stdev = new double[genes];
            for (int i = 0; i < genes; i++) {
                double sum = 0;
                for (List<Double> candidate : candidates) {
                    sum += candidate.get(i);
                }
                mean[i] = sum / samples;
                if (samples > 1) {
                    double squares = 0;
                    for (List<Double> candidate : candidates) {
                        double d = candidate.get(i) - mean[i];
                        squares += d * d;
                    }
                    stdev[i] = Math.sqrt(squares / (samples - 1));
                }
            }

            int count = context.config().numOffspringOr(context.engine().populationSize());
            for (int k = 0; k < count; k++) {
                List<Double> child = new ArrayList<>(genes);
                for (int i = 0; i < genes; i++) {
                    child.add(random.nextGaussian(mean[i], stdev[i]));
                }
                offspring.add(context.engine().bounder().bound(child, context));
            }
            return offspring;
        }
    }
}
