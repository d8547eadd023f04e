package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.List;

/**
 * Adds N({@code gaussianMean}, {@code gaussianStdev}) noise to each allele with
 * probability {@code mutationRate}, then bounds the mutant.
 */
public final class GaussianMutation extends Mutation<Double> {

    @Override
    protected List<Double> mutate(EvolutionRandom random, List<Double> mutant,
                                  EvolutionContext<List<Double>> context) {
        var config = context.config();
        for (int i = 0; i < mutant.size(); i++) {
            if (random.nextBoolean(config.mutationRate())) {
                mutant.set(i, mutant.get(i) + random.nextGaussian(config.gaussianMean(), config.gaussianStdev()));
            }
        }
        return context.engine().bounder().bound(mutant, context);
    }
}
