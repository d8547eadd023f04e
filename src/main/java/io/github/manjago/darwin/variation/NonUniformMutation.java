package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.Bounder;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.RangeBounder;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.List;

/**
 * Michalewicz non-uniform mutation: each allele moves toward one of its bounds
 * by a step that shrinks as the run approaches {@code maxGenerations}.
 *
 * Needs a {@link RangeBounder} and a positive {@code maxGenerations}.
 */
public final class NonUniformMutation extends Mutation<Double> {

    @Override
    protected List<Double> mutate(EvolutionRandom random, List<Double> mutant,
                                  EvolutionContext<List<Double>> context) {
        Bounder<List<Double>> bounder = context.engine().bounder();
        if (!(bounder instanceof RangeBounder range)) {
            throw new IllegalStateException("Non-uniform mutation needs a bounder with known ranges");
        }
        int maxGenerations = context.config().maxGenerations();
        if (maxGenerations <= 0) {
            throw new IllegalStateException("Non-uniform mutation needs maxGenerations to be set");
        }
        double progress = Math.min(1.0, context.engine().numGenerations() / (double) maxGenerations);
        double exponent = Math.pow(1.0 - progress, context.config().mutationStrength());

        for (int i = 0; i < mutant.size(); i++) {
            double c = mutant.get(i);
            double shrink = 1.0 - Math.pow(random.nextDouble(), exponent);
            double value = random.nextBoolean()
                    ? c + (range.upperBound(i) - c) * shrink
                    : c - (c - range.lowerBound(i)) * shrink;
            mutant.set(i, value);
        }
        return range.bound(mutant, context);
    }
}
