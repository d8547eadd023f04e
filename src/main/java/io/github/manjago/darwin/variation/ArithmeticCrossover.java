package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted average of the parents with weight {@code axAlpha}; children are bounded.
 */
public final class ArithmeticCrossover extends Crossover<Double> {

    @Override
    protected List<List<Double>> cross(EvolutionRandom random, List<Double> mom, List<Double> dad,
                                       EvolutionContext<List<Double>> context) {
        requireSameLength(mom, dad);
        double alpha = context.config().axAlpha();
        List<Double> bro = new ArrayList<>(mom.size());
        List<Double> sis = new ArrayList<>(mom.size());
        for (int i = 0; i < mom.size(); i++) {
            double m = mom.get(i);
            double d = dad.get(i);
            bro.add(m * alpha + d * (1 - alpha));
            sis.add(d * alpha + m * (1 - alpha));
        }
        var bounder = context.engine().bounder();
        return List.of(bounder.bound(bro, context), bounder.bound(sis, context));
    }
}
