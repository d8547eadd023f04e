package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * BLX-alpha: each child allele is drawn uniformly from the parents' interval
 * widened by {@code blxAlpha} of its length on both sides.
 */
public final class BlendCrossover extends Crossover<Double> {

    @Override
    protected List<List<Double>> cross(EvolutionRandom random, List<Double> mom, List<Double> dad,
                                       EvolutionContext<List<Double>> context) {
        requireSameLength(mom, dad);
        double alpha = context.config().blxAlpha();
        List<Double> bro = new ArrayList<>(mom.size());
        List<Double> sis = new ArrayList<>(mom.size());
        for (int i = 0; i < mom.size(); i++) {
            double smallest = Math.min(mom.get(i), dad.get(i));
            double largest = Math.max(mom.get(i), dad.get(i));
            double delta = alpha * (largest - smallest);
            bro.add(random.nextDouble(smallest - delta, largest + delta));
            sis.add(random.nextDouble(smallest - delta, largest + delta));
        }
        var bounder = context.engine().bounder();
        return List.of(bounder.bound(bro, context), bounder.bound(sis, context));
    }
}
