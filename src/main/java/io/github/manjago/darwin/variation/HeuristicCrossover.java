package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves from the worse parent toward the better one: each child allele is
 * {@code worse + r * (better - worse)} for a fresh uniform {@code r}.
 *
 * Parents are looked up in the current population to learn which one is
 * better, so candidates need value equality.
 */
public final class HeuristicCrossover extends Crossover<Double> {

    @Override
    protected List<List<Double>> cross(EvolutionRandom random, List<Double> mom, List<Double> dad,
                                       EvolutionContext<List<Double>> context) {
        requireSameLength(mom, dad);
        List<Individual<List<Double>>> population = context.engine().population();
        Individual<List<Double>> momIndividual = lookup(population, mom);
        Individual<List<Double>> dadIndividual = lookup(population, dad);
        boolean momIsBetter = momIndividual.isBetterThan(dadIndividual);

        List<Double> bro = new ArrayList<>(mom.size());
        List<Double> sis = new ArrayList<>(mom.size());
        for (int i = 0; i < mom.size(); i++) {
            double m = mom.get(i);
            double d = dad.get(i);
            double base = momIsBetter ? d : m;
            double step = momIsBetter ? m - d : d - m;
            bro.add(base + random.nextDouble() * step);
            sis.add(base + random.nextDouble() * step);
        }
        var bounder = context.engine().bounder();
        return List.of(bounder.bound(bro, context), bounder.bound(sis, context));
    }

    private static Individual<List<Double>> lookup(List<Individual<List<Double>>> population, List<Double> candidate) {
        for (Individual<List<Double>> individual : population) {
            if (individual.candidate().equals(candidate)) {
                return individual;
            }
        }
        throw new IllegalArgumentException("Parent is not in the current population: " + candidate);
    }
}
