package io.github.manjago.darwin.emo;

import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Pareto front extraction and crowding distance.
 *
 * Dominance follows the individuals' own ordering, so it respects {@code maximize}.
 */
public final class NonDominatedSorting {

    private NonDominatedSorting() {
    }

    /**
     * Partition {@code pool} into fronts. Front 0 holds the members no other member
     * dominates, front 1 those left non-dominated once front 0 is removed, and so on.
     * Members keep their pool order within a front.
     */
    public static <C> List<List<Individual<C>>> fronts(List<Individual<C>> pool) {
        List<List<Individual<C>>> fronts = new ArrayList<>();
        List<Individual<C>> remaining = new ArrayList<>(pool);
        while (!remaining.isEmpty()) {
            List<Individual<C>> front = new ArrayList<>();
            List<Individual<C>> rest = new ArrayList<>();
            for (Individual<C> candidate : remaining) {
                boolean dominated = false;
                for (Individual<C> other : remaining) {
                    if (other != candidate && candidate.isWorseThan(other)) {
                        dominated = true;
                        break;
                    }
                }
                (dominated ? rest : front).add(candidate);
            }
            fronts.add(front);
            remaining = rest;
        }
        return fronts;
    }

    /**
     * Crowding distance of every member of {@code front}, index-aligned with it.
     *
     * For each objective the members with the smallest and largest value get
     * infinite distance; interior members add the gap between their neighbours
     * divided by the objective's range. An objective with zero range adds nothing.
     */
    public static double[] crowdingDistances(List<? extends Individual<?>> front) {
        int n = front.size();
        double[] distance = new double[n];
        if (n == 0) {
            return distance;
        }
        if (n <= 2) {
            Arrays.fill(distance, Double.POSITIVE_INFINITY);
            return distance;
        }

        Fitness[] fitness = new Fitness[n];
        for (int i = 0; i < n; i++) {
            fitness[i] = front.get(i).requireFitness();
        }
        int objectives = fitness[0].objectives();

        for (int m = 0; m < objectives; m++) {
            final int objective = m;
            Integer[] order = new Integer[n];
            for (int i = 0; i < n; i++) {
                order[i] = i;
            }
            Arrays.sort(order, Comparator.comparingDouble(i -> fitness[i].objective(objective)));

            double min = fitness[order[0]].objective(objective);
            double max = fitness[order[n - 1]].objective(objective);
            distance[order[0]] = Double.POSITIVE_INFINITY;
            distance[order[n - 1]] = Double.POSITIVE_INFINITY;

            double range = max - min;
            if (range == 0) {
                continue;
            }
            for (int k = 1; k < n - 1; k++) {
                double gap = fitness[order[k + 1]].objective(objective) - fitness[order[k - 1]].objective(objective);
                distance[order[k]] += gap / range;
            }
        }
        return distance;
    }
}
