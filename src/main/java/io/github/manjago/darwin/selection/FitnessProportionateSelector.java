package io.github.manjago.darwin.selection;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.ScalarFitness;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Roulette-wheel selection with probability proportional to fitness.
 *
 * Only defined for maximization with fitness values of a single sign.
 * All-zero fitness degrades to uniform selection.
 */
public final class FitnessProportionateSelector<C> implements Selector<C> {

    @Override
    public List<Individual<C>> select(EvolutionRandom random, List<Individual<C>> population,
                                      EvolutionContext<C> context) {
        int numSelected = context.config().numSelectedOr(1);
        List<Individual<C>> selected = new ArrayList<>(numSelected);
        if (population.isEmpty()) {
            return selected;
        }
        if (!context.engine().maximize()) {
            throw new IllegalArgumentException("Fitness-proportionate selection requires maximization");
        }

        List<Individual<C>> pool = new ArrayList<>(population);
        pool.sort(Collections.reverseOrder());

        double[] values = new double[pool.size()];
        boolean anyPositive = false;
        boolean anyNegative = false;
        for (int i = 0; i < pool.size(); i++) {
            if (!(pool.get(i).requireFitness() instanceof ScalarFitness scalar)) {
                throw new IllegalArgumentException("Fitness-proportionate selection requires scalar fitness");
            }
            values[i] = scalar.value();
            anyPositive |= values[i] > 0;
            anyNegative |= values[i] < 0;
        }
        if (anyPositive && anyNegative) {
            throw new IllegalArgumentException("Fitness-proportionate selection requires fitness values of one sign");
        }

        double total = 0;
        for (double v : values) {
            total += v;
        }
        double[] cumulative = new double[values.length];
        if (total == 0) {
            for (int i = 0; i < values.length; i++) {
                cumulative[i] = (i + 1) / (double) values.length;
            }
        } else {
            double running = 0;
            for (int i = 0; i < values.length; i++) {
                running += values[i];
                cumulative[i] = running / total;
            }
        }

        for (int i = 0; i < numSelected; i++) {
            selected.add(pool.get(RouletteWheel.spin(random, cumulative)));
        }
        return selected;
    }
}
