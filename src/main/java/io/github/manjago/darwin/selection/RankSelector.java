package io.github.manjago.darwin.selection;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Selector;

import java.util.ArrayList;
import java.util.List;

/**
 * Roulette-wheel selection on linear rank: the worst individual has weight 1,
 * the best has weight N.
 */
public final class RankSelector<C> implements Selector<C> {

    @Override
    public List<Individual<C>> select(EvolutionRandom random, List<Individual<C>> population,
                                      EvolutionContext<C> context) {
        int numSelected = context.config().numSelectedOr(1);
        List<Individual<C>> selected = new ArrayList<>(numSelected);
        if (population.isEmpty()) {
            return selected;
        }

        List<Individual<C>> pool = new ArrayList<>(population);
        pool.sort(null);

        int n = pool.size();
        double total = n * (n + 1) / 2.0;
        double[] cumulative = new double[n];
        double running = 0;
        for (int i = 0; i < n; i++) {
            running += i + 1;
            cumulative[i] = running / total;
        }

        for (int i = 0; i < numSelected; i++) {
            selected.add(pool.get(RouletteWheel.spin(random, cumulative)));
        }
        return selected;
    }
}
