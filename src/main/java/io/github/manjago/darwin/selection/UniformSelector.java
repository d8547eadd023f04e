package io.github.manjago.darwin.selection;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Selector;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects {@code numSelected} individuals uniformly at random, with replacement.
 */
public final class UniformSelector<C> implements Selector<C> {

    @Override
    public List<Individual<C>> select(EvolutionRandom random, List<Individual<C>> population,
                                      EvolutionContext<C> context) {
        int numSelected = context.config().numSelectedOr(1);
        List<Individual<C>> selected = new ArrayList<>(numSelected);
        if (population.isEmpty()) {
            return selected;
        }
        for (int i = 0; i < numSelected; i++) {
            selected.add(random.choice(population));
        }
        return selected;
    }
}
