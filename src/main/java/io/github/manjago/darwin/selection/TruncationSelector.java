package io.github.manjago.darwin.selection;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Selects the best {@code numSelected} individuals (default: all of them).
 */
public final class TruncationSelector<C> implements Selector<C> {

    @Override
    public List<Individual<C>> select(EvolutionRandom random, List<Individual<C>> population,
                                      EvolutionContext<C> context) {
        int numSelected = context.config().numSelectedOr(population.size());
        List<Individual<C>> sorted = new ArrayList<>(population);
        sorted.sort(Collections.reverseOrder());
        return new ArrayList<>(sorted.subList(0, Math.min(numSelected, sorted.size())));
    }
}
