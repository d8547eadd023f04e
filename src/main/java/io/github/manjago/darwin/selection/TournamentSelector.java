package io.github.manjago.darwin.selection;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Selector;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs {@code numSelected} tournaments of {@code tournamentSize} distinct
 * contestants and keeps each winner. A tie keeps the earlier contestant.
 */
public final class TournamentSelector<C> implements Selector<C> {

    @Override
    public List<Individual<C>> select(EvolutionRandom random, List<Individual<C>> population,
                                      EvolutionContext<C> context) {
        int numSelected = context.config().numSelectedOr(1);
        int tournamentSize = Math.min(context.config().tournamentSize(), population.size());
        List<Individual<C>> selected = new ArrayList<>(numSelected);
        if (population.isEmpty()) {
            return selected;
        }
        for (int i = 0; i < numSelected; i++) {
            List<Individual<C>> contestants = random.sample(population, tournamentSize);
            Individual<C> winner = contestants.get(0);
            for (Individual<C> contestant : contestants) {
                if (contestant.isBetterThan(winner)) {
                    winner = contestant;
                }
            }
            selected.add(winner);
        }
        return selected;
    }
}
