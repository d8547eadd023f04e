package io.github.manjago.darwin.archive;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.Archiver;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every individual no other archived individual beats. With scalar
 * fitness that is the set of best individuals seen, with Pareto fitness the
 * non-dominated front. A candidate already in the archive is not added twice.
 */
public final class BestArchiver<C> implements Archiver<C> {

    @Override
    public List<Individual<C>> archive(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> archive, EvolutionContext<C> context) {
        List<Individual<C>> updated = new ArrayList<>(archive);
        for (Individual<C> individual : population) {
            if (updated.isEmpty()) {
                updated.add(individual);
                continue;
            }
            boolean add = true;
            List<Individual<C>> beaten = new ArrayList<>();
            for (Individual<C> member : updated) {
                if (individual.candidate().equals(member.candidate())) {
                    add = false;
                    break;
                } else if (individual.isWorseThan(member)) {
                    add = false;
                } else if (member.isWorseThan(individual)) {
                    beaten.add(member);
                }
            }
            updated.removeAll(beaten);
            if (add) {
                updated.add(individual);
            }
        }
        return updated;
    }
}
