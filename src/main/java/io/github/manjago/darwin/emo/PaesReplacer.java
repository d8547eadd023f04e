package io.github.manjago.darwin.emo;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * (1+1) PAES acceptance for each parent/offspring pair, decided in this order:
 * <ol>
 *   <li>offspring identical to the parent: parent</li>
 *   <li>offspring fitness-equal to an archive member: offspring</li>
 *   <li>offspring dominates the parent: offspring</li>
 *   <li>parent dominates the offspring: parent</li>
 *   <li>offspring dominated by an archive member: parent</li>
 *   <li>offspring dominates an archive member: offspring</li>
 *   <li>otherwise the one in the less crowded grid cell, offspring on a tie</li>
 * </ol>
 * The archive itself is left to the engine's archiver.
 */
public final class PaesReplacer<C> implements Replacer<C> {

    private final AdaptiveGridArchiver<C> archiver;

    public PaesReplacer(AdaptiveGridArchiver<C> archiver) {
        this.archiver = Objects.requireNonNull(archiver, "archiver");
    }

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        List<Individual<C>> archive = context.engine().archive();
        int divisions = context.config().numGridDivisions();
        int pairs = Math.min(parents.size(), offspring.size());
        List<Individual<C>> survivors = new ArrayList<>(pairs);
        for (int i = 0; i < pairs; i++) {
            survivors.add(choose(parents.get(i), offspring.get(i), archive, divisions));
        }
        return survivors;
    }

    private Individual<C> choose(Individual<C> parent, Individual<C> child,
                                 List<Individual<C>> archive, int divisions) {
        if (child.equals(parent)) {
            return parent;
        }
        for (Individual<C> member : archive) {
            if (child.requireFitness().equals(member.requireFitness())) {
                return child;
            }
        }
        if (parent.isWorseThan(child)) {
            return child;
        }
        if (child.isWorseThan(parent)) {
            return parent;
        }
        boolean dominatesMember = false;
        for (Individual<C> member : archive) {
            if (child.isWorseThan(member)) {
                return parent;
            }
            if (member.isWorseThan(child)) {
                dominatesMember = true;
            }
        }
        if (dominatesMember) {
            return child;
        }
        int[] counts = archiver.cellOccupancy(archive, List.of(child, parent), divisions);
        return counts[0] <= counts[1] ? child : parent;
    }
}
