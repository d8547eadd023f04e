package io.github.manjago.darwin.emo;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.Archiver;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.RunScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PAES archive of non-dominated individuals, bounded by {@code maxArchiveSize}
 * (default: population size).
 *
 * <p>A candidate dominated by or fitness-equal to a member is discarded. A
 * candidate dominating members replaces all of them. Otherwise it joins while
 * there is room; once full it evicts the member in the most crowded grid cell,
 * provided that cell is strictly more crowded than the candidate's own.
 *
 * <p>Grid bounds and cell occupancy are per-run state, cleared by {@link #reset()}.
 */
public final class AdaptiveGridArchiver<C> implements Archiver<C>, RunScoped {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveGridArchiver.class);

    private AdaptiveGrid grid;
    private final Map<Long, Integer> occupancy = new HashMap<>();

    @Override
    public void reset() {
        grid = null;
        occupancy.clear();
    }

    @Override
    public List<Individual<C>> archive(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> archive, EvolutionContext<C> context) {
        int maxSize = context.config().maxArchiveSizeOr(context.engine().populationSize());
        int divisions = context.config().numGridDivisions();
        List<Individual<C>> updated = new ArrayList<>(archive);
        for (Individual<C> individual : population) {
            insert(individual, updated, maxSize, divisions);
        }
        return updated;
    }

    /**
     * Offer {@code candidate} to {@code archive}, modifying it in place.
     *
     * @return true if the candidate was added
     */
    public boolean insert(Individual<C> candidate, List<Individual<C>> archive, int maxSize, int divisions) {
        Fitness fitness = candidate.requireFitness();
        refresh(archive, List.of(candidate), divisions);

        for (Individual<C> member : archive) {
            if (candidate.isWorseThan(member) || fitness.equals(member.requireFitness())) {
                return false;
            }
        }

        boolean dominatesMembers = archive.removeIf(member -> member.isWorseThan(candidate));
        if (dominatesMembers || archive.size() < maxSize) {
            archive.add(candidate);
            return true;
        }

        long location = grid.location(fitness);
        if (location == AdaptiveGrid.OUT_OF_RANGE) {
            log.debug("Rejecting {}: outside the grid bounds", fitness);
            return false;
        }

        int crowdedIndex = -1;
        int crowdedCount = -1;
        for (int i = 0; i < archive.size(); i++) {
            long memberLocation = grid.location(archive.get(i).requireFitness());
            if (memberLocation == AdaptiveGrid.OUT_OF_RANGE) {
                continue;
            }
            int count = occupancy.getOrDefault(memberLocation, 0);
            if (count > crowdedCount) {
                crowdedCount = count;
                crowdedIndex = i;
            }
        }
        if (crowdedIndex >= 0 && crowdedCount > occupancy.getOrDefault(location, 0)) {
            Individual<C> evicted = archive.set(crowdedIndex, candidate);
            log.debug("Evicted {} from a cell of {} to admit {}", evicted.fitness(), crowdedCount, fitness);
            return true;
        }
        return false;
    }

    /**
     * Occupancy of the cells of {@code individuals}, counted over the archive
     * members, with grid bounds taken over the archive and the individuals together.
     */
    public int[] cellOccupancy(List<Individual<C>> archive, List<Individual<C>> individuals, int divisions) {
        int[] counts = new int[individuals.size()];
        if (counts.length == 0) {
            return counts;
        }
        ensureGrid(divisions);
        grid.update(fitnessOf(archive, individuals));
        recount(archive, List.of());

        for (int i = 0; i < counts.length; i++) {
            long location = grid.location(individuals.get(i).requireFitness());
            counts[i] = location == AdaptiveGrid.OUT_OF_RANGE ? Integer.MAX_VALUE : occupancy.getOrDefault(location, 0);
        }
        return counts;
    }

    /**
     * Current cell occupancy, keyed by grid location.
     */
    public Map<Long, Integer> occupancy() {
        return Map.copyOf(occupancy);
    }

    private void refresh(List<Individual<C>> archive, List<Individual<C>> extra, int divisions) {
        ensureGrid(divisions);
        List<Fitness> values = fitnessOf(archive, extra);
        if (values.isEmpty()) {
            occupancy.clear();
            return;
        }
        grid.update(values);
        recount(archive, extra);
    }

    private void ensureGrid(int divisions) {
        if (grid == null || grid.divisions() != divisions) {
            grid = new AdaptiveGrid(divisions);
        }
    }

    private List<Fitness> fitnessOf(List<Individual<C>> first, List<Individual<C>> second) {
        List<Fitness> values = new ArrayList<>(first.size() + second.size());
        for (Individual<C> individual : first) {
            values.add(individual.requireFitness());
        }
        for (Individual<C> individual : second) {
            values.add(individual.requireFitness());
        }
        return values;
    }

    private void recount(List<Individual<C>> archive, List<Individual<C>> extra) {
        occupancy.clear();
        for (Individual<C> member : archive) {
            count(member.requireFitness());
        }
        for (Individual<C> individual : extra) {
            count(individual.requireFitness());
        }
    }

    private void count(Fitness fitness) {
        long location = grid.location(fitness);
        if (location != AdaptiveGrid.OUT_OF_RANGE) {
            occupancy.merge(location, 1, Integer::sum);
        }
    }
}
