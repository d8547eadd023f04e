package io.github.manjago.darwin.emo;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * NSGA-II survivor selection over population and offspring together.
 *
 * Whole fronts are admitted while they fit. The front that overflows is cut by
 * descending crowding distance, ties kept in front order; exact duplicates of
 * admitted survivors come last. The result has the current population size, or
 * the whole pool when it is smaller.
 */
public final class NsgaReplacer<C> implements Replacer<C> {

    private static final Logger log = LoggerFactory.getLogger(NsgaReplacer.class);

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        int target = population.size();
        List<Individual<C>> pool = new ArrayList<>(population);
        pool.addAll(offspring);
        return survivors(pool, target);
    }

    /**
     * Best {@code target} members of {@code pool} by front rank and crowding.
     */
    public static <T> List<Individual<T>> survivors(List<Individual<T>> pool, int target) {
        List<List<Individual<T>>> fronts = NonDominatedSorting.fronts(pool);
        log.debug("Pool of {} split into {} fronts", pool.size(), fronts.size());

        List<Individual<T>> survivors = new ArrayList<>(Math.min(target, pool.size()));
        for (List<Individual<T>> front : fronts) {
            if (survivors.size() >= target) {
                break;
            }
            if (survivors.size() + front.size() <= target) {
                survivors.addAll(front);
                continue;
            }

            double[] distance = NonDominatedSorting.crowdingDistances(front);
            List<Integer> order = new ArrayList<>(front.size());
            for (int i = 0; i < front.size(); i++) {
                order.add(i);
            }
            order.sort(Comparator.comparingDouble((Integer i) -> distance[i]).reversed());

            List<Individual<T>> duplicates = new ArrayList<>();
            for (int i : order) {
                if (survivors.size() >= target) {
                    break;
                }
                Individual<T> member = front.get(i);
                if (survivors.contains(member)) {
                    duplicates.add(member);
                } else {
                    survivors.add(member);
                }
            }
            for (Individual<T> duplicate : duplicates) {
                if (survivors.size() >= target) {
                    break;
                }
                survivors.add(duplicate);
            }
        }
        return survivors;
    }
}
