package io.github.manjago.darwin.emo;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.Pareto;
import io.github.manjago.darwin.engine.StubEngineView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NonDominatedSortingTest {

    private static Individual<String> ind(String name, double... values) {
        return new Individual<>(name, new Pareto(values), true);
    }

    private static Set<String> names(List<Individual<String>> individuals) {
        return individuals.stream().map(Individual::candidate).collect(Collectors.toSet());
    }

    /**
     * Totally ordered pool: member i dominates every member below it.
     */
    private static List<Individual<String>> chain(int size) {
        List<Individual<String>> pool = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            pool.add(ind("c" + i, i, i));
        }
        return pool;
    }

    @Nested
    @DisplayName("Fronts")
    class Fronts {

        @Test
        @DisplayName("A chain splits into singleton fronts, best first")
        void chainFronts() {
            List<List<Individual<String>>> fronts = NonDominatedSorting.fronts(chain(6));

            assertEquals(6, fronts.size());
            for (int k = 0; k < 6; k++) {
                assertEquals(1, fronts.get(k).size());
                assertEquals("c" + (5 - k), fronts.get(k).get(0).candidate());
            }
        }

        @Test
        @DisplayName("Trade-offs share the first front")
        void tradeOffs() {
            List<List<Individual<String>>> fronts = NonDominatedSorting.fronts(List.of(
                    ind("a", 1, 5), ind("b", 5, 1), ind("c", 3, 3), ind("d", 2, 2), ind("e", 0, 0)));

            assertEquals(3, fronts.size());
            assertEquals(Set.of("a", "b", "c"), names(fronts.get(0)));
            assertEquals(Set.of("d"), names(fronts.get(1)));
            assertEquals(Set.of("e"), names(fronts.get(2)));
        }

        @Test
        @DisplayName("Minimization flips the fronts")
        void minimization() {
            List<Individual<String>> pool = List.of(
                    new Individual<>("low", new Pareto(1, 1), false),
                    new Individual<>("high", new Pareto(2, 2), false));

            assertEquals("low", NonDominatedSorting.fronts(pool).get(0).get(0).candidate());
        }
    }

    @Nested
    @DisplayName("Crowding distance")
    class Crowding {

        @Test
        @DisplayName("Fronts of two or fewer are all boundary points")
        void small() {
            double[] d = NonDominatedSorting.crowdingDistances(List.of(ind("a", 1, 2), ind("b", 2, 1)));
            assertEquals(Double.POSITIVE_INFINITY, d[0]);
            assertEquals(Double.POSITIVE_INFINITY, d[1]);
            assertEquals(0, NonDominatedSorting.crowdingDistances(List.of()).length);
        }

        @Test
        @DisplayName("Interior points sum normalized neighbour gaps")
        void interior() {
            double[] d = NonDominatedSorting.crowdingDistances(List.of(
                    ind("a", 0, 3), ind("b", 1, 2), ind("c", 2, 1), ind("d", 3, 0)));

            assertEquals(Double.POSITIVE_INFINITY, d[0]);
            assertEquals(4.0 / 3.0, d[1], 1e-12);
            assertEquals(4.0 / 3.0, d[2], 1e-12);
            assertEquals(Double.POSITIVE_INFINITY, d[3]);
        }

        @ParameterizedTest(name = "shuffle seed {0}")
        @ValueSource(longs = {1, 2, 3, 4, 5, 6, 7, 8})
        @DisplayName("Boundary points are infinite whatever the input order")
        void boundariesInAnyOrder(long seed) {
            List<Individual<String>> front = new ArrayList<>(List.of(
                    ind("a", 0, 4), ind("b", 1, 3), ind("c", 2, 2), ind("d", 3, 1), ind("e", 4, 0)));
            new EvolutionRandom(seed).shuffle(front);

            double[] d = NonDominatedSorting.crowdingDistances(front);

            for (int i = 0; i < front.size(); i++) {
                String name = front.get(i).candidate();
                if (name.equals("a") || name.equals("e")) {
                    assertEquals(Double.POSITIVE_INFINITY, d[i], name + " in " + front);
                } else {
                    assertEquals(1.0, d[i], 1e-12, name + " in " + front);
                }
            }
        }

        @Test
        @DisplayName("An objective with zero range adds nothing")
        void zeroRange() {
            double[] d = NonDominatedSorting.crowdingDistances(List.of(
                    ind("a", 0, 5), ind("b", 1, 5), ind("c", 2, 5)));

            assertEquals(1.0, d[1], 1e-12);
        }
    }

    @Nested
    @DisplayName("NSGA-II survivors")
    class Survivors {

        @Test
        @DisplayName("From a chain of 2N the best N survive")
        void chainHalf() {
            List<Individual<String>> survivors = NsgaReplacer.survivors(chain(10), 5);

            assertEquals(Set.of("c5", "c6", "c7", "c8", "c9"), names(survivors));
        }

        @Test
        @DisplayName("The overflowing front is cut by crowding distance")
        void crowdingCut() {
            List<Individual<String>> population = List.of(ind("a", 0, 3), ind("b", 1, 2), ind("c", 2, 1));
            List<Individual<String>> offspring = List.of(ind("d", 3, 0));

            List<Individual<String>> survivors = new NsgaReplacer<String>().replace(new EvolutionRandom(1),
                    population, population, offspring, StubEngineView.context(EvolutionConfig.builder().build()));

            assertEquals(List.of("a", "d", "b"), survivors.stream().map(Individual::candidate).toList());
        }

        @Test
        @DisplayName("Duplicates of admitted members come last")
        void duplicatesDeferred() {
            List<Individual<String>> pool = List.of(ind("a", 0, 3), ind("a", 0, 3), ind("b", 1, 2), ind("d", 3, 0));

            List<Individual<String>> survivors = NsgaReplacer.survivors(pool, 3);

            assertEquals(Set.of("a", "b", "d"), names(survivors));
            assertEquals(3, survivors.size());
        }

        @Test
        @DisplayName("A pool smaller than the target is kept whole")
        void smallPool() {
            assertEquals(3, NsgaReplacer.survivors(chain(3), 10).size());
        }
    }
}
