package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.RealBounder;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.StubEngineView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MutationTest {

    private static final List<Integer> PERMUTATION = List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);

    private EvolutionRandom random;

    @BeforeEach
    void setUp() {
        random = new EvolutionRandom(5);
    }

    private static <E> EvolutionContext<List<E>> withRate(double rate) {
        return StubEngineView.context(EvolutionConfig.builder().mutationRate(rate).build());
    }

    @Test
    @DisplayName("Default variator passes candidates through")
    void defaultVariator() {
        List<String> candidates = List.of("a", "b");
        assertEquals(candidates, new DefaultVariator<String>()
                .vary(random, candidates, StubEngineView.context(EvolutionConfig.builder().build())));
    }

    @Nested
    @DisplayName("Bit flip")
    class BitFlip {

        @Test
        @DisplayName("Rate 1 flips every bit")
        void flipsAll() {
            List<List<Integer>> mutants = new BitFlipMutation().vary(random, List.of(List.of(0, 1, 1, 0)), withRate(1.0));
            assertEquals(List.of(List.of(1, 0, 0, 1)), mutants);
        }

        @Test
        @DisplayName("Rate 0 leaves the candidate alone and does not touch the parent")
        void flipsNone() {
            List<Integer> parent = new ArrayList<>(List.of(0, 1));
            List<List<Integer>> mutants = new BitFlipMutation().vary(random, List.of(parent), withRate(0.0));

            assertEquals(List.of(0, 1), mutants.get(0));
            assertNotSame(parent, mutants.get(0));
        }
    }

    @Nested
    @DisplayName("Permutation mutations")
    class Permutations {

        @Test
        @DisplayName("Scramble keeps the elements and only disturbs one segment")
        void scramble() {
            for (int trial = 0; trial < 30; trial++) {
                List<Integer> mutant = new ScrambleMutation<Integer>()
                        .vary(random, List.of(PERMUTATION), withRate(1.0)).get(0);

                assertEquals(new HashSet<>(PERMUTATION), new HashSet<>(mutant));
            }
        }

        @Test
        @DisplayName("Inversion reverses one contiguous segment")
        void inversion() {
            for (int trial = 0; trial < 30; trial++) {
                List<Integer> mutant = new InversionMutation<Integer>()
                        .vary(random, List.of(PERMUTATION), withRate(1.0)).get(0);

                int first = 0;
                while (mutant.get(first).equals(PERMUTATION.get(first))) {
                    first++;
                }
                int last = mutant.size() - 1;
                while (mutant.get(last).equals(PERMUTATION.get(last))) {
                    last--;
                }
                for (int i = first; i <= last; i++) {
                    assertEquals(PERMUTATION.get(first + last - i), mutant.get(i));
                }
            }
        }

        @Test
        @DisplayName("Rate 0 leaves permutations unchanged")
        void rateZero() {
            assertEquals(PERMUTATION, new InversionMutation<Integer>()
                    .vary(random, List.of(PERMUTATION), withRate(0.0)).get(0));
            assertEquals(PERMUTATION, new ScrambleMutation<Integer>()
                    .vary(random, List.of(PERMUTATION), withRate(0.0)).get(0));
        }
    }

    @Nested
    @DisplayName("Random reset")
    class RandomReset {

        @Test
        @DisplayName("Every allele takes a legal value")
        void legalValues() {
            List<String> mutant = new RandomResetMutation<>(List.of("x", "y"))
                    .vary(random, List.of(List.of("a", "b", "c")), withRate(1.0)).get(0);

            assertTrue(List.of("x", "y").containsAll(mutant));
        }

        @Test
        @DisplayName("Needs legal values")
        void emptyValues() {
            assertThrows(IllegalArgumentException.class, () -> new RandomResetMutation<String>(List.of()));
        }
    }

    @Nested
    @DisplayName("Gaussian")
    class Gaussian {

        @Test
        @DisplayName("Mutants are bounded")
        void bounded() {
            EvolutionContext<List<Double>> ctx = new StubEngineView<List<Double>>()
                    .withBounder(new RealBounder(-1.0, 1.0))
                    .toContext(EvolutionConfig.builder().mutationRate(1.0).gaussianStdev(10.0).build());

            for (int trial = 0; trial < 50; trial++) {
                List<Double> mutant = new GaussianMutation().vary(random, List.of(List.of(0.0, 0.5)), ctx).get(0);
                for (double allele : mutant) {
                    assertTrue(allele >= -1.0 && allele <= 1.0);
                }
            }
        }

        @Test
        @DisplayName("Rate 1 moves every allele")
        void movesAlleles() {
            List<Double> mutant = new GaussianMutation()
                    .vary(random, List.of(List.of(0.0, 0.0, 0.0)), withRate(1.0)).get(0);

            for (double allele : mutant) {
                assertNotEquals(0.0, allele);
            }
        }
    }

    @Nested
    @DisplayName("Non-uniform")
    class NonUniform {

        @Test
        @DisplayName("Stays within the bounder's ranges")
        void withinRange() {
            EvolutionContext<List<Double>> ctx = new StubEngineView<List<Double>>()
                    .withBounder(new RealBounder(0.0, 1.0))
                    .withGenerations(3)
                    .toContext(EvolutionConfig.builder().maxGenerations(10).build());

            for (int trial = 0; trial < 50; trial++) {
                List<Double> mutant = new NonUniformMutation().vary(random, List.of(List.of(0.5, 0.1)), ctx).get(0);
                for (double allele : mutant) {
                    assertTrue(allele >= 0.0 && allele <= 1.0);
                }
            }
        }

        @Test
        @DisplayName("Step vanishes once maxGenerations is reached")
        void finalGeneration() {
            EvolutionContext<List<Double>> ctx = new StubEngineView<List<Double>>()
                    .withBounder(new RealBounder(0.0, 1.0))
                    .withGenerations(10)
                    .toContext(EvolutionConfig.builder().maxGenerations(10).build());

            List<Double> mutant = new NonUniformMutation().vary(random, List.of(List.of(0.5, 0.25)), ctx).get(0);
            assertEquals(0.5, mutant.get(0), 1e-12);
            assertEquals(0.25, mutant.get(1), 1e-12);
        }

        @Test
        @DisplayName("Needs a ranged bounder and maxGenerations")
        void preconditions() {
            EvolutionContext<List<Double>> noRange = StubEngineView.context(
                    EvolutionConfig.builder().maxGenerations(10).build());
            assertThrows(IllegalStateException.class,
                    () -> new NonUniformMutation().vary(random, List.of(List.of(0.5)), noRange));

            EvolutionContext<List<Double>> noGenerations = new StubEngineView<List<Double>>()
                    .withBounder(new RealBounder(0.0, 1.0))
                    .toContext(EvolutionConfig.builder().build());
            assertThrows(IllegalStateException.class,
                    () -> new NonUniformMutation().vary(random, List.of(List.of(0.5)), noGenerations));
        }
    }
}
