package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.ScalarFitness;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.StubEngineView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ReplacersTest {

    private EvolutionRandom random;

    @BeforeEach
    void setUp() {
        random = new EvolutionRandom(77);
    }

    private static Individual<String> ind(String name, double fitness) {
        return new Individual<>(name, new ScalarFitness(fitness), true);
    }

    private static Set<String> names(List<Individual<String>> individuals) {
        return individuals.stream().map(Individual::candidate).collect(Collectors.toSet());
    }

    private static EvolutionContext<String> context(EvolutionConfig config) {
        return StubEngineView.context(config);
    }

    private static EvolutionContext<String> defaults() {
        return context(EvolutionConfig.builder().build());
    }

    private final List<Individual<String>> population = List.of(ind("p1", 1), ind("p2", 2), ind("p3", 3));
    private final List<Individual<String>> offspring = List.of(ind("o0", 0), ind("o5", 5));

    @Test
    @DisplayName("Default replacer keeps the population")
    void defaultReplacer() {
        assertEquals(population, new DefaultReplacer<String>()
                .replace(random, population, population, offspring, defaults()));
    }

    @Test
    @DisplayName("Truncation keeps the best of population and offspring")
    void truncation() {
        List<Individual<String>> survivors = new TruncationReplacer<String>()
                .replace(random, population, population, offspring, defaults());

        assertEquals(Set.of("o5", "p3", "p2"), names(survivors));
    }

    @Test
    @DisplayName("Steady state replaces the worst members")
    void steadyState() {
        List<Individual<String>> survivors = new SteadyStateReplacer<String>()
                .replace(random, population, population, offspring, defaults());

        assertEquals(Set.of("o0", "o5", "p3"), names(survivors));
    }

    @Nested
    @DisplayName("Generational")
    class Generational {

        @Test
        @DisplayName("Without elites the offspring take over")
        void noElites() {
            List<Individual<String>> survivors = new GenerationalReplacer<String>()
                    .replace(random, population, population, offspring, defaults());

            assertEquals(Set.of("o0", "o5"), names(survivors));
        }

        @Test
        @DisplayName("Elites compete with the offspring")
        void elites() {
            EvolutionContext<String> ctx = context(EvolutionConfig.builder().numElites(1).build());
            List<Individual<String>> survivors = new GenerationalReplacer<String>()
                    .replace(random, population, population, offspring, ctx);

            assertEquals(Set.of("o0", "o5", "p3"), names(survivors));
        }

        @Test
        @DisplayName("Result never exceeds the population size")
        void capped() {
            List<Individual<String>> many = List.of(ind("a", 9), ind("b", 8), ind("c", 7), ind("d", 6));
            List<Individual<String>> survivors = new GenerationalReplacer<String>()
                    .replace(random, population, population, many, defaults());

            assertEquals(Set.of("a", "b", "c"), names(survivors));
        }
    }

    @Nested
    @DisplayName("Evolution strategy")
    class Strategy {

        @Test
        @DisplayName("Plus keeps the best of parents and offspring")
        void plus() {
            List<Individual<String>> survivors = new PlusReplacer<String>()
                    .replace(random, population, population, offspring, defaults());

            assertEquals(Set.of("o5", "p3", "p2"), names(survivors));
        }

        @Test
        @DisplayName("Comma keeps only offspring")
        void comma() {
            List<Individual<String>> survivors = new CommaReplacer<String>()
                    .replace(random, population, population, offspring, defaults());

            assertEquals(Set.of("o0", "o5"), names(survivors));
        }
    }

    @Test
    @DisplayName("Random replacement spares the elites")
    void randomSparesElites() {
        EvolutionContext<String> ctx = context(EvolutionConfig.builder().numElites(1).build());
        for (int trial = 0; trial < 20; trial++) {
            List<Individual<String>> survivors = new RandomReplacer<String>()
                    .replace(random, population, population, offspring, ctx);

            assertEquals(3, survivors.size());
            assertTrue(names(survivors).contains("p3"));
            assertTrue(names(survivors).containsAll(Set.of("o0", "o5")));
        }
    }

    @Nested
    @DisplayName("Crowding")
    class Crowding {

        @Test
        @DisplayName("A better offspring replaces its nearest sampled neighbour")
        void replacesNearest() {
            List<Individual<List<Double>>> pop = List.of(
                    new Individual<>(List.of(0.0), new ScalarFitness(1), true),
                    new Individual<>(List.of(10.0), new ScalarFitness(1), true));
            List<Individual<List<Double>>> child = List.of(new Individual<>(List.of(9.0), new ScalarFitness(5), true));
            EvolutionContext<List<Double>> ctx = StubEngineView.context(EvolutionConfig.builder().build());

            List<Individual<List<Double>>> survivors = CrowdingReplacer.euclidean()
                    .replace(random, pop, pop, child, ctx);

            Set<List<Double>> candidates = new HashSet<>();
            survivors.forEach(s -> candidates.add(s.candidate()));
            assertEquals(Set.of(List.of(0.0), List.of(9.0)), candidates);
        }

        @Test
        @DisplayName("A worse offspring is discarded")
        void worseDiscarded() {
            List<Individual<List<Double>>> pop = List.of(new Individual<>(List.of(0.0), new ScalarFitness(5), true));
            List<Individual<List<Double>>> child = List.of(new Individual<>(List.of(0.1), new ScalarFitness(1), true));
            EvolutionContext<List<Double>> ctx = StubEngineView.context(EvolutionConfig.builder().build());

            assertEquals(pop, CrowdingReplacer.euclidean().replace(random, pop, pop, child, ctx));
        }

        @Test
        @DisplayName("Euclidean distance")
        void distance() {
            assertEquals(5.0, CrowdingReplacer.euclideanDistance(List.of(0.0, 0.0), List.of(3.0, 4.0)));
        }
    }

    @Nested
    @DisplayName("Simulated annealing")
    class Annealing {

        @Test
        @DisplayName("Better offspring always replace their parent")
        void betterAccepted() {
            EvolutionContext<String> ctx = context(EvolutionConfig.builder().maxEvaluations(100).build());
            List<Individual<String>> survivors = new SimulatedAnnealingReplacer<String>()
                    .replace(random, List.of(ind("p", 1)), List.of(ind("p", 1)), List.of(ind("c", 2)), ctx);

            assertEquals(Set.of("c"), names(survivors));
        }

        @Test
        @DisplayName("At zero temperature worse offspring are rejected")
        void coldRejects() {
            EvolutionContext<String> ctx = new StubEngineView<String>()
                    .withEvaluations(100)
                    .toContext(EvolutionConfig.builder().maxEvaluations(100).build());
            List<Individual<String>> survivors = new SimulatedAnnealingReplacer<String>()
                    .replace(random, List.of(ind("p", 5)), List.of(ind("p", 5)), List.of(ind("c", 1)), ctx);

            assertEquals(Set.of("p"), names(survivors));
        }

        @Test
        @DisplayName("Geometric cooling keeps the temperature in the run scratch")
        void geometricCooling() {
            EvolutionContext<String> ctx = context(EvolutionConfig.builder()
                    .temperature(100.0).coolingRate(0.5).build());

            assertEquals(50.0, SimulatedAnnealingReplacer.nextTemperature(ctx));
            assertEquals(25.0, SimulatedAnnealingReplacer.nextTemperature(ctx));
            assertEquals(Double.valueOf(25.0), ctx.scratch().getTemperature());
        }

        @Test
        @DisplayName("Generation budget drives the temperature when no evaluation budget is set")
        void generationSchedule() {
            EvolutionContext<String> ctx = new StubEngineView<String>()
                    .withGenerations(5)
                    .toContext(EvolutionConfig.builder().maxGenerations(20).build());

            assertEquals(0.75, SimulatedAnnealingReplacer.nextTemperature(ctx));
        }

        @Test
        @DisplayName("No schedule configured is an error")
        void noSchedule() {
            assertThrows(IllegalStateException.class, () -> SimulatedAnnealingReplacer.nextTemperature(defaults()));
        }

        @Test
        @DisplayName("Acceptance probability falls with the fitness gap")
        void acceptance() {
            double small = SimulatedAnnealingReplacer.acceptance(ind("p", 5), ind("c", 4), 1.0);
            double large = SimulatedAnnealingReplacer.acceptance(ind("p", 5), ind("c", 1), 1.0);

            assertEquals(Math.exp(-1), small, 1e-12);
            assertTrue(large < small);
        }
    }
}
