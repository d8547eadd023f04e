package io.github.manjago.darwin.generation;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.RealBounder;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.StubEngineView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorsTest {

    private final EvolutionRandom random = new EvolutionRandom(13);
    private final EvolutionContext<Object> context = StubEngineView.context(EvolutionConfig.builder().build());

    @Nested
    @DisplayName("UniformRealGenerator")
    class Uniform {

        @Test
        @DisplayName("Values stay inside the bounds")
        void inRange() {
            UniformRealGenerator generator = new UniformRealGenerator(3, -2.0, 5.0);
            for (int i = 0; i < 200; i++) {
                List<Double> candidate = generator.generate(random, context);
                assertEquals(3, candidate.size());
                for (double v : candidate) {
                    assertTrue(v >= -2.0 && v <= 5.0, "out of range: " + v);
                }
            }
        }

        @Test
        @DisplayName("Per-dimension bounds are honored")
        void perDimension() {
            UniformRealGenerator generator = new UniformRealGenerator(2,
                    new RealBounder(List.of(0.0, 10.0), List.of(1.0, 11.0)));
            List<Double> candidate = generator.generate(random, context);

            assertTrue(candidate.get(0) >= 0.0 && candidate.get(0) <= 1.0);
            assertTrue(candidate.get(1) >= 10.0 && candidate.get(1) <= 11.0);
        }

        @Test
        @DisplayName("Zero dimensions are rejected")
        void invalidDimensions() {
            assertThrows(IllegalArgumentException.class, () -> new UniformRealGenerator(0, 0.0, 1.0));
        }
    }

    @Nested
    @DisplayName("DiversifyingGenerator")
    class Diversifying {

        @Test
        @DisplayName("Every candidate is new")
        void unique() {
            DiversifyingGenerator<Integer> generator =
                    new DiversifyingGenerator<>((r, c) -> r.nextInt(10));
            Set<Integer> values = new HashSet<>();
            for (int i = 0; i < 10; i++) {
                assertTrue(values.add(generator.generate(random, context)));
            }
            assertEquals(10, generator.generated());
        }

        @Test
        @DisplayName("Running out of new candidates fails")
        void exhausted() {
            DiversifyingGenerator<Integer> generator =
                    new DiversifyingGenerator<>((r, c) -> r.nextInt(2), 50);
            generator.generate(random, context);
            generator.generate(random, context);

            assertThrows(IllegalStateException.class, () -> generator.generate(random, context));
        }

        @Test
        @DisplayName("Reset forgets earlier candidates")
        void reset() {
            DiversifyingGenerator<Integer> generator = new DiversifyingGenerator<>((r, c) -> 7, 3);
            assertEquals(7, generator.generate(random, context));
            generator.reset();

            assertEquals(7, generator.generate(random, context));
            assertEquals(1, generator.generated());
        }
    }
}
