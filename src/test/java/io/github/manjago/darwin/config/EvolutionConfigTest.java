package io.github.manjago.darwin.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EvolutionConfigTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("reference.conf matches the builder defaults")
        void defaultsMatchBuilder() {
            assertEquals(EvolutionConfig.builder().build(), EvolutionConfig.defaults());
        }

        @Test
        @DisplayName("Defaults leave optional values unset")
        void optionalDefaults() {
            EvolutionConfig config = EvolutionConfig.defaults();

            assertNull(config.temperature());
            assertNull(config.coolingRate());
            assertNull(config.tau());
            assertNull(config.tauPrime());
            assertNull(config.maxTime());
            assertEquals(2, config.tournamentSize());
            assertEquals(0.1, config.mutationRate());
        }

        @Test
        @DisplayName("File values override the reference")
        void fromFile() throws IOException {
            Path file = tempDir.resolve("test.conf");
            Files.writeString(file, """
                darwin {
                  random.seed = 42
                  selection.tournament-size = 5
                  annealing.temperature = 100
                  termination.max-time = 30s
                }
                """);

            EvolutionConfig config = EvolutionConfig.fromFile(file);

            assertEquals(42, config.randomSeed());
            assertEquals(5, config.tournamentSize());
            assertEquals(Double.valueOf(100.0), config.temperature());
            assertEquals(Duration.ofSeconds(30), config.maxTime());
            assertEquals(0.1, config.mutationRate());
        }

        @Test
        @DisplayName("Invalid values are rejected")
        void invalidValues() {
            var bad = ConfigFactory.parseString("darwin.selection.tournament-size = 0")
                    .withFallback(ConfigFactory.load());
            assertThrows(IllegalArgumentException.class, () -> EvolutionConfig.fromConfig(bad));
            assertThrows(IllegalArgumentException.class, () -> EvolutionConfig.builder().numElites(-1).build());
        }
    }

    @Nested
    @DisplayName("Derived values")
    class Derived {

        @Test
        @DisplayName("Zero counts fall back to the operator default")
        void fallbacks() {
            EvolutionConfig config = EvolutionConfig.builder().build();

            assertEquals(7, config.numSelectedOr(7));
            assertEquals(8, config.maxEvaluationsOr(8));
            assertEquals(9, config.maxArchiveSizeOr(9));

            EvolutionConfig set = config.toBuilder().numSelected(3).maxEvaluations(4).build();
            assertEquals(3, set.numSelectedOr(7));
            assertEquals(4, set.maxEvaluationsOr(8));
        }

        @Test
        @DisplayName("Configured seed is used as is")
        void effectiveSeed() {
            assertEquals(42, EvolutionConfig.builder().randomSeed(42).build().effectiveSeed());
        }

        @Test
        @DisplayName("toBuilder round-trips every value")
        void toBuilderRoundTrip() {
            EvolutionConfig config = EvolutionConfig.builder()
                    .temperature(50.0)
                    .maxTime(Duration.ofMinutes(1))
                    .evaluateMigrant(true)
                    .build();

            assertEquals(config, config.toBuilder().build());
        }
    }
}
