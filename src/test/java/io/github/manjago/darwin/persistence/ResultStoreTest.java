package io.github.manjago.darwin.persistence;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.Pareto;
import io.github.manjago.darwin.core.ScalarFitness;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.generation.UniformRealGenerator;
import io.github.manjago.darwin.engine.Evaluator;
import io.github.manjago.darwin.termination.GenerationTerminator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultStoreTest {

    @TempDir
    Path tempDir;

    private static Individual<List<Double>> scalar(double fitness, double... genes) {
        List<Double> candidate = new ArrayList<>();
        for (double gene : genes) {
            candidate.add(gene);
        }
        return new Individual<>(candidate, new ScalarFitness(fitness), false);
    }

    @Test
    @DisplayName("Saved run loads back unchanged")
    void roundTrip() throws IOException {
        EvolutionRandom random = new EvolutionRandom(42);
        random.nextLong();
        StoredRun run = new StoredRun(5, 100, 42, false, "EvaluationTerminator", random.saveState(),
                List.of(scalar(1.5, 0.1, 0.2), scalar(0.5, -1.0, 3.0)),
                List.of(scalar(0.5, -1.0, 3.0)));
        Path file = tempDir.resolve("run.mv");

        ResultStore.save(run, file);
        StoredRun loaded = ResultStore.load(file);

        assertEquals(5, loaded.generations());
        assertEquals(100, loaded.evaluations());
        assertEquals(42, loaded.seed());
        assertFalse(loaded.maximize());
        assertEquals("EvaluationTerminator", loaded.terminationCause());
        assertEquals(run.population(), loaded.population());
        assertEquals(run.archive(), loaded.archive());
        assertEquals(List.of(-1.0, 3.0), loaded.best().candidate());

        assertTrue(loaded.hasDeterministicRng());
        EvolutionRandom restored = EvolutionRandom.restore(loaded.rngState());
        assertEquals(random.nextLong(), restored.nextLong());
    }

    @Test
    @DisplayName("Pareto fitness keeps values and polarity")
    void paretoFitness() {
        Pareto fitness = new Pareto(new double[]{1.0, 2.0}, new boolean[]{true, false});
        Individual<List<Double>> individual = new Individual<>(List.of(0.5), fitness, true);

        Individual<List<Double>> restored = ResultStore.deserialize(ResultStore.serialize(individual), true);

        assertEquals(individual, restored);
        Pareto restoredFitness = (Pareto) restored.requireFitness();
        assertTrue(restoredFitness.maximizes(0));
        assertFalse(restoredFitness.maximizes(1));
    }

    @Test
    @DisplayName("Saving again replaces the previous content")
    void overwrite() throws IOException {
        Path file = tempDir.resolve("run.mv");
        ResultStore.save(new StoredRun(1, 10, 1, true, null, null,
                List.of(scalar(1, 1.0), scalar(2, 2.0), scalar(3, 3.0)), List.of()), file);
        ResultStore.save(new StoredRun(2, 20, 1, true, null, null, List.of(scalar(4, 4.0)), List.of()), file);

        StoredRun loaded = ResultStore.load(file);

        assertEquals(2, loaded.generations());
        assertEquals(1, loaded.population().size());
        assertNull(loaded.terminationCause());
        assertFalse(loaded.hasDeterministicRng());
    }

    @Test
    @DisplayName("Finished engine can be saved directly")
    void saveEngine() throws IOException {
        EvolutionEngine<List<Double>> engine = new EvolutionEngine<>(new EvolutionRandom(9));
        engine.setTerminator(new GenerationTerminator<>());
        engine.evolve(new UniformRealGenerator(2, -1.0, 1.0),
                Evaluator.of(x -> new ScalarFitness(x.get(0) + x.get(1))), 6,
                EvolutionConfig.builder().maxGenerations(2).build());
        Path file = tempDir.resolve("engine.mv");

        ResultStore.save(engine, file);
        StoredRun loaded = ResultStore.load(file);

        assertEquals(2, loaded.generations());
        assertEquals(engine.getNumEvaluations(), loaded.evaluations());
        assertEquals(9, loaded.seed());
        assertTrue(loaded.maximize());
        assertEquals("GenerationTerminator", loaded.terminationCause());
        assertEquals(engine.getPopulation(), loaded.population());
    }

    @Test
    @DisplayName("Unsaved engine cannot be snapshotted")
    void engineNotRun() {
        EvolutionEngine<List<Double>> engine = new EvolutionEngine<>(new EvolutionRandom(9));

        assertThrows(IllegalStateException.class, () -> StoredRun.of(engine));
    }

    @Test
    @DisplayName("Validity and description")
    void validity() throws IOException {
        Path file = tempDir.resolve("run.mv");
        ResultStore.save(new StoredRun(3, 30, 7, true, "DefaultTerminator", null,
                List.of(scalar(1, 1.0)), List.of()), file);
        Path garbage = tempDir.resolve("garbage.mv");
        Files.writeString(garbage, "not a store");

        assertTrue(ResultStore.isValid(file));
        assertFalse(ResultStore.isValid(garbage));

        String description = ResultStore.describe(file);
        assertTrue(description.contains("3 generations"), description);
        assertTrue(description.contains("seed=7"), description);
        assertTrue(description.contains("DefaultTerminator"), description);
        assertTrue(ResultStore.describe(garbage).startsWith("Invalid result file"));
    }

    @Test
    @DisplayName("Loading a non-store file fails with IOException")
    void loadGarbage() throws IOException {
        Path garbage = tempDir.resolve("garbage.mv");
        Files.writeString(garbage, "not a store");

        assertThrows(IOException.class, () -> ResultStore.load(garbage));
    }
}
