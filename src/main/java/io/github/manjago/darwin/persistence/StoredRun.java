package io.github.manjago.darwin.persistence;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.EvolutionEngine;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A finished run over real vectors, as written to or read from a {@link ResultStore}.
 */
public record StoredRun(
    long generations,
    long evaluations,
    long seed,
    boolean maximize,
    @Nullable String terminationCause,
    @Nullable EvolutionRandom.State rngState,
    List<Individual<List<Double>>> population,
    List<Individual<List<Double>>> archive
) {

    public StoredRun {
        population = List.copyOf(population);
        archive = List.copyOf(archive);
    }

    /**
     * Snapshot of an engine after {@code evolve} returned.
     *
     * @throws IllegalStateException if the engine has not run
     */
    public static StoredRun of(EvolutionEngine<List<Double>> engine) {
        EvolutionContext<List<Double>> context = engine.getContext();
        if (context == null) {
            throw new IllegalStateException("Engine has not run yet");
        }
        return new StoredRun(
            engine.getNumGenerations(),
            engine.getNumEvaluations(),
            engine.getRandom().getInitialSeed(),
            context.engine().maximize(),
            engine.getTerminationCause(),
            engine.getRandom().saveState(),
            engine.getPopulation(),
            engine.getArchive()
        );
    }

    public boolean hasDeterministicRng() {
        return rngState != null;
    }

    /**
     * Best individual of the population, null when it is empty.
     */
    public @Nullable Individual<List<Double>> best() {
        return population.isEmpty() ? null : Collections.max(population);
    }
}
