package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.analysis.FitnessStatistics;
import org.jetbrains.annotations.Nullable;

/**
 * Snapshot of a run's counters.
 *
 * @param fitness population statistics, null for empty or multi-objective populations
 */
public record EvolutionStats(
    long numGenerations,
    long numEvaluations,
    int populationSize,
    int archiveSize,
    @Nullable String terminationCause,
    @Nullable FitnessStatistics fitness,
    long elapsedMillis,
    long seed
) {

    public double evaluationsPerSecond() {
        return elapsedMillis > 0 ? numEvaluations * 1000.0 / elapsedMillis : 0;
    }

    @Override
    public String toString() {
        return String.format("""
            === Evolution Statistics ===
            Generations:      %,d
            Evaluations:      %,d (%.0f/sec)
            Population:       %,d
            Archive:          %,d
            Terminated by:    %s
            Fitness:          %s
            Elapsed:          %,d ms
            Seed:             %d
            """,
            numGenerations,
            numEvaluations, evaluationsPerSecond(),
            populationSize,
            archiveSize,
            terminationCause == null ? "-" : terminationCause,
            fitness == null ? "n/a" : fitness,
            elapsedMillis,
            seed
        );
    }
}
