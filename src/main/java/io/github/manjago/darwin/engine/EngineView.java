package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.core.Bounder;
import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;

import java.util.List;

/**
 * Read-only handle on the running engine for operators that need counters,
 * the population size or the bounder.
 *
 * @param <C> candidate type
 */
public interface EngineView<C> {

    long numEvaluations();

    long numGenerations();

    /**
     * Population size requested for the current run.
     */
    int populationSize();

    /**
     * Copy of the current population.
     */
    List<Individual<C>> population();

    /**
     * Copy of the current archive.
     */
    List<Individual<C>> archive();

    Bounder<C> bounder();

    boolean maximize();

    /**
     * Evaluate candidates through the run's evaluator, counting the evaluations.
     */
    List<Fitness> evaluate(List<C> candidates);
}
