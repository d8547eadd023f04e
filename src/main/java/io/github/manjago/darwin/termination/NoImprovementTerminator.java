package io.github.manjago.darwin.termination;

import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.RunScoped;
import io.github.manjago.darwin.engine.Terminator;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stops when the best fitness has not changed for {@code maxGenerations}
 * consecutive checks (default 10).
 */
public final class NoImprovementTerminator<C> implements Terminator<C>, RunScoped {

    private Fitness previousBest;
    private int unchanged;

    @Override
    public void reset() {
        previousBest = null;
        unchanged = 0;
    }

    @Override
    public boolean shouldTerminate(List<Individual<C>> population, EvolutionContext<C> context) {
        if (population.isEmpty()) {
            return false;
        }
        Fitness best = Collections.max(population).requireFitness();
        if (previousBest == null || !Objects.equals(previousBest, best)) {
            previousBest = best;
            unchanged = 0;
            return false;
        }
        if (unchanged >= context.config().maxGenerationsOr(10)) {
            return true;
        }
        unchanged++;
        return false;
    }
}
