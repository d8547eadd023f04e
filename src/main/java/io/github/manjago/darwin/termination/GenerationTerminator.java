package io.github.manjago.darwin.termination;

import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Terminator;

import java.util.List;

/**
 * Stops after {@code maxGenerations} generations (default 1).
 */
public final class GenerationTerminator<C> implements Terminator<C> {

    @Override
    public boolean shouldTerminate(List<Individual<C>> population, EvolutionContext<C> context) {
        return context.engine().numGenerations() >= context.config().maxGenerationsOr(1);
    }
}
