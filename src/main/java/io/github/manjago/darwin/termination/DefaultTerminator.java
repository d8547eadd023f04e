package io.github.manjago.darwin.termination;

import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Terminator;

import java.util.List;

/**
 * Always stops, so a run ends right after initialization.
 */
public final class DefaultTerminator<C> implements Terminator<C> {

    @Override
    public boolean shouldTerminate(List<Individual<C>> population, EvolutionContext<C> context) {
        return true;
    }
}
