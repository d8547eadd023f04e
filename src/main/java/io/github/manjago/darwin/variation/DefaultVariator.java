package io.github.manjago.darwin.variation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Variator;

import java.util.ArrayList;
import java.util.List;

/**
 * Passes candidates through unchanged.
 */
public final class DefaultVariator<C> implements Variator<C> {

    @Override
    public List<C> vary(EvolutionRandom random, List<C> candidates, EvolutionContext<C> context) {
        return new ArrayList<>(candidates);
    }
}
