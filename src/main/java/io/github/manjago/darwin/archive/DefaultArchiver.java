package io.github.manjago.darwin.archive;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.Archiver;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.List;

/**
 * Leaves the archive untouched.
 */
public final class DefaultArchiver<C> implements Archiver<C> {

    @Override
    public List<Individual<C>> archive(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> archive, EvolutionContext<C> context) {
        return archive;
    }
}
