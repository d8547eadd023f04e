package io.github.manjago.darwin.archive;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.Archiver;
import io.github.manjago.darwin.engine.EvolutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Archive mirrors the current population.
 */
public final class PopulationArchiver<C> implements Archiver<C> {

    @Override
    public List<Individual<C>> archive(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> archive, EvolutionContext<C> context) {
        return new ArrayList<>(population);
    }
}
