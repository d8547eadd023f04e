package io.github.manjago.darwin.migration;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Migrator;

import java.util.List;

/**
 * No migration.
 */
public final class DefaultMigrator<C> implements Migrator<C> {

    @Override
    public List<Individual<C>> migrate(EvolutionRandom random, List<Individual<C>> population,
                                       EvolutionContext<C> context) {
        return population;
    }
}
