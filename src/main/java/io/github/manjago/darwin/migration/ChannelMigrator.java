package io.github.manjago.darwin.migration;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Migrator;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Island migration through a {@link MigrationChannel}.
 *
 * Each call picks a random local individual, replaces it with a pending
 * migrant if there is one, and offers the displaced individual to the channel.
 * With {@code evaluateMigrant} the incoming candidate is re-scored by the local
 * evaluator, counted as one evaluation.
 */
public final class ChannelMigrator<C> implements Migrator<C> {

    private static final Logger log = LoggerFactory.getLogger(ChannelMigrator.class);

    private final MigrationChannel<C> channel;

    public ChannelMigrator(MigrationChannel<C> channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public List<Individual<C>> migrate(EvolutionRandom random, List<Individual<C>> population,
                                       EvolutionContext<C> context) {
        if (population.isEmpty()) {
            return population;
        }
        List<Individual<C>> result = new ArrayList<>(population);
        channel.lock().lock();
        try {
            int index = random.nextInt(result.size());
            Individual<C> outgoing = result.get(index);

            Individual<C> incoming = channel.tryReceive();
            if (incoming != null) {
                if (context.config().evaluateMigrant()) {
                    incoming = reevaluate(incoming, context);
                }
                if (incoming != null) {
                    result.set(index, incoming);
                    log.debug("Migrant {} replaced {}", incoming, outgoing);
                }
            }
            if (!channel.trySend(outgoing)) {
                log.debug("Migration channel full, {} stays home", outgoing);
            }
        } finally {
            channel.lock().unlock();
        }
        return result;
    }

    private @Nullable Individual<C> reevaluate(Individual<C> migrant, EvolutionContext<C> context) {
        Fitness fitness = context.engine().evaluate(List.of(migrant.candidate())).get(0);
        if (fitness == null) {
            log.warn("Dropping migrant without fitness: {}", migrant.candidate());
            return null;
        }
        return new Individual<>(migrant.candidate(), fitness, context.engine().maximize());
    }
}
