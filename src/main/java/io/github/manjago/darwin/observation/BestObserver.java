package io.github.manjago.darwin.observation;

import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Observer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Logs the best individual every {@code reportInterval} generations.
 */
public final class BestObserver<C> implements Observer<C> {

    private static final Logger log = LoggerFactory.getLogger(BestObserver.class);

    @Override
    public void observe(List<Individual<C>> population, EvolutionContext<C> context) {
        long generation = context.engine().numGenerations();
        int interval = Math.max(1, context.config().reportInterval());
        if (population.isEmpty() || generation % interval != 0) {
            return;
        }
        log.info("Gen {} best: {}", generation, Collections.max(population));
    }
}
