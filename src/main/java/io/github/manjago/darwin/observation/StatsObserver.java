package io.github.manjago.darwin.observation;

import io.github.manjago.darwin.analysis.FitnessStatistics;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EngineView;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Observer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logs population statistics every {@code reportInterval} generations.
 */
public final class StatsObserver<C> implements Observer<C> {

    private static final Logger log = LoggerFactory.getLogger(StatsObserver.class);

    @Override
    public void observe(List<Individual<C>> population, EvolutionContext<C> context) {
        EngineView<C> engine = context.engine();
        int interval = Math.max(1, context.config().reportInterval());
        if (engine.numGenerations() % interval != 0) {
            return;
        }
        if (FitnessStatistics.supports(population)) {
            FitnessStatistics stats = FitnessStatistics.of(population);
            log.info("Gen {} | evals {} | size {} | best {} | worst {} | mean {} | std {}",
                    engine.numGenerations(), engine.numEvaluations(), population.size(),
                    format(stats.best()), format(stats.worst()), format(stats.mean()), format(stats.std()));
        } else {
            log.info("Gen {} | evals {} | size {} | archive {}",
                    engine.numGenerations(), engine.numEvaluations(), population.size(),
                    engine.archive().size());
        }
    }

    private static String format(double value) {
        return String.format("%.6g", value);
    }
}
