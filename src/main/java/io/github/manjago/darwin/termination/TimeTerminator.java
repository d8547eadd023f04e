package io.github.manjago.darwin.termination;

import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.RunScoped;
import io.github.manjago.darwin.engine.Terminator;

import java.time.Duration;
import java.util.List;

/**
 * Stops once {@code maxTime} has elapsed since the run started.
 */
public final class TimeTerminator<C> implements Terminator<C>, RunScoped {

    private long startNanos = -1;

    @Override
    public void reset() {
        startNanos = System.nanoTime();
    }

    @Override
    public boolean shouldTerminate(List<Individual<C>> population, EvolutionContext<C> context) {
        Duration maxTime = context.config().maxTime();
        if (maxTime == null) {
            throw new IllegalStateException("Time termination needs maxTime to be set");
        }
        if (startNanos < 0) {
            startNanos = System.nanoTime();
        }
        return System.nanoTime() - startNanos >= maxTime.toNanos();
    }
}
