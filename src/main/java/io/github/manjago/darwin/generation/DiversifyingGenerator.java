package io.github.manjago.darwin.generation;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Generator;
import io.github.manjago.darwin.engine.RunScoped;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Wraps a generator so that no candidate is produced twice within a run.
 * Candidates need value {@code equals}/{@code hashCode}.
 */
public final class DiversifyingGenerator<C> implements Generator<C>, RunScoped {

    public static final int DEFAULT_MAX_ATTEMPTS = 10_000;

    private final Generator<C> delegate;
    private final int maxAttempts;
    private final Set<C> seen = new HashSet<>();

    public DiversifyingGenerator(Generator<C> delegate) {
        this(delegate, DEFAULT_MAX_ATTEMPTS);
    }

    public DiversifyingGenerator(Generator<C> delegate, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.maxAttempts = maxAttempts;
    }

    @Override
    public void reset() {
        seen.clear();
    }

    /**
     * @throws IllegalStateException if no new candidate turns up within the attempt limit
     */
    @Override
    public C generate(EvolutionRandom random, EvolutionContext<?> context) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            C candidate = delegate.generate(random, context);
            if (seen.add(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException(
                "No new candidate after " + maxAttempts + " attempts, " + seen.size() + " already generated");
    }

    public int generated() {
        return seen.size();
    }
}
