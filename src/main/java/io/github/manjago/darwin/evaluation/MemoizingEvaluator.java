package io.github.manjago.darwin.evaluation;

import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches fitness by candidate in a bounded LRU map and sends only unseen
 * candidates to the wrapped evaluator, as one batch.
 *
 * Candidates need value {@code equals}/{@code hashCode}. Null results are not
 * cached. The cache is guarded by a lock, so one instance may back several engines.
 */
public final class MemoizingEvaluator<C> implements Evaluator<C> {

    private static final Logger log = LoggerFactory.getLogger(MemoizingEvaluator.class);

    public static final int DEFAULT_CAPACITY = 1024;

    private final Evaluator<C> delegate;
    private final Map<C, Fitness> cache;
    private final Lock lock = new ReentrantLock();
    private long hits = 0;
    private long misses = 0;

    public MemoizingEvaluator(Evaluator<C> delegate) {
        this(delegate, DEFAULT_CAPACITY);
    }

    public MemoizingEvaluator(Evaluator<C> delegate, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<C, Fitness> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public List<Fitness> evaluate(List<C> candidates, EvolutionContext<?> context) {
        Map<C, Fitness> known = new HashMap<>();
        Set<C> unseen = new LinkedHashSet<>();
        lock.lock();
        try {
            for (C candidate : candidates) {
                if (known.containsKey(candidate) || unseen.contains(candidate)) {
                    continue;
                }
                Fitness cached = cache.get(candidate);
                if (cached != null) {
                    known.put(candidate, cached);
                } else {
                    unseen.add(candidate);
                }
            }
        } finally {
            lock.unlock();
        }

        if (!unseen.isEmpty()) {
            List<C> batch = new ArrayList<>(unseen);
            List<Fitness> scores = delegate.evaluate(batch, context);
            if (scores.size() != batch.size()) {
                throw new IllegalStateException(
                        "Evaluator returned " + scores.size() + " values for " + batch.size() + " candidates");
            }
            lock.lock();
            try {
                for (int i = 0; i < batch.size(); i++) {
                    Fitness fitness = scores.get(i);
                    known.put(batch.get(i), fitness);
                    if (fitness != null) {
                        cache.put(batch.get(i), fitness);
                    }
                }
            } finally {
                lock.unlock();
            }
        }

        List<Fitness> result = new ArrayList<>(candidates.size());
        for (C candidate : candidates) {
            result.add(known.get(candidate));
        }
        lock.lock();
        try {
            misses += unseen.size();
            hits += candidates.size() - unseen.size();
        } finally {
            lock.unlock();
        }
        log.debug("Memoized evaluation: {} candidates, {} sent to the evaluator", candidates.size(), unseen.size());
        return result;
    }

    public long hits() {
        lock.lock();
        try {
            return hits;
        } finally {
            lock.unlock();
        }
    }

    public long misses() {
        lock.lock();
        try {
            return misses;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }
}
