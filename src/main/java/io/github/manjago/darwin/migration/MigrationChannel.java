package io.github.manjago.darwin.migration;

import io.github.manjago.darwin.core.Individual;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded queue of migrants shared by runs on different threads.
 *
 * Sends and receives never block: a full channel drops the migrant, an empty
 * one yields nothing. The capacity bounds memory, so freshness of migrants is
 * not guaranteed.
 */
public final class MigrationChannel<C> {

    private final BlockingQueue<Individual<C>> queue;
    private final Lock lock = new ReentrantLock();

    public MigrationChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return false if the channel is full
     */
    public boolean trySend(Individual<C> migrant) {
        return queue.offer(migrant);
    }

    public @Nullable Individual<C> tryReceive() {
        return queue.poll();
    }

    /**
     * Lock guarding a receive-then-send swap.
     */
    Lock lock() {
        return lock;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return queue.size() + queue.remainingCapacity();
    }
}
