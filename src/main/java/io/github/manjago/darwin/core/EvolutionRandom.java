package io.github.manjago.darwin.core;

import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.core.RandomProviderDefaultState;
import org.apache.commons.rng.sampling.ListSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.io.Serial;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Seedable random source shared by every operator of one run.
 *
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP:
 * - fast, 128 bits of state
 * - state can be saved with a finished run and restored later
 *
 * Do not change the algorithm: stored runs would no longer replay.
 */
public final class EvolutionRandom {

    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long initialSeed;
    private final RestorableUniformRandomProvider rng;
    private final ContinuousSampler gaussian;

    public EvolutionRandom(long seed) {
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
        this.gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
    }

    private EvolutionRandom(long initialSeed, RandomProviderState state) {
        this(initialSeed);
        this.rng.restoreState(state);
    }

    // ========== Uniform draws ==========

    public int nextInt() {
        return rng.nextInt();
    }

    /**
     * Uniform int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Uniform int in [origin, bound).
     */
    public int nextInt(int origin, int bound) {
        return origin + rng.nextInt(bound - origin);
    }

    public long nextLong() {
        return rng.nextLong();
    }

    /**
     * Uniform double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Uniform double in [lower, upper).
     */
    public double nextDouble(double lower, double upper) {
        return lower + (upper - lower) * rng.nextDouble();
    }

    /**
     * True with the given probability.
     */
    public boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }

    public boolean nextBoolean() {
        return rng.nextBoolean();
    }

    // ========== Distributions ==========

    /**
     * Standard normal draw.
     */
    public double nextGaussian() {
        return gaussian.sample();
    }

    public double nextGaussian(double mean, double stdev) {
        return mean + stdev * gaussian.sample();
    }

    // ========== Collections ==========

    /**
     * Uniformly chosen element.
     */
    public <T> T choice(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return items.get(rng.nextInt(items.size()));
    }

    /**
     * {@code k} distinct positions of {@code items}, without replacement.
     */
    public <T> List<T> sample(List<T> items, int k) {
        return ListSampler.sample(rng, items, k);
    }

    /**
     * Shuffle in place.
     */
    public <T> void shuffle(List<T> items) {
        ListSampler.shuffle(rng, items);
    }

    // ========== State Management ==========

    public long getInitialSeed() {
        return initialSeed;
    }

    public State saveState() {
        RandomProviderState state = rng.saveState();
        byte[] stateBytes = ((RandomProviderDefaultState) state).getState();
        return new State(initialSeed, stateBytes);
    }

    public static EvolutionRandom restore(State state) {
        return new EvolutionRandom(state.initialSeed(), new RandomProviderDefaultState(state.stateBytes()));
    }

    /**
     * Raw generator state.
     * Byte layout: [8 bytes seed][4 bytes length][N bytes state]
     */
    public record State(long initialSeed, byte[] stateBytes) implements Serializable {

        @Serial
        private static final long serialVersionUID = 1L;

        public byte[] toBytes() {
            ByteBuffer buf = ByteBuffer.allocate(8 + 4 + stateBytes.length);
            buf.putLong(initialSeed);
            buf.putInt(stateBytes.length);
            buf.put(stateBytes);
            return buf.array();
        }

        public static State fromBytes(byte[] bytes) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            long seed = buf.getLong();
            int len = buf.getInt();
            byte[] stateBytes = new byte[len];
            buf.get(stateBytes);
            return new State(seed, stateBytes);
        }
    }
}
