package io.github.manjago.darwin.selection;

import io.github.manjago.darwin.core.EvolutionRandom;

/**
 * Spin of a roulette wheel over cumulative normalized weights.
 */
final class RouletteWheel {

    private RouletteWheel() {
    }

    /**
     * Index of the first slot whose cumulative weight exceeds a uniform draw.
     *
     * @param cumulative non-decreasing weights ending at 1.0
     */
    static int spin(EvolutionRandom random, double[] cumulative) {
        double cutoff = random.nextDouble();
        int lower = 0;
        int upper = cumulative.length - 1;
        while (upper >= lower) {
            int mid = (lower + upper) >>> 1;
            if (cumulative[mid] > cutoff) {
                upper = mid - 1;
            } else {
                lower = mid + 1;
            }
        }
        return Math.max(0, Math.min(cumulative.length - 1, lower));
    }
}
