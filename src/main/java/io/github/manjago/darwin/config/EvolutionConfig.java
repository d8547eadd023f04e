package io.github.manjago.darwin.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Fixed parameters of one evolution run.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 *
 * Counts whose default depends on the population or on the operator use 0
 * for "operator default".
 */
public record EvolutionConfig(
    long randomSeed,            // 0 = time-based

    // Selection
    int numSelected,            // 0 = operator default
    int tournamentSize,

    // Variation
    double crossoverRate,
    int numCrossoverPoints,
    double mutationRate,
    double gaussianMean,
    double gaussianStdev,
    double uxBias,
    double blxAlpha,
    double axAlpha,
    double mutationStrength,
    int numOffspring,           // 0 = operator default

    // Replacement
    int numElites,
    int crowdingDistance,

    // Simulated annealing
    @Nullable Double temperature,
    @Nullable Double coolingRate,

    // Evolution strategy
    @Nullable Double tau,
    @Nullable Double tauPrime,
    double epsilon,

    // Archive
    int maxArchiveSize,         // 0 = population size
    int numGridDivisions,

    // Termination
    int maxEvaluations,         // 0 = population size
    int maxGenerations,         // 0 = terminator default
    @Nullable Duration maxTime,
    double minDiversity,
    double tolerance,

    // Migration
    int maxMigrants,
    boolean evaluateMigrant,

    // Reporting
    int reportInterval
) {

    public EvolutionConfig {
        requireNonNegative("numSelected", numSelected);
        requireNonNegative("numOffspring", numOffspring);
        requireNonNegative("numElites", numElites);
        requireNonNegative("maxArchiveSize", maxArchiveSize);
        requireNonNegative("maxEvaluations", maxEvaluations);
        requireNonNegative("maxGenerations", maxGenerations);
        if (tournamentSize < 1) {
            throw new IllegalArgumentException("tournamentSize must be at least 1, got " + tournamentSize);
        }
        if (numCrossoverPoints < 1) {
            throw new IllegalArgumentException("numCrossoverPoints must be at least 1, got " + numCrossoverPoints);
        }
        if (numGridDivisions < 1) {
            throw new IllegalArgumentException("numGridDivisions must be at least 1, got " + numGridDivisions);
        }
        if (maxMigrants < 1) {
            throw new IllegalArgumentException("maxMigrants must be at least 1, got " + maxMigrants);
        }
        if (crowdingDistance < 1) {
            throw new IllegalArgumentException("crowdingDistance must be at least 1, got " + crowdingDistance);
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }

    /**
     * Load default configuration.
     */
    public static EvolutionConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file, falling back to the defaults.
     */
    public static EvolutionConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static EvolutionConfig fromConfig(Config config) {
        Config c = config.getConfig("darwin");

        return new EvolutionConfig(
            c.getLong("random.seed"),
            c.getInt("selection.num-selected"),
            c.getInt("selection.tournament-size"),
            c.getDouble("variation.crossover-rate"),
            c.getInt("variation.num-crossover-points"),
            c.getDouble("variation.mutation-rate"),
            c.getDouble("variation.gaussian-mean"),
            c.getDouble("variation.gaussian-stdev"),
            c.getDouble("variation.ux-bias"),
            c.getDouble("variation.blx-alpha"),
            c.getDouble("variation.ax-alpha"),
            c.getDouble("variation.mutation-strength"),
            c.getInt("variation.num-offspring"),
            c.getInt("replacement.num-elites"),
            c.getInt("replacement.crowding-distance"),
            optionalDouble(c, "annealing.temperature"),
            optionalDouble(c, "annealing.cooling-rate"),
            optionalDouble(c, "strategy.tau"),
            optionalDouble(c, "strategy.tau-prime"),
            c.getDouble("strategy.epsilon"),
            c.getInt("archive.max-size"),
            c.getInt("archive.num-grid-divisions"),
            c.getInt("termination.max-evaluations"),
            c.getInt("termination.max-generations"),
            c.hasPath("termination.max-time") ? c.getDuration("termination.max-time") : null,
            c.getDouble("termination.min-diversity"),
            c.getDouble("termination.tolerance"),
            c.getInt("migration.max-migrants"),
            c.getBoolean("migration.evaluate-migrant"),
            c.getInt("reporting.interval")
        );
    }

    private static @Nullable Double optionalDouble(Config c, String path) {
        return c.hasPath(path) ? c.getDouble(path) : null;
    }

    /**
     * Seed to actually use: the configured one, or one derived from the clock.
     */
    public long effectiveSeed() {
        return randomSeed != 0 ? randomSeed : System.nanoTime();
    }

    // ========== Derived defaults ==========

    public int numSelectedOr(int fallback) {
        return numSelected > 0 ? numSelected : fallback;
    }

    public int numOffspringOr(int fallback) {
        return numOffspring > 0 ? numOffspring : fallback;
    }

    public int maxEvaluationsOr(int fallback) {
        return maxEvaluations > 0 ? maxEvaluations : fallback;
    }

    public int maxGenerationsOr(int fallback) {
        return maxGenerations > 0 ? maxGenerations : fallback;
    }

    public int maxArchiveSizeOr(int fallback) {
        return maxArchiveSize > 0 ? maxArchiveSize : fallback;
    }

    /**
     * Builder for programmatic configuration. Starts from the same values as reference.conf.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .randomSeed(randomSeed)
            .numSelected(numSelected)
            .tournamentSize(tournamentSize)
            .crossoverRate(crossoverRate)
            .numCrossoverPoints(numCrossoverPoints)
            .mutationRate(mutationRate)
            .gaussianMean(gaussianMean)
            .gaussianStdev(gaussianStdev)
            .uxBias(uxBias)
            .blxAlpha(blxAlpha)
            .axAlpha(axAlpha)
            .mutationStrength(mutationStrength)
            .numOffspring(numOffspring)
            .numElites(numElites)
            .crowdingDistance(crowdingDistance)
            .temperature(temperature)
            .coolingRate(coolingRate)
            .tau(tau)
            .tauPrime(tauPrime)
            .epsilon(epsilon)
            .maxArchiveSize(maxArchiveSize)
            .numGridDivisions(numGridDivisions)
            .maxEvaluations(maxEvaluations)
            .maxGenerations(maxGenerations)
            .maxTime(maxTime)
            .minDiversity(minDiversity)
            .tolerance(tolerance)
            .maxMigrants(maxMigrants)
            .evaluateMigrant(evaluateMigrant)
            .reportInterval(reportInterval);
    }

    public static class Builder {
        private long randomSeed = 0;
        private int numSelected = 0;
        private int tournamentSize = 2;
        private double crossoverRate = 1.0;
        private int numCrossoverPoints = 1;
        private double mutationRate = 0.1;
        private double gaussianMean = 0.0;
        private double gaussianStdev = 1.0;
        private double uxBias = 0.5;
        private double blxAlpha = 0.1;
        private double axAlpha = 0.5;
        private double mutationStrength = 1.0;
        private int numOffspring = 0;
        private int numElites = 0;
        private int crowdingDistance = 2;
        private Double temperature = null;
        private Double coolingRate = null;
        private Double tau = null;
        private Double tauPrime = null;
        private double epsilon = 0.00001;
        private int maxArchiveSize = 0;
        private int numGridDivisions = 1;
        private int maxEvaluations = 0;
        private int maxGenerations = 0;
        private Duration maxTime = null;
        private double minDiversity = 0.001;
        private double tolerance = 0.001;
        private int maxMigrants = 1;
        private boolean evaluateMigrant = false;
        private int reportInterval = 10;

        public Builder randomSeed(long seed) { this.randomSeed = seed; return this; }
        public Builder numSelected(int n) { this.numSelected = n; return this; }
        public Builder tournamentSize(int size) { this.tournamentSize = size; return this; }
        public Builder crossoverRate(double rate) { this.crossoverRate = rate; return this; }
        public Builder numCrossoverPoints(int points) { this.numCrossoverPoints = points; return this; }
        public Builder mutationRate(double rate) { this.mutationRate = rate; return this; }
        public Builder gaussianMean(double mean) { this.gaussianMean = mean; return this; }
        public Builder gaussianStdev(double stdev) { this.gaussianStdev = stdev; return this; }
        public Builder uxBias(double bias) { this.uxBias = bias; return this; }
        public Builder blxAlpha(double alpha) { this.blxAlpha = alpha; return this; }
        public Builder axAlpha(double alpha) { this.axAlpha = alpha; return this; }
        public Builder mutationStrength(double strength) { this.mutationStrength = strength; return this; }
        public Builder numOffspring(int n) { this.numOffspring = n; return this; }
        public Builder numElites(int n) { this.numElites = n; return this; }
        public Builder crowdingDistance(int distance) { this.crowdingDistance = distance; return this; }
        public Builder temperature(Double t) { this.temperature = t; return this; }
        public Builder coolingRate(Double rate) { this.coolingRate = rate; return this; }
        public Builder tau(Double tau) { this.tau = tau; return this; }
        public Builder tauPrime(Double tauPrime) { this.tauPrime = tauPrime; return this; }
        public Builder epsilon(double epsilon) { this.epsilon = epsilon; return this; }
        public Builder maxArchiveSize(int size) { this.maxArchiveSize = size; return this; }
        public Builder numGridDivisions(int divisions) { this.numGridDivisions = divisions; return this; }
        public Builder maxEvaluations(int max) { this.maxEvaluations = max; return this; }
        public Builder maxGenerations(int max) { this.maxGenerations = max; return this; }
        public Builder maxTime(Duration time) { this.maxTime = time; return this; }
        public Builder minDiversity(double diversity) { this.minDiversity = diversity; return this; }
        public Builder tolerance(double tolerance) { this.tolerance = tolerance; return this; }
        public Builder maxMigrants(int max) { this.maxMigrants = max; return this; }
        public Builder evaluateMigrant(boolean evaluate) { this.evaluateMigrant = evaluate; return this; }
        public Builder reportInterval(int interval) { this.reportInterval = interval; return this; }

        public EvolutionConfig build() {
            return new EvolutionConfig(
                randomSeed, numSelected, tournamentSize,
                crossoverRate, numCrossoverPoints, mutationRate, gaussianMean, gaussianStdev,
                uxBias, blxAlpha, axAlpha, mutationStrength, numOffspring,
                numElites, crowdingDistance,
                temperature, coolingRate,
                tau, tauPrime, epsilon,
                maxArchiveSize, numGridDivisions,
                maxEvaluations, maxGenerations, maxTime, minDiversity, tolerance,
                maxMigrants, evaluateMigrant,
                reportInterval
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            EvolutionConfig:
              random.seed:                  %s
              selection.num-selected:       %s
              selection.tournament-size:    %d
              variation.crossover-rate:     %.3f
              variation.crossover-points:   %d
              variation.mutation-rate:      %.3f
              variation.gaussian:           mean %.3f, stdev %.3f
              variation.ux-bias:            %.3f
              variation.blx-alpha:          %.3f
              variation.ax-alpha:           %.3f
              variation.mutation-strength:  %.3f
              variation.num-offspring:      %s
              replacement.num-elites:       %d
              replacement.crowding-dist:    %d
              annealing.temperature:        %s
              annealing.cooling-rate:       %s
              strategy.tau / tau-prime:     %s / %s
              strategy.epsilon:             %s
              archive.max-size:             %s
              archive.grid-divisions:       %d
              termination.max-evaluations:  %s
              termination.max-generations:  %s
              termination.max-time:         %s
              termination.min-diversity:    %s
              termination.tolerance:        %s
              migration.max-migrants:       %d
              migration.evaluate-migrant:   %s
              reporting.interval:           %,d generations
            """,
            randomSeed == 0 ? "time-based" : Long.toString(randomSeed),
            orDefault(numSelected, "operator default"),
            tournamentSize,
            crossoverRate,
            numCrossoverPoints,
            mutationRate,
            gaussianMean, gaussianStdev,
            uxBias,
            blxAlpha,
            axAlpha,
            mutationStrength,
            orDefault(numOffspring, "operator default"),
            numElites,
            crowdingDistance,
            temperature == null ? "derived" : temperature,
            coolingRate == null ? "derived" : coolingRate,
            tau == null ? "derived" : tau, tauPrime == null ? "derived" : tauPrime,
            epsilon,
            orDefault(maxArchiveSize, "population size"),
            numGridDivisions,
            orDefault(maxEvaluations, "population size"),
            orDefault(maxGenerations, "terminator default"),
            maxTime == null ? "none" : maxTime,
            minDiversity,
            tolerance,
            maxMigrants,
            evaluateMigrant,
            reportInterval
        );
    }

    private static String orDefault(int value, String label) {
        return value == 0 ? label : String.format("%,d", value);
    }
}
