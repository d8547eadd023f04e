package io.github.manjago.darwin.cli;

import io.github.manjago.darwin.analysis.Hypervolume;
import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.StrategyCandidate;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.engine.EvolutionStats;
import io.github.manjago.darwin.observation.StatsObserver;
import io.github.manjago.darwin.persistence.ResultStore;
import io.github.manjago.darwin.persistence.StoredRun;
import io.github.manjago.darwin.preset.EstimationOfDistribution;
import io.github.manjago.darwin.preset.EvolutionStrategy;
import io.github.manjago.darwin.preset.GeneticAlgorithm;
import io.github.manjago.darwin.preset.Nsga2;
import io.github.manjago.darwin.preset.Paes;
import io.github.manjago.darwin.preset.SimulatedAnnealing;
import io.github.manjago.darwin.preset.SteadyStateAlgorithm;
import io.github.manjago.darwin.termination.EvaluationTerminator;
import io.github.manjago.darwin.variation.BlendCrossover;
import io.github.manjago.darwin.variation.GaussianMutation;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Optimize a demo problem.
 *
 * Examples:
 *   darwin run                                  # GA on 2-D Rastrigin
 *   darwin run -a es -e 5000 --seed 42          # evolution strategy, fixed seed
 *   darwin run -a nsga2 -p schaffer -o front.mv # multi-objective, store result
 *   darwin run --config my.conf                 # use custom config
 */
@Command(
    name = "run",
    description = "Optimize a demo problem",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final int DEFAULT_MAX_EVALUATIONS = 2000;
    private static final int DEFAULT_PAES_ARCHIVE = 100;

    /**
     * Algorithm presets.
     */
    public enum Algorithm {
        GA, ES, EDA, DEA, SA, NSGA2, PAES;

        boolean isMultiObjective() {
            return this == NSGA2 || this == PAES;
        }
    }

    @Option(names = {"-a", "--algorithm"}, description = "Algorithm: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "GA")
    private Algorithm algorithm;

    @Option(names = {"-p", "--problem"}, description = "Problem: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "RASTRIGIN")
    private DemoProblem problem;

    @Option(names = {"-d", "--dimensions"}, description = "Problem dimensions (default: ${DEFAULT-VALUE})",
            defaultValue = "2")
    private int dimensions;

    @Option(names = {"-n", "--population"}, description = "Population size (default: ${DEFAULT-VALUE})",
            defaultValue = "20")
    private int populationSize;

    @Option(names = {"-e", "--max-evaluations"}, description = "Max evaluations")
    private Integer maxEvaluations;

    @Option(names = {"-s", "--seed"}, description = "Random seed (0 = time based)")
    private Long seed;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "Output file for the final population")
    private Path outputFile;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;

    @Override
    public Integer call() throws IOException {
        if (problem.isMultiObjective() && !algorithm.isMultiObjective()) {
            System.err.printf("%s has %d objectives; use NSGA2 or PAES%n", problem, problem.objectives());
            return 2;
        }
        if (dimensions <= 0 || populationSize <= 0) {
            System.err.println("Dimensions and population size must be positive");
            return 2;
        }

        EvolutionConfig config = buildConfig();
        EvolutionRandom random = new EvolutionRandom(config.effectiveSeed());

        if (!quiet) {
            printConfig(config, random.getInitialSeed());
        }

        StoredRun run;
        EvolutionStats stats;
        if (algorithm == Algorithm.ES) {
            EvolutionStrategy engine = new EvolutionStrategy(random);
            configure(engine);
            engine.evolvePayload(problem.generator(dimensions), problem.evaluator(), populationSize, List.of(),
                    false, problem.bounder(), config);
            run = payloadRun(engine);
            stats = engine.getStats();
        } else {
            EvolutionEngine<List<Double>> engine = create(random);
            configure(engine);
            engine.evolve(problem.generator(dimensions), problem.evaluator(), populationSize, List.of(),
                    false, problem.bounder(), config);
            run = StoredRun.of(engine);
            stats = engine.getStats();
        }

        if (!quiet) {
            printFinalReport(run, stats);
        }
        if (outputFile != null) {
            ResultStore.save(run, outputFile);
            if (!quiet) {
                System.out.println("Saved to " + outputFile);
            }
        }
        return 0;
    }

    private EvolutionEngine<List<Double>> create(EvolutionRandom random) {
        return switch (algorithm) {
            case GA -> new GeneticAlgorithm<>(random, new GaussianMutation());
            case EDA -> new EstimationOfDistribution(random);
            case DEA -> new SteadyStateAlgorithm(random);
            case SA -> new SimulatedAnnealing(random);
            case NSGA2 -> {
                Nsga2<List<Double>> nsga = new Nsga2<>(random);
                nsga.setVariators(List.of(new BlendCrossover(), new GaussianMutation()));
                yield nsga;
            }
            case PAES -> new Paes(random);
            case ES -> throw new IllegalArgumentException("ES evolves strategy candidates");
        };
    }

    private <C> void configure(EvolutionEngine<C> engine) {
        engine.setTerminator(new EvaluationTerminator<>());
        if (!quiet) {
            engine.addObserver(new StatsObserver<>());
        }
    }

    private EvolutionConfig buildConfig() {
        EvolutionConfig base = configFile != null ? EvolutionConfig.fromFile(configFile) : EvolutionConfig.defaults();
        EvolutionConfig.Builder builder = base.toBuilder();

        // Override from CLI options
        if (seed != null) builder.randomSeed(seed);
        if (maxEvaluations != null) {
            builder.maxEvaluations(maxEvaluations);
        } else if (base.maxEvaluations() == 0) {
            builder.maxEvaluations(DEFAULT_MAX_EVALUATIONS);
        }
        if (algorithm == Algorithm.PAES && base.maxArchiveSize() == 0) {
            builder.maxArchiveSize(DEFAULT_PAES_ARCHIVE);
        }
        return builder.build();
    }

    private static StoredRun payloadRun(EvolutionStrategy engine) {
        return new StoredRun(
            engine.getNumGenerations(),
            engine.getNumEvaluations(),
            engine.getRandom().getInitialSeed(),
            false,
            engine.getTerminationCause(),
            engine.getRandom().saveState(),
            payloads(engine.getPopulation()),
            payloads(engine.getArchive())
        );
    }

    private static List<Individual<List<Double>>> payloads(List<Individual<StrategyCandidate>> individuals) {
        List<Individual<List<Double>>> result = new ArrayList<>(individuals.size());
        for (Individual<StrategyCandidate> individual : individuals) {
            result.add(new Individual<>(individual.candidate().payload(), individual.fitness(), individual.maximize()));
        }
        return result;
    }

    private void printConfig(EvolutionConfig config, long effectiveSeed) {
        System.out.println();
        System.out.println("Configuration:");
        System.out.printf("  Algorithm:       %s%n", algorithm);
        System.out.printf("  Problem:         %s (%d-D)%n", problem, problem.dimensions(dimensions));
        System.out.printf("  Population:      %,d%n", populationSize);
        System.out.printf("  Max evaluations: %,d%n", config.maxEvaluations());
        System.out.printf("  Seed:            %d%n", effectiveSeed);
        System.out.println();
    }

    private void printFinalReport(StoredRun run, EvolutionStats stats) {
        System.out.println();
        System.out.print(stats);
        System.out.println();
        if (problem.isMultiObjective()) {
            List<Individual<List<Double>>> front = run.archive().isEmpty() ? run.population() : run.archive();
            System.out.printf("Front: %d points, hypervolume %.6f%n", front.size(), Hypervolume.of(front));
        } else {
            Individual<List<Double>> best = run.best();
            System.out.println("Best: " + (best == null ? "-" : best));
        }
    }
}
