package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.analysis.FitnessStatistics;
import io.github.manjago.darwin.archive.DefaultArchiver;
import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.Bounder;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.migration.DefaultMigrator;
import io.github.manjago.darwin.replacement.DefaultReplacer;
import io.github.manjago.darwin.selection.DefaultSelector;
import io.github.manjago.darwin.termination.DefaultTerminator;
import io.github.manjago.darwin.variation.DefaultVariator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Generic evolution engine.
 *
 * Sequences the operator pipeline: terminate check, select, vary, evaluate,
 * replace, migrate, archive, observe. Every role is pluggable through a setter;
 * variators, terminators and observers are ordered lists. Operator exceptions
 * propagate to the caller unchanged.
 *
 * <p>An engine is not thread-safe and runs one evolution at a time. Run state
 * (population, archive, counters) stays readable after {@code evolve} returns.
 *
 * @param <C> candidate type
 */
public class EvolutionEngine<C> {

    private static final Logger log = LoggerFactory.getLogger(EvolutionEngine.class);

    protected final EvolutionRandom random;

    // Operators
    private Selector<C> selector = new DefaultSelector<>();
    private List<Variator<C>> variators = List.of(new DefaultVariator<>());
    private Replacer<C> replacer = new DefaultReplacer<>();
    private Migrator<C> migrator = new DefaultMigrator<>();
    private Archiver<C> archiver = new DefaultArchiver<>();
    private List<Terminator<C>> terminators = List.of(new DefaultTerminator<>());
    private List<Observer<C>> observers = List.of();

    // Run state
    private List<Individual<C>> population = new ArrayList<>();
    private List<Individual<C>> archive = new ArrayList<>();
    private long numEvaluations = 0;
    private long numGenerations = 0;
    private @Nullable String terminationCause;
    private @Nullable EvolutionContext<C> context;
    private @Nullable Evaluator<C> evaluator;
    private Bounder<C> bounder = Bounder.identity();
    private boolean maximize = true;
    private int populationSize = 0;
    private long startMillis = 0;
    private long elapsedMillis = 0;

    private final EngineView<C> view = new View();

    public EvolutionEngine(@NotNull EvolutionRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    // ========== Run ==========

    /**
     * Evolve a maximized population without seeds or bounder.
     */
    public List<Individual<C>> evolve(Generator<C> generator, Evaluator<C> evaluator,
                                      int popSize, EvolutionConfig config) {
        return evolve(generator, evaluator, popSize, List.of(), true, Bounder.identity(), config);
    }

    public List<Individual<C>> evolve(Generator<C> generator, Evaluator<C> evaluator,
                                      int popSize, boolean maximize, EvolutionConfig config) {
        return evolve(generator, evaluator, popSize, List.of(), maximize, Bounder.identity(), config);
    }

    public List<Individual<C>> evolve(Generator<C> generator, Evaluator<C> evaluator,
                                      int popSize, boolean maximize, Bounder<C> bounder,
                                      EvolutionConfig config) {
        return evolve(generator, evaluator, popSize, List.of(), maximize, bounder, config);
    }

    /**
     * Run an evolution and return the final population.
     *
     * @param generator creates the initial candidates beyond the seeds
     * @param evaluator scores candidate batches
     * @param popSize   requested population size, must be positive
     * @param seeds     candidates placed verbatim in the initial population; more
     *                  seeds than {@code popSize} are all kept
     * @param maximize  polarity of the fitness ordering
     * @param bounder   legalizes candidates produced by numeric variators
     * @param config    fixed parameters
     * @throws IllegalArgumentException if {@code popSize} is not positive
     * @throws IllegalStateException    if the evaluator returns the wrong number of values
     */
    public List<Individual<C>> evolve(@NotNull Generator<C> generator,
                                      @NotNull Evaluator<C> evaluator,
                                      int popSize,
                                      @NotNull Collection<? extends C> seeds,
                                      boolean maximize,
                                      @Nullable Bounder<C> bounder,
                                      @NotNull EvolutionConfig config) {
        if (popSize <= 0) {
            throw new IllegalArgumentException("Population size must be positive, got " + popSize);
        }
        int size = effectivePopulationSize(popSize);
        EvolutionConfig effective = applyDefaults(config, size);

        this.evaluator = evaluator;
        this.bounder = bounder != null ? bounder : Bounder.identity();
        this.maximize = maximize;
        this.populationSize = size;
        this.population = new ArrayList<>();
        this.archive = new ArrayList<>();
        this.numEvaluations = 0;
        this.numGenerations = 0;
        this.terminationCause = null;
        this.context = new EvolutionContext<>(effective, new RunScratch(), view);
        this.startMillis = System.currentTimeMillis();
        resetRunScoped(generator, evaluator);

        log.info("Starting evolution: population {}, {} seeds, {}", size, seeds.size(),
                maximize ? "maximizing" : "minimizing");

        // Initial population
        List<C> candidates = new ArrayList<>(seeds);
        int toGenerate = Math.max(size - seeds.size(), 0);
        for (int i = 0; i < toGenerate; i++) {
            candidates.add(generator.generate(random, context));
        }
        population = toIndividuals(candidates, evaluateCounted(candidates));
        log.debug("Initial population: {} of {} candidates kept", population.size(), candidates.size());

        archive = archiver.archive(random, new ArrayList<>(population), new ArrayList<>(archive), context);
        notifyObservers();

        while (!shouldTerminate()) {
            List<Individual<C>> parents = selector.select(random, new ArrayList<>(population), context);
            log.debug("Generation {}: selected {} parents", numGenerations, parents.size());

            List<C> offspringCandidates = new ArrayList<>(parents.size());
            for (Individual<C> parent : parents) {
                offspringCandidates.add(parent.candidate());
            }
            for (Variator<C> variator : variators) {
                offspringCandidates = variator.vary(random, offspringCandidates, context);
                log.debug("Generation {}: {} produced {} candidates", numGenerations,
                        variator.getClass().getSimpleName(), offspringCandidates.size());
            }

            List<Individual<C>> offspring = toIndividuals(offspringCandidates, evaluateCounted(offspringCandidates));

            population = replacer.replace(random, new ArrayList<>(population), parents, offspring, context);
            log.debug("Generation {}: {} left {} individuals", numGenerations,
                    replacer.getClass().getSimpleName(), population.size());

            population = migrator.migrate(random, population, context);
            archive = archiver.archive(random, new ArrayList<>(population), new ArrayList<>(archive), context);
            log.debug("Generation {}: archive holds {} individuals", numGenerations, archive.size());

            numGenerations++;
            notifyObservers();
        }

        elapsedMillis = System.currentTimeMillis() - startMillis;
        log.info("Evolution finished after {} generations, {} evaluations ({}), {} ms",
                numGenerations, numEvaluations, terminationCause, elapsedMillis);
        return new ArrayList<>(population);
    }

    /**
     * Population size actually used for a requested size.
     */
    protected int effectivePopulationSize(int requested) {
        return requested;
    }

    /**
     * Fill in parameters whose default depends on the algorithm.
     */
    protected EvolutionConfig applyDefaults(EvolutionConfig config, int popSize) {
        return config;
    }

    private void resetRunScoped(Generator<C> generator, Evaluator<C> evaluator) {
        List<Object> operators = new ArrayList<>();
        operators.add(generator);
        operators.add(evaluator);
        operators.add(selector);
        operators.addAll(variators);
        operators.add(replacer);
        operators.add(migrator);
        operators.add(archiver);
        operators.addAll(terminators);
        operators.addAll(observers);
        for (Object operator : operators) {
            if (operator instanceof RunScoped scoped) {
                scoped.reset();
            }
        }
    }

    private boolean shouldTerminate() {
        for (Terminator<C> terminator : terminators) {
            if (terminator.shouldTerminate(new ArrayList<>(population), context)) {
                terminationCause = terminator.name();
                log.debug("Terminated by {}", terminationCause);
                return true;
            }
        }
        return false;
    }

    private void notifyObservers() {
        for (Observer<C> observer : observers) {
            observer.observe(new ArrayList<>(population), context);
        }
    }

    private List<Fitness> evaluateCounted(List<C> candidates) {
        if (evaluator == null || context == null) {
            throw new IllegalStateException("No run in progress");
        }
        List<Fitness> fitness = evaluator.evaluate(candidates, context);
        if (fitness == null || fitness.size() != candidates.size()) {
            throw new IllegalStateException("Evaluator returned "
                    + (fitness == null ? "null" : fitness.size() + " values") + " for "
                    + candidates.size() + " candidates");
        }
        numEvaluations += fitness.size();
        return fitness;
    }

    private List<Individual<C>> toIndividuals(List<C> candidates, List<Fitness> fitness) {
        List<Individual<C>> individuals = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            Fitness f = fitness.get(i);
            if (f == null) {
                log.warn("Excluding candidate without fitness: {}", candidates.get(i));
                continue;
            }
            individuals.add(new Individual<>(candidates.get(i), f, maximize));
        }
        return individuals;
    }

    // ========== Operators ==========

    public Selector<C> getSelector() {
        return selector;
    }

    public void setSelector(@NotNull Selector<C> selector) {
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    public List<Variator<C>> getVariators() {
        return variators;
    }

    public void setVariator(@NotNull Variator<C> variator) {
        setVariators(List.of(variator));
    }

    /**
     * Variation pipeline, applied in order.
     */
    public void setVariators(@NotNull List<? extends Variator<C>> variators) {
        this.variators = List.copyOf(variators);
    }

    public Replacer<C> getReplacer() {
        return replacer;
    }

    public void setReplacer(@NotNull Replacer<C> replacer) {
        this.replacer = Objects.requireNonNull(replacer, "replacer");
    }

    public Migrator<C> getMigrator() {
        return migrator;
    }

    public void setMigrator(@NotNull Migrator<C> migrator) {
        this.migrator = Objects.requireNonNull(migrator, "migrator");
    }

    public Archiver<C> getArchiver() {
        return archiver;
    }

    public void setArchiver(@NotNull Archiver<C> archiver) {
        this.archiver = Objects.requireNonNull(archiver, "archiver");
    }

    public List<Terminator<C>> getTerminators() {
        return terminators;
    }

    public void setTerminator(@NotNull Terminator<C> terminator) {
        setTerminators(List.of(terminator));
    }

    /**
     * Terminators, combined with a short-circuit OR.
     */
    public void setTerminators(@NotNull List<? extends Terminator<C>> terminators) {
        if (terminators.isEmpty()) {
            throw new IllegalArgumentException("At least one terminator is required");
        }
        this.terminators = List.copyOf(terminators);
    }

    public List<Observer<C>> getObservers() {
        return observers;
    }

    public void setObservers(@NotNull List<? extends Observer<C>> observers) {
        this.observers = List.copyOf(observers);
    }

    public void addObserver(@NotNull Observer<C> observer) {
        List<Observer<C>> updated = new ArrayList<>(observers);
        updated.add(observer);
        this.observers = List.copyOf(updated);
    }

    // ========== Getters ==========

    public EvolutionRandom getRandom() {
        return random;
    }

    public List<Individual<C>> getPopulation() {
        return new ArrayList<>(population);
    }

    public List<Individual<C>> getArchive() {
        return new ArrayList<>(archive);
    }

    public long getNumEvaluations() {
        return numEvaluations;
    }

    public long getNumGenerations() {
        return numGenerations;
    }

    public @Nullable String getTerminationCause() {
        return terminationCause;
    }

    /**
     * Context of the current or last run, null before the first run.
     */
    public @Nullable EvolutionContext<C> getContext() {
        return context;
    }

    public EvolutionStats getStats() {
        return new EvolutionStats(
                numGenerations,
                numEvaluations,
                population.size(),
                archive.size(),
                terminationCause,
                FitnessStatistics.supports(population) ? FitnessStatistics.of(population) : null,
                elapsedMillis,
                random.getInitialSeed()
        );
    }

    private final class View implements EngineView<C> {

        @Override
        public long numEvaluations() {
            return numEvaluations;
        }

        @Override
        public long numGenerations() {
            return numGenerations;
        }

        @Override
        public int populationSize() {
            return populationSize;
        }

        @Override
        public List<Individual<C>> population() {
            return new ArrayList<>(population);
        }

        @Override
        public List<Individual<C>> archive() {
            return new ArrayList<>(archive);
        }

        @Override
        public Bounder<C> bounder() {
            return bounder;
        }

        @Override
        public boolean maximize() {
            return maximize;
        }

        @Override
        public List<Fitness> evaluate(List<C> candidates) {
            return evaluateCounted(candidates);
        }
    }
}
