package io.github.manjago.darwin.replacement;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.engine.EngineView;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.Replacer;
import io.github.manjago.darwin.engine.RunScratch;

import java.util.ArrayList;
import java.util.List;

/**
 * Metropolis acceptance: an offspring at least as good as its parent replaces it;
 * a worse one replaces it with probability {@code exp(-|df| / T)}.
 *
 * <p>Temperature schedule, in order of preference:
 * <ol>
 *   <li>{@code temperature} and {@code coolingRate} both set: geometric cooling,
 *       the current value kept in the run scratch</li>
 *   <li>{@code maxEvaluations} set: fraction of the evaluation budget remaining</li>
 *   <li>{@code maxGenerations} set: fraction of the generation budget remaining</li>
 * </ol>
 */
public final class SimulatedAnnealingReplacer<C> implements Replacer<C> {

    @Override
    public List<Individual<C>> replace(EvolutionRandom random, List<Individual<C>> population,
                                       List<Individual<C>> parents, List<Individual<C>> offspring,
                                       EvolutionContext<C> context) {
        double temperature = nextTemperature(context);
        List<Individual<C>> survivors = new ArrayList<>(Math.min(parents.size(), offspring.size()));
        for (int i = 0; i < Math.min(parents.size(), offspring.size()); i++) {
            Individual<C> parent = parents.get(i);
            Individual<C> child = offspring.get(i);
            if (child.isBetterOrEqual(parent)) {
                survivors.add(child);
            } else if (temperature > 0 && random.nextDouble() < acceptance(parent, child, temperature)) {
                survivors.add(child);
            } else {
                survivors.add(parent);
            }
        }
        return survivors;
    }

    static double acceptance(Individual<?> parent, Individual<?> child, double temperature) {
        double delta = Math.abs(parent.requireFitness().objective(0) - child.requireFitness().objective(0));
        return Math.exp(-delta / temperature);
    }

    /**
     * Temperature for the current replacement step.
     *
     * @throws IllegalStateException if no schedule can be derived from the configuration
     */
    static double nextTemperature(EvolutionContext<?> context) {
        EvolutionConfig config = context.config();
        EngineView<?> engine = context.engine();
        if (config.temperature() != null && config.coolingRate() != null) {
            RunScratch scratch = context.scratch();
            double current = scratch.getTemperature() != null ? scratch.getTemperature() : config.temperature();
            double cooled = current * config.coolingRate();
            scratch.setTemperature(cooled);
            return cooled;
        }
        if (config.maxEvaluations() > 0) {
            return (config.maxEvaluations() - engine.numEvaluations()) / (double) config.maxEvaluations();
        }
        if (config.maxGenerations() > 0) {
            return (config.maxGenerations() - engine.numGenerations()) / (double) config.maxGenerations();
        }
        throw new IllegalStateException(
                "Simulated annealing needs temperature and coolingRate, maxEvaluations or maxGenerations");
    }
}
