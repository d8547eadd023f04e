package io.github.manjago.darwin.preset;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.engine.Variator;
import io.github.manjago.darwin.replacement.GenerationalReplacer;
import io.github.manjago.darwin.selection.RankSelector;
import io.github.manjago.darwin.variation.BitFlipMutation;
import io.github.manjago.darwin.variation.NPointCrossover;

import java.util.List;

/**
 * Canonical generational GA: rank selection of a full population of parents,
 * n-point crossover followed by a mutation, generational replacement with
 * {@code numElites} elites.
 *
 * @param <E> allele type
 */
public class GeneticAlgorithm<E> extends EvolutionEngine<List<E>> {

    public GeneticAlgorithm(EvolutionRandom random, Variator<List<E>> mutation) {
        super(random);
        setSelector(new RankSelector<>());
        setVariators(List.of(new NPointCrossover<E>(), mutation));
        setReplacer(new GenerationalReplacer<>());
    }

    /**
     * GA over 0/1 strings with bit-flip mutation.
     */
    public static GeneticAlgorithm<Integer> binary(EvolutionRandom random) {
        return new GeneticAlgorithm<>(random, new BitFlipMutation());
    }

    @Override
    protected EvolutionConfig applyDefaults(EvolutionConfig config, int popSize) {
        if (config.numSelected() > 0) {
            return config;
        }
        return config.toBuilder().numSelected(popSize).build();
    }
}
