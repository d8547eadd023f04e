package io.github.manjago.darwin.preset;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.emo.AdaptiveGridArchiver;
import io.github.manjago.darwin.emo.PaesReplacer;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.variation.GaussianMutation;

import java.util.List;

/**
 * Pareto Archived Evolution Strategy: a (1+1) strategy over real vectors whose
 * acceptance consults an adaptive-grid archive.
 */
public class Paes extends EvolutionEngine<List<Double>> {

    public Paes(EvolutionRandom random) {
        super(random);
        AdaptiveGridArchiver<List<Double>> archiver = new AdaptiveGridArchiver<>();
        setArchiver(archiver);
        setVariator(new GaussianMutation());
        setReplacer(new PaesReplacer<>(archiver));
    }
}
