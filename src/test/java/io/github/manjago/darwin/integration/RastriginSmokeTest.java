package io.github.manjago.darwin.integration;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.RealBounder;
import io.github.manjago.darwin.core.ScalarFitness;
import io.github.manjago.darwin.engine.Evaluator;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.generation.UniformRealGenerator;
import io.github.manjago.darwin.replacement.GenerationalReplacer;
import io.github.manjago.darwin.selection.RankSelector;
import io.github.manjago.darwin.termination.EvaluationTerminator;
import io.github.manjago.darwin.variation.GaussianMutation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of a hand-assembled engine on the one-dimensional Rastrigin function.
 */
@DisplayName("Rastrigin smoke tests")
class RastriginSmokeTest {

    private static final RealBounder BOUNDS = new RealBounder(-5.12, 5.12);

    private static final Evaluator<List<Double>> RASTRIGIN = Evaluator.of(x -> {
        double sum = 10.0 * x.size();
        for (double v : x) {
            sum += v * v - 10.0 * Math.cos(2 * Math.PI * v);
        }
        return new ScalarFitness(sum);
    });

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1, 2, 3, 4, 5})
    @DisplayName("Rank selection with Gaussian mutation finds the global basin")
    void findsMinimum(long seed) {
        EvolutionEngine<List<Double>> engine = new EvolutionEngine<>(new EvolutionRandom(seed));
        engine.setSelector(new RankSelector<>());
        engine.setVariator(new GaussianMutation());
        engine.setReplacer(new GenerationalReplacer<>());
        engine.setTerminator(new EvaluationTerminator<>());

        EvolutionConfig config = EvolutionConfig.builder()
                .randomSeed(seed)
                .numSelected(20)
                .numElites(1)
                .mutationRate(1.0)
                .gaussianStdev(1.0)
                .maxEvaluations(2000)
                .build();

        List<Individual<List<Double>>> result = engine.evolve(
                new UniformRealGenerator(1, BOUNDS), RASTRIGIN, 20, false, BOUNDS, config);

        assertEquals(20, result.size());
        assertEquals(2000, engine.getNumEvaluations());
        Individual<List<Double>> best = Collections.max(result);
        assertTrue(best.requireFitness().objective(0) < 1.0, "best was " + best);
        assertTrue(best.candidate().get(0) >= -5.12 && best.candidate().get(0) <= 5.12);
    }
}
