package io.github.manjago.darwin.preset;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.Bounder;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.StrategyCandidate;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.EvolutionEngine;
import io.github.manjago.darwin.engine.Evaluator;
import io.github.manjago.darwin.engine.Generator;
import io.github.manjago.darwin.engine.RunScoped;
import io.github.manjago.darwin.engine.Variator;
import io.github.manjago.darwin.replacement.PlusReplacer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * (mu + lambda) evolution strategy with one self-adaptive step size per allele.
 *
 * Problems are written against plain real vectors; {@link #evolvePayload}
 * pairs each vector with its step sizes and strips them again before evaluation.
 */
public class EvolutionStrategy extends EvolutionEngine<StrategyCandidate> {

    public EvolutionStrategy(EvolutionRandom random) {
        super(random);
        setVariator(new SelfAdaptiveMutation());
        setReplacer(new PlusReplacer<>());
    }

    /**
     * Evolve real vectors. Initial step sizes are uniform in [0, 1).
     *
     * @param bounder applied to the vector part of each offspring
     */
    public List<Individual<StrategyCandidate>> evolvePayload(Generator<List<Double>> generator,
                                                             Evaluator<List<Double>> evaluator,
                                                             int popSize,
                                                             Collection<List<Double>> seeds,
                                                             boolean maximize,
                                                             Bounder<List<Double>> bounder,
                                                             EvolutionConfig config) {
        resetIfScoped(generator);
        resetIfScoped(evaluator);
        resetIfScoped(bounder);

        List<StrategyCandidate> wrappedSeeds = new ArrayList<>(seeds.size());
        for (List<Double> seed : seeds) {
            wrappedSeeds.add(withRandomStrategy(random, seed));
        }
        Generator<StrategyCandidate> wrappedGenerator =
                (rng, context) -> withRandomStrategy(rng, generator.generate(rng, context));
        Evaluator<StrategyCandidate> wrappedEvaluator =
                (candidates, context) -> payloadFitness(evaluator, candidates, context);
        Bounder<StrategyCandidate> wrappedBounder = (candidate, context) ->
                new StrategyCandidate(bounder.bound(candidate.payload(), context), candidate.strategy());

        return evolve(wrappedGenerator, wrappedEvaluator, popSize, wrappedSeeds, maximize, wrappedBounder, config);
    }

    private static StrategyCandidate withRandomStrategy(EvolutionRandom random, List<Double> payload) {
        List<Double> strategy = new ArrayList<>(payload.size());
        for (int i = 0; i < payload.size(); i++) {
            strategy.add(random.nextDouble());
        }
        return new StrategyCandidate(payload, strategy);
    }

    private static void resetIfScoped(Object operator) {
        if (operator instanceof RunScoped scoped) {
            scoped.reset();
        }
    }

    /**
     * Log-normal step-size update followed by Gaussian perturbation:
     * {@code s' = max(s * exp(tau' * N + tau * N_i), epsilon)}, {@code x' = x + s' * N_i}.
     * Unset {@code tau} and {@code tauPrime} default to {@code 1/sqrt(2 sqrt n)} and
     * {@code 1/sqrt(2n)}.
     */
    public static final class SelfAdaptiveMutation implements Variator<StrategyCandidate> {

        @Override
        public List<StrategyCandidate> vary(EvolutionRandom random, List<StrategyCandidate> candidates,
                                            EvolutionContext<StrategyCandidate> context) {
            EvolutionConfig config = context.config();
            List<StrategyCandidate> mutants = new ArrayList<>(candidates.size());
            for (StrategyCandidate candidate : candidates) {
                int n = candidate.size();
                double tau = config.tau() != null ? config.tau() : 1.0 / Math.sqrt(2.0 * Math.sqrt(n));
                double tauPrime = config.tauPrime() != null ? config.tauPrime() : 1.0 / Math.sqrt(2.0 * n);

                double global = tauPrime * random.nextGaussian();
                List<Double> payload = new ArrayList<>(n);
                List<Double> strategy = new ArrayList<>(n);
                for (int i = 0; i < n; i++) {
                    double step = candidate.strategy().get(i) * Math.exp(global + tau * random.nextGaussian());
                    step = Math.max(step, config.epsilon());
                    strategy.add(step);
                    payload.add(candidate.payload().get(i) + step * random.nextGaussian());
                }
                mutants.add(context.engine().bounder().bound(new StrategyCandidate(payload, strategy), context));
            }
            return mutants;
        }
    }

    private static List<Fitness> payloadFitness(Evaluator<List<Double>> evaluator,
                                                List<StrategyCandidate> candidates,
                                                EvolutionContext<?> context) {
        List<List<Double>> payloads = new ArrayList<>(candidates.size());
        for (StrategyCandidate candidate : candidates) {
            payloads.add(candidate.payload());
        }
        return evaluator.evaluate(payloads, context);
    }
}
