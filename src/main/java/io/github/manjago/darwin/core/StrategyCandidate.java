package io.github.manjago.darwin.core;

import java.util.List;

/**
 * Real-valued candidate paired with its self-adaptive step sizes, one per allele.
 *
 * @param payload  the solution evaluated by the problem
 * @param strategy mutation step sizes, same length as {@code payload}
 */
public record StrategyCandidate(List<Double> payload, List<Double> strategy) {

    public StrategyCandidate {
        if (payload.size() != strategy.size()) {
            throw new IllegalArgumentException(
                    "Payload has " + payload.size() + " alleles but strategy has " + strategy.size());
        }
        payload = List.copyOf(payload);
        strategy = List.copyOf(strategy);
    }

    public int size() {
        return payload.size();
    }
}
