package io.github.manjago.darwin.engine;

import io.github.manjago.darwin.config.EvolutionConfig;

/**
 * Everything an operator may consult during a run.
 *
 * @param config  fixed parameters
 * @param scratch mutable per-run values
 * @param engine  read-only engine handle
 */
public record EvolutionContext<C>(EvolutionConfig config, RunScratch scratch, EngineView<C> engine) {
}
