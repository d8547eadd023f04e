package io.github.manjago.darwin.engine;

/**
 * Strategy that keeps state across the calls of one run.
 * The engine calls {@link #reset()} at the start of every run.
 */
public interface RunScoped {

    void reset();
}
