package io.github.manjago.darwin.engine;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Mutable values that operators may update during one run,
 * such as the current annealing temperature.
 * Cleared by the engine at the start of every run.
 */
public final class RunScratch {

    private @Nullable Double temperature;
    private final Map<String, Object> values = new HashMap<>();

    public @Nullable Double getTemperature() {
        return temperature;
    }

    public void setTemperature(@Nullable Double temperature) {
        this.temperature = temperature;
    }

    public void put(String key, Object value) {
        values.put(key, value);
    }

    /**
     * Value stored under {@code key}, or null.
     *
     * @throws ClassCastException if the stored value is not of {@code type}
     */
    public <T> @Nullable T get(String key, Class<T> type) {
        return type.cast(values.get(key));
    }

    public void clear() {
        temperature = null;
        values.clear();
    }
}
