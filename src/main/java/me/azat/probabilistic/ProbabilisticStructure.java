package me.azat.probabilistic;

import com.google.common.collect.ImmutableMap;

/**
 * Common surface of every structure a {@link StructureRegistry} can hold.
 * <p>
 * Implementations are not thread safe. Concurrent mutation of one instance must be prevented by
 * the caller.
 */
public interface ProbabilisticStructure {

    StructureType type();

    /**
     * Diagnostics snapshot. Keys are stable snake_case names, values are numbers, booleans,
     * strings or nested maps.
     */
    ImmutableMap<String, Object> getInfo();

    /**
     * Returns the structure to the state it had right after construction.
     */
    void reset();
}
