package com.agentmesh.core.memory;

import java.time.Instant;

/**
 * A keyed value held by a {@link MemoryManager}.
 *
 * @param key        lookup key
 * @param value      stored value
 * @param importance importance between 0 and 1
 * @param storedAt   when the value was stored
 */
public record MemoryEntry(String key, Object value, double importance, Instant storedAt) {

    public MemoryEntry {
        if (importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("Importance must be between 0 and 1: " + importance);
        }
    }
}
