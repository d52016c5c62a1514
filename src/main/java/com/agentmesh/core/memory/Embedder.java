package com.agentmesh.core.memory;

/**
 * Turns text into a fixed-length unit vector.
 * <p>
 * Implementations must return vectors of {@link #dimension()} entries and must be deterministic
 * for identical input. Text without any token maps to the zero vector.
 */
public interface Embedder {

    float[] embed(String text);

    int dimension();
}
