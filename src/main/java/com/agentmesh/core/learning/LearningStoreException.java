package com.agentmesh.core.learning;

/**
 * Thrown when learning tables cannot be written, read, or understood.
 */
public class LearningStoreException extends RuntimeException {

    public LearningStoreException(String message) {
        super(message);
    }

    public LearningStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
