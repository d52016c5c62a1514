package com.agentmesh.core.orchestrator;

import java.util.Locale;

/**
 * Coarse task type derived from the analyzer's 0-1 score.
 */
public enum ComplexityType {
    SIMPLE,
    MODERATE,
    COMPLEX;

    /** Below 0.3 simple, below 0.6 moderate, otherwise complex. */
    public static ComplexityType fromScore(double score) {
        if (score < 0.3) return SIMPLE;
        if (score < 0.6) return MODERATE;
        return COMPLEX;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
