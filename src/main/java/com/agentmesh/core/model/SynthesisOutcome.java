package com.agentmesh.core.model;

import java.util.Collection;

/**
 * Distinguishes full, partial and total failure of a decomposed task.
 */
public enum SynthesisOutcome {
    SUCCEEDED,
    PARTIALLY_SUCCEEDED,
    FAILED;

    public static SynthesisOutcome of(Collection<Result> results) {
        if (results.isEmpty()) {
            return FAILED;
        }
        long succeeded = results.stream().filter(Result::success).count();
        if (succeeded == results.size()) return SUCCEEDED;
        if (succeeded == 0) return FAILED;
        return PARTIALLY_SUCCEEDED;
    }
}
