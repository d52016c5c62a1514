package com.agentmesh.core.memory;

/**
 * Who may read a {@link ContextEntry}.
 */
public enum ContextScope {
    /** Only the owning agent. */
    PRIVATE,
    /** The owner and the agents listed in {@code sharedWith}; everyone when that list is empty. */
    SHARED,
    /** Every agent. */
    GLOBAL
}
