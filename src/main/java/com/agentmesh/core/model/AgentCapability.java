package com.agentmesh.core.model;

/**
 * A named skill an agent declares at construction, with a proficiency between 0 and 1.
 */
public record AgentCapability(String name, String description, double proficiency) {

    public AgentCapability {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability name must not be blank");
        }
        if (proficiency < 0.0 || proficiency > 1.0) {
            throw new IllegalArgumentException("Proficiency must be within [0, 1]: " + proficiency);
        }
        description = description != null ? description : "";
    }

    public static AgentCapability of(String name, double proficiency) {
        return new AgentCapability(name, name.replace('_', ' '), proficiency);
    }
}
