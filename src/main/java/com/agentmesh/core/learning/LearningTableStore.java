package com.agentmesh.core.learning;

import java.util.Optional;

/**
 * Saves and loads engine snapshots under a name, e.g. the owning agent's id.
 */
public interface LearningTableStore {

    void save(String name, LearningSnapshot snapshot);

    Optional<LearningSnapshot> load(String name);
}
