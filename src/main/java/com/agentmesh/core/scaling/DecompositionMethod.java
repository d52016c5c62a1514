package com.agentmesh.core.scaling;

public enum DecompositionMethod {
    NONE,
    REQUIREMENT_BASED,
    HIERARCHICAL,
    DIVIDE_AND_CONQUER
}
