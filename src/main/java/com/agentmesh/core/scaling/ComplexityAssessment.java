package com.agentmesh.core.scaling;

/**
 * @param score raw weighted complexity score (unbounded)
 * @param level bucket the score falls into
 */
public record ComplexityAssessment(double score, ComplexityLevel level) {}
