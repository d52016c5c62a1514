package com.agentmesh.core.memory;

import java.time.Instant;
import java.util.Set;

/**
 * A scoped fact held by the {@link ContextProtocol}. Scope and audience change in place when the
 * entry is shared; everything else is fixed. Entries returned by a relevance query are copies
 * whose {@link #relevanceScore()} belongs to that query.
 */
public final class ContextEntry {

    private final String id;
    private final ContextType type;
    private final String ownerAgentId;
    private final Object content;
    private final double importance;
    private final Instant timestamp;
    private final Instant expiresAt;

    private final double relevanceScore;

    private volatile ContextScope scope;
    private volatile Set<String> sharedWith;

    ContextEntry(String id, ContextType type, ContextScope scope, String ownerAgentId, Set<String> sharedWith,
                 Object content, double importance, Instant timestamp, Instant expiresAt) {
        this(id, type, scope, ownerAgentId, sharedWith, content, importance, timestamp, expiresAt, 0.0);
    }

    private ContextEntry(String id, ContextType type, ContextScope scope, String ownerAgentId, Set<String> sharedWith,
                         Object content, double importance, Instant timestamp, Instant expiresAt,
                         double relevanceScore) {
        this.id = id;
        this.type = type;
        this.scope = scope;
        this.ownerAgentId = ownerAgentId;
        this.sharedWith = Set.copyOf(sharedWith);
        this.content = content;
        this.importance = importance;
        this.timestamp = timestamp;
        this.expiresAt = expiresAt;
        this.relevanceScore = relevanceScore;
    }

    public String id() { return id; }
    public ContextType type() { return type; }
    public ContextScope scope() { return scope; }
    public String ownerAgentId() { return ownerAgentId; }
    public Set<String> sharedWith() { return sharedWith; }
    public Object content() { return content; }
    public double importance() { return importance; }
    public Instant timestamp() { return timestamp; }
    public Instant expiresAt() { return expiresAt; }
    public double relevanceScore() { return relevanceScore; }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isVisibleTo(String agentId) {
        return switch (scope) {
            case GLOBAL -> true;
            case SHARED -> ownerAgentId.equals(agentId) || sharedWith.isEmpty() || sharedWith.contains(agentId);
            case PRIVATE -> ownerAgentId.equals(agentId);
        };
    }

    synchronized void reshare(ContextScope newScope, Set<String> audience) {
        this.sharedWith = Set.copyOf(audience);
        this.scope = newScope;
    }

    /** Detached copy carrying one retrieval's score; the stored entry is left untouched. */
    synchronized ContextEntry scored(double score) {
        return new ContextEntry(id, type, scope, ownerAgentId, sharedWith, content, importance, timestamp,
                expiresAt, score);
    }

    @Override
    public String toString() {
        return "ContextEntry[" + id + ", " + type + ", " + scope + ", owner=" + ownerAgentId + "]";
    }
}
