package com.agentmesh.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Scoped context shared between agents.
 * <p>
 * Entries live in a single map keyed by id, so changing an entry's scope moves it without
 * copying. Every read skips entries past their expiry; {@link #sweepExpired()} removes them.
 */
public class ContextProtocol {

    private static final Logger log = LoggerFactory.getLogger(ContextProtocol.class);

    private static final Pattern WORDS = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Duration RECENCY_WINDOW = Duration.ofHours(24);

    private final ConcurrentHashMap<String, ContextEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public ContextProtocol() {
        this(Clock.systemUTC());
    }

    public ContextProtocol(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param ttl lifetime of the entry; null or zero means it never expires
     */
    public ContextEntry store(String agentId, ContextType type, ContextScope scope, Object content,
                              double importance, Duration ttl) {
        return store(agentId, type, scope, Set.of(), content, importance, ttl);
    }

    public ContextEntry store(String agentId, ContextType type, ContextScope scope, Collection<String> sharedWith,
                              Object content, double importance, Duration ttl) {
        if (importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("Importance must be between 0 and 1: " + importance);
        }
        Instant now = clock.instant();
        Instant expiresAt = ttl == null || ttl.isZero() ? null : now.plus(ttl);
        var entry = new ContextEntry("ctx-" + UUID.randomUUID(), type, scope, agentId,
                new HashSet<>(sharedWith), content, importance, now, expiresAt);
        entries.put(entry.id(), entry);
        log.debug("Agent {} stored {} context {} ({})", agentId, type, entry.id(), scope);
        return entry;
    }

    public Optional<ContextEntry> get(String entryId) {
        ContextEntry entry = entries.get(entryId);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /** Live entries {@code agentId} may read. */
    public List<ContextEntry> visibleTo(String agentId) {
        Instant now = clock.instant();
        return entries.values().stream()
                .filter(e -> !e.isExpired(now) && e.isVisibleTo(agentId))
                .sorted(Comparator.comparing(ContextEntry::timestamp))
                .toList();
    }

    /**
     * Best {@code topK} entries visible to {@code agentId} for {@code query}, scored by
     * {@code 0.5*keywordOverlap + 0.3*recency + 0.2*importance}, recency decaying linearly to 0
     * over 24 hours. The returned entries are per-call copies carrying their score.
     */
    public List<ContextEntry> retrieveRelevantContext(String agentId, String query, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        Set<String> queryWords = words(query);
        var scored = new ArrayList<ContextEntry>();
        for (ContextEntry entry : visibleTo(agentId)) {
            double overlap = overlap(queryWords, words(String.valueOf(entry.content())));
            double ageSeconds = Math.max(0, Duration.between(entry.timestamp(), now).toSeconds());
            double recency = Math.max(0.0, 1.0 - ageSeconds / RECENCY_WINDOW.toSeconds());
            scored.add(entry.scored(0.5 * overlap + 0.3 * recency + 0.2 * entry.importance()));
        }
        scored.sort(Comparator.comparingDouble(ContextEntry::relevanceScore).reversed());
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    /**
     * Changes the scope and audience of an existing entry in place.
     *
     * @return false when the entry is unknown or expired
     */
    public boolean shareContext(String entryId, ContextScope scope, Collection<String> targetAgents) {
        Optional<ContextEntry> entry = get(entryId);
        if (entry.isEmpty()) {
            log.debug("Cannot share unknown context {}", entryId);
            return false;
        }
        entry.get().reshare(scope, targetAgents != null ? new HashSet<>(targetAgents) : Set.of());
        log.debug("Context {} is now {} (shared with {})", entryId, scope, targetAgents);
        return true;
    }

    public boolean delete(String entryId) {
        return entries.remove(entryId) != null;
    }

    /** Physically removes expired entries. */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (var entry : entries.values()) {
            if (entry.isExpired(now) && entries.remove(entry.id(), entry)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired context entries", removed);
        }
        return removed;
    }

    /** Stored entries, expired ones included until the next sweep. */
    public int size() {
        return entries.size();
    }

    private static Set<String> words(String text) {
        var words = new HashSet<String>();
        if (text == null) {
            return words;
        }
        for (String w : WORDS.split(text.toLowerCase(Locale.ROOT))) {
            if (!w.isEmpty()) words.add(w);
        }
        return words;
    }

    private static double overlap(Set<String> query, Set<String> content) {
        if (query.isEmpty()) {
            return 0.0;
        }
        int common = 0;
        for (String w : query) {
            if (content.contains(w)) common++;
        }
        return (double) common / query.size();
    }
}
