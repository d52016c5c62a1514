package com.agentmesh.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Content store ranked by embedding similarity.
 * <p>
 * Retrieval score is the cosine similarity between query and entry embeddings, blended 60/40
 * with attribute overlap when a query context is given, scaled by {@code 0.8 + 0.2*importance}
 * and nudged up by how often the entry has been returned before. At capacity, storing a new key
 * evicts the entry with the lowest {@code importance + accessCount/100}.
 */
public class SemanticMemory {

    private static final Logger log = LoggerFactory.getLogger(SemanticMemory.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private static final class Item {
        final String key;
        final String content;
        final Map<String, Object> context;
        final double importance;
        final float[] embedding;
        final Instant storedAt = Instant.now();
        int accessCount;

        Item(String key, String content, Map<String, Object> context, double importance, float[] embedding) {
            this.key = key;
            this.content = content;
            this.context = context;
            this.importance = importance;
            this.embedding = embedding;
        }

        SemanticMatch toMatch(double score) {
            return new SemanticMatch(key, content, context, importance, accessCount, score);
        }
    }

    private final Embedder embedder;
    private final int capacity;
    private final Map<String, Item> items = new HashMap<>();

    public SemanticMemory(Embedder embedder) {
        this(embedder, DEFAULT_CAPACITY);
    }

    public SemanticMemory(Embedder embedder, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.embedder = embedder;
        this.capacity = capacity;
    }

    public synchronized void store(String key, String content, Map<String, Object> context, double importance) {
        if (importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("Importance must be between 0 and 1: " + importance);
        }
        if (!items.containsKey(key) && items.size() >= capacity) {
            evictOne();
        }
        var ctx = context != null ? Map.copyOf(context) : Map.<String, Object>of();
        items.put(key, new Item(key, content, ctx, importance, embedder.embed(content)));
    }

    private void evictOne() {
        items.values().stream()
                .min(Comparator.comparingDouble(i -> i.importance + i.accessCount / 100.0))
                .ifPresent(victim -> {
                    items.remove(victim.key);
                    log.debug("Evicted semantic memory entry {} (importance {}, accessed {} times)",
                            victim.key, victim.importance, victim.accessCount);
                });
    }

    /**
     * Top {@code topK} entries for {@code query}, best first. Every returned entry's access
     * count is incremented.
     *
     * @param queryContext attributes to match against entry context, or null
     */
    public synchronized List<SemanticMatch> retrieve(String query, Map<String, ?> queryContext, int topK) {
        if (topK <= 0 || items.isEmpty()) {
            return List.of();
        }
        float[] queryVector = embedder.embed(query);
        boolean blend = queryContext != null && !queryContext.isEmpty();

        var scored = new ArrayList<Map.Entry<Item, Double>>();
        for (Item item : items.values()) {
            double similarity = cosine(queryVector, item.embedding);
            if (blend) {
                similarity = 0.6 * similarity + 0.4 * overlap(queryContext, item.context);
            }
            double score = similarity * (0.8 + 0.2 * item.importance)
                    + 0.05 * Math.min(1.0, item.accessCount / 10.0);
            scored.add(Map.entry(item, score));
        }
        scored.sort(Map.Entry.<Item, Double>comparingByValue().reversed());

        var matches = new ArrayList<SemanticMatch>();
        for (var entry : scored.subList(0, Math.min(topK, scored.size()))) {
            Item item = entry.getKey();
            item.accessCount++;
            matches.add(item.toMatch(entry.getValue()));
        }
        return matches;
    }

    public synchronized Optional<SemanticMatch> get(String key) {
        Item item = items.get(key);
        return item != null ? Optional.of(item.toMatch(1.0)) : Optional.empty();
    }

    public synchronized boolean remove(String key) {
        return items.remove(key) != null;
    }

    public synchronized int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Share of query attributes whose value the entry context carries too. */
    static double overlap(Map<String, ?> query, Map<String, Object> context) {
        if (query.isEmpty()) {
            return 0.0;
        }
        int matching = 0;
        for (var attribute : query.entrySet()) {
            Object value = context.get(attribute.getKey());
            if (value != null && value.equals(attribute.getValue())) {
                matching++;
            }
        }
        return (double) matching / query.size();
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
