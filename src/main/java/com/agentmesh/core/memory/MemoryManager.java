package com.agentmesh.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-agent working memory: a bounded short-term ring buffer plus an unbounded long-term map.
 * <p>
 * Short-term entries whose importance reaches the consolidation threshold are copied to
 * long-term storage as they are stored. {@link #consolidate()} catches up entries that were
 * below the threshold when stored but are not any more, e.g. after the threshold was lowered.
 */
public class MemoryManager {

    private static final Logger log = LoggerFactory.getLogger(MemoryManager.class);

    public static final int DEFAULT_SHORT_TERM_CAPACITY = 100;
    public static final double DEFAULT_CONSOLIDATION_THRESHOLD = 0.7;

    private static final class Slot {
        final MemoryEntry entry;
        boolean promoted;

        Slot(MemoryEntry entry) {
            this.entry = entry;
        }
    }

    private final Slot[] ring;
    private int head;
    private int size;
    private final Map<String, MemoryEntry> longTerm = new HashMap<>();
    private double consolidationThreshold;

    public MemoryManager() {
        this(DEFAULT_SHORT_TERM_CAPACITY, DEFAULT_CONSOLIDATION_THRESHOLD);
    }

    public MemoryManager(int shortTermCapacity, double consolidationThreshold) {
        if (shortTermCapacity < 1) {
            throw new IllegalArgumentException("Short-term capacity must be positive: " + shortTermCapacity);
        }
        this.ring = new Slot[shortTermCapacity];
        setConsolidationThreshold(consolidationThreshold);
    }

    /**
     * Appends to the ring buffer, overwriting the oldest entry when full. Promotes the entry to
     * long-term storage at once when its importance is at or above the threshold.
     */
    public synchronized MemoryEntry storeShortTerm(String key, Object value, double importance) {
        var slot = new Slot(new MemoryEntry(key, value, importance, Instant.now()));
        ring[(head + size) % ring.length] = slot;
        if (size < ring.length) {
            size++;
        } else {
            head = (head + 1) % ring.length;
        }
        if (importance >= consolidationThreshold) {
            promote(slot);
        }
        return slot.entry;
    }

    public synchronized MemoryEntry storeLongTerm(String key, Object value, double importance) {
        var entry = new MemoryEntry(key, value, importance, Instant.now());
        longTerm.put(key, entry);
        return entry;
    }

    /** Newest short-term entry for {@code key}, else the long-term one. */
    public synchronized Optional<MemoryEntry> retrieve(String key) {
        for (int i = size - 1; i >= 0; i--) {
            var slot = ring[(head + i) % ring.length];
            if (slot.entry.key().equals(key)) {
                return Optional.of(slot.entry);
            }
        }
        return Optional.ofNullable(longTerm.get(key));
    }

    /** Up to {@code n} short-term entries, newest first. */
    public synchronized List<MemoryEntry> recentShortTerm(int n) {
        var recent = new ArrayList<MemoryEntry>();
        for (int i = size - 1; i >= 0 && recent.size() < n; i--) {
            recent.add(ring[(head + i) % ring.length].entry);
        }
        return recent;
    }

    /** @return number of entries promoted by this sweep */
    public synchronized int consolidate() {
        int promoted = 0;
        for (int i = 0; i < size; i++) {
            var slot = ring[(head + i) % ring.length];
            if (!slot.promoted && slot.entry.importance() >= consolidationThreshold) {
                promote(slot);
                promoted++;
            }
        }
        if (promoted > 0) {
            log.debug("Consolidated {} short-term entries", promoted);
        }
        return promoted;
    }

    private void promote(Slot slot) {
        longTerm.put(slot.entry.key(), slot.entry);
        slot.promoted = true;
    }

    /** Removes {@code key} from both stores. */
    public synchronized boolean forget(String key) {
        boolean removed = longTerm.remove(key) != null;
        var kept = new ArrayList<Slot>(size);
        for (int i = 0; i < size; i++) {
            var slot = ring[(head + i) % ring.length];
            if (slot.entry.key().equals(key)) {
                removed = true;
            } else {
                kept.add(slot);
            }
        }
        if (kept.size() != size) {
            rebuild(kept);
        }
        return removed;
    }

    private void rebuild(List<Slot> kept) {
        Arrays.fill(ring, null);
        for (int i = 0; i < kept.size(); i++) {
            ring[i] = kept.get(i);
        }
        head = 0;
        size = kept.size();
    }

    public synchronized Optional<MemoryEntry> longTerm(String key) {
        return Optional.ofNullable(longTerm.get(key));
    }

    public synchronized void setConsolidationThreshold(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Threshold must be between 0 and 1: " + threshold);
        }
        this.consolidationThreshold = threshold;
    }

    public synchronized double consolidationThreshold() {
        return consolidationThreshold;
    }

    public synchronized int shortTermSize() {
        return size;
    }

    public synchronized int longTermSize() {
        return longTerm.size();
    }

    public synchronized void clearShortTerm() {
        rebuild(List.of());
    }
}
