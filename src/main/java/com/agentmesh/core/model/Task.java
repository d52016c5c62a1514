package com.agentmesh.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A unit of work handed to the orchestrator, either by a caller or by decomposition.
 * <p>
 * Everything except the child id list is fixed at construction. Child ids are only appended
 * through {@link #subtaskOf}, which records the parent id on the child in the same step, so a
 * child id always points to a task whose {@code parentTaskId} is this task.
 */
public final class Task {

    public static final int DEFAULT_PRIORITY = 5;

    private final String id;
    private final String description;
    private final List<String> requirements;
    private final int priority;
    private final String parentTaskId;
    private final List<String> childTaskIds = new CopyOnWriteArrayList<>();
    private final Map<String, Object> context;
    private final Instant createdAt;

    private Task(String id, String description, List<String> requirements, int priority,
                 String parentTaskId, Map<String, Object> context) {
        this.id = Objects.requireNonNull(id, "id");
        this.description = description != null ? description : "";
        this.requirements = requirements != null ? List.copyOf(requirements) : List.of();
        this.priority = priority;
        this.parentTaskId = parentTaskId;
        this.context = context != null ? Collections.unmodifiableMap(new HashMap<>(context)) : Map.of();
        this.createdAt = Instant.now();
    }

    public static Task of(String description, List<String> requirements, int priority,
                          Map<String, Object> context) {
        return new Task(newId(), description, requirements, priority, null, context);
    }

    public static Task of(String description, String... requirements) {
        return of(description, List.of(requirements), DEFAULT_PRIORITY, Map.of());
    }

    /**
     * Creates a child task inheriting the parent's priority and context, merged with
     * {@code extraContext}, and appends its id to the parent.
     */
    public static Task subtaskOf(Task parent, String description, List<String> requirements,
                                 Map<String, Object> extraContext) {
        var merged = new HashMap<>(parent.context);
        if (extraContext != null) {
            merged.putAll(extraContext);
        }
        var child = new Task(newId(), description, requirements, parent.priority, parent.id, merged);
        parent.childTaskIds.add(child.id);
        return child;
    }

    private static String newId() {
        return "task-" + UUID.randomUUID();
    }

    public String id() { return id; }
    public String description() { return description; }
    public List<String> requirements() { return requirements; }
    public int priority() { return priority; }
    public String parentTaskId() { return parentTaskId; }
    public List<String> childTaskIds() { return List.copyOf(childTaskIds); }
    public Map<String, Object> context() { return context; }
    public Instant createdAt() { return createdAt; }

    public boolean isSubtask() {
        return parentTaskId != null;
    }

    /** Word tokens of the description, lower-cased. */
    public List<String> descriptionWords() {
        var words = new ArrayList<String>();
        for (String w : description.toLowerCase().split("\\s+")) {
            if (!w.isBlank()) words.add(w);
        }
        return words;
    }

    @Override
    public String toString() {
        return "Task[" + id + ", requirements=" + requirements + ", priority=" + priority
                + (parentTaskId != null ? ", parent=" + parentTaskId : "") + "]";
    }
}
