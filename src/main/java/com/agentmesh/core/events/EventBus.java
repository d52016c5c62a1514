package com.agentmesh.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for task lifecycle events.
 * <p>
 * Events are routed three ways: to subscribers of the root task, to subscribers of the subtask
 * the event concerns, and to global subscribers. A root task's subscriptions end once its
 * {@value AgentMeshEvent#TASK_SYNTHESIZED} event has been delivered, a subtask's once its
 * {@value AgentMeshEvent#SUBTASK_COMPLETED} event has. This is an observation channel for
 * callers; agents talk to each other over the message bus.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AgentMeshEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AgentMeshEvent>>> subtaskSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AgentMeshEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(AgentMeshEvent event) {
        log.debug("Publishing {} for task {} (subtask {})", event.eventType(), event.taskId(), event.subtaskId());

        deliverAll(taskSubscribers.get(event.taskId()), event);
        if (event.subtaskId() != null) {
            deliverAll(subtaskSubscribers.get(event.subtaskId()), event);
        }
        deliverAll(globalSubscribers, event);

        if (AgentMeshEvent.TASK_SYNTHESIZED.equals(event.eventType())) {
            taskSubscribers.remove(event.taskId());
        } else if (AgentMeshEvent.SUBTASK_COMPLETED.equals(event.eventType()) && event.subtaskId() != null) {
            subtaskSubscribers.remove(event.subtaskId());
        }
    }

    /**
     * Subscribe to every event of a root task, its subtasks' events included.
     *
     * @param taskId   the top-level task to follow
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe early
     */
    public Subscription subscribe(String taskId, Consumer<AgentMeshEvent> consumer) {
        return add(taskSubscribers, taskId, consumer);
    }

    /**
     * Subscribe to a root task's events whose type starts with {@code eventTypePrefix}, for
     * example {@code "subtask."}.
     */
    public Subscription subscribe(String taskId, String eventTypePrefix, Consumer<AgentMeshEvent> consumer) {
        return subscribe(taskId, event -> {
            if (event.eventType().startsWith(eventTypePrefix)) {
                consumer.accept(event);
            }
        });
    }

    /** Subscribe to the events of a single subtask. */
    public Subscription subscribeSubtask(String subtaskId, Consumer<AgentMeshEvent> consumer) {
        return add(subtaskSubscribers, subtaskId, consumer);
    }

    public Subscription subscribeAll(Consumer<AgentMeshEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /** Root tasks and subtasks that currently have subscribers. */
    public int activeSubscriptionKeys() {
        return taskSubscribers.size() + subtaskSubscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static Subscription add(ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AgentMeshEvent>>> index,
                                    String key, Consumer<AgentMeshEvent> consumer) {
        index.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> index.computeIfPresent(key, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    private void deliverAll(List<Consumer<AgentMeshEvent>> subscribers, AgentMeshEvent event) {
        if (subscribers == null) {
            return;
        }
        for (Consumer<AgentMeshEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber threw exception processing event {}: {}",
                        event.eventType(), e.getMessage(), e);
            }
        }
    }
}
