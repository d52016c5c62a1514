package com.agentmesh.core.bus;

import com.agentmesh.core.model.AgentUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process message bus with per-agent bounded priority queues, broadcast, topic pub/sub and
 * request/response correlation.
 * <p>
 * Each agent's queue is guarded by its own lock; registration, topics and pending replies live in
 * concurrent maps. A full queue drops the message and counts it; retrying is the caller's job.
 */
public class MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private final int queueCapacity;
    private final int historySize;

    private final ConcurrentHashMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> topicSubscribers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Message>> pendingResponses = new ConcurrentHashMap<>();

    private final ConcurrentLinkedDeque<Message> history = new ConcurrentLinkedDeque<>();
    private final AtomicInteger historyCount = new AtomicInteger();

    private final AtomicLong totalMessages = new AtomicLong();
    private final AtomicLong broadcasts = new AtomicLong();
    private final AtomicLong directMessages = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();

    public MessageBus() {
        this(DEFAULT_QUEUE_CAPACITY, DEFAULT_HISTORY_SIZE);
    }

    public MessageBus(int queueCapacity, int historySize) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.historySize = Math.max(0, historySize);
    }

    // -- Registration ---------------------------------------------------------

    public void register(String agentId) {
        mailboxes.computeIfAbsent(agentId, id -> {
            log.debug("Registered agent {} on message bus", id);
            return new Mailbox(id, queueCapacity);
        });
    }

    public void unregister(String agentId) {
        Mailbox mailbox = mailboxes.remove(agentId);
        if (mailbox == null) {
            log.debug("Unregister ignored, agent {} not registered", agentId);
            return;
        }
        int discarded = mailbox.close();
        if (discarded > 0) {
            dropped.addAndGet(discarded);
            log.warn("Agent {} unregistered with {} undelivered message(s)", agentId, discarded);
        }
        topicSubscribers.values().forEach(subscribers -> subscribers.remove(agentId));
        log.debug("Unregistered agent {} from message bus", agentId);
    }

    public boolean isRegistered(String agentId) {
        return mailboxes.containsKey(agentId);
    }

    public Set<String> registeredAgents() {
        return Set.copyOf(mailboxes.keySet());
    }

    // -- Sending --------------------------------------------------------------

    /**
     * Enqueues a message for its recipient, or for every registered agent except the sender when
     * the recipient is {@link Message#BROADCAST}. A reply correlated with a pending
     * {@link #sendAndWaitResponse} call completes that call instead of being queued.
     *
     * @return false if the message was already expired, the recipient is unknown, or a target
     *         queue was full
     */
    public boolean send(Message message) {
        if (message.isExpired(Instant.now())) {
            expired.incrementAndGet();
            log.debug("Message {} from {} expired before send", message.id(), message.sender());
            return false;
        }
        totalMessages.incrementAndGet();
        recordHistory(message);

        if (message.correlationId() != null) {
            CompletableFuture<Message> waiting = pendingResponses.remove(message.correlationId());
            if (waiting != null) {
                directMessages.incrementAndGet();
                waiting.complete(message);
                return true;
            }
        }

        if (message.isBroadcast()) {
            return broadcast(message);
        }

        directMessages.incrementAndGet();
        Mailbox mailbox = mailboxes.get(message.recipient());
        if (mailbox == null) {
            dropped.incrementAndGet();
            log.warn("Dropping message {}: recipient {} is not registered", message.id(), message.recipient());
            return false;
        }
        if (!mailbox.offer(message)) {
            dropped.incrementAndGet();
            log.warn("Dropping message {}: queue for {} is full ({} messages)",
                    message.id(), message.recipient(), queueCapacity);
            return false;
        }
        log.debug("Queued {} message {} from {} to {} (priority {})",
                message.type(), message.id(), message.sender(), message.recipient(), message.priority());
        return true;
    }

    private boolean broadcast(Message message) {
        broadcasts.incrementAndGet();
        boolean allDelivered = true;
        for (Mailbox mailbox : mailboxes.values()) {
            if (mailbox.agentId().equals(message.sender())) {
                continue;
            }
            if (!mailbox.offer(message)) {
                dropped.incrementAndGet();
                allDelivered = false;
                log.warn("Broadcast {} dropped for {}: queue full", message.id(), mailbox.agentId());
            }
        }
        return allDelivered;
    }

    /**
     * Sends a message and blocks until a reply carrying its id as correlation id arrives.
     *
     * @throws AgentUnavailableException if the message cannot be delivered
     * @throws ResponseTimeoutException  if no reply arrives within {@code timeout}
     */
    public Message sendAndWaitResponse(Message message, Duration timeout) {
        var future = new CompletableFuture<Message>();
        pendingResponses.put(message.id(), future);
        if (!send(message)) {
            pendingResponses.remove(message.id());
            throw new AgentUnavailableException("Could not deliver message " + message.id()
                    + " to " + message.recipient());
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ResponseTimeoutException("No response to message " + message.id() + " from "
                    + message.recipient() + " within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResponseTimeoutException("Interrupted waiting for response to " + message.id(), e);
        } catch (ExecutionException e) {
            throw new AgentUnavailableException("Response to " + message.id() + " failed", e.getCause());
        } catch (CancellationException e) {
            throw new AgentUnavailableException("Message bus shut down while waiting for " + message.id(), e);
        } finally {
            pendingResponses.remove(message.id());
        }
    }

    // -- Receiving ------------------------------------------------------------

    /**
     * Waits for the next message for {@code agentId}, discarding any whose TTL has elapsed.
     *
     * @param timeout maximum wait; null waits indefinitely, zero or negative only polls
     * @return the message, or empty on timeout, unknown agent, or interruption
     */
    public Optional<Message> receive(String agentId, Duration timeout) {
        Mailbox mailbox = mailboxes.get(agentId);
        if (mailbox == null) {
            log.debug("Receive for unregistered agent {}", agentId);
            return Optional.empty();
        }
        try {
            return mailbox.take(timeout, m -> {
                expired.incrementAndGet();
                log.debug("Discarded expired message {} for {}", m.id(), agentId);
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    // -- Pub/sub --------------------------------------------------------------

    public void subscribe(String agentId, String topic) {
        topicSubscribers.computeIfAbsent(topic, t -> ConcurrentHashMap.newKeySet()).add(agentId);
        log.debug("Agent {} subscribed to topic {}", agentId, topic);
    }

    public void unsubscribe(String agentId, String topic) {
        Set<String> subscribers = topicSubscribers.get(topic);
        if (subscribers != null) {
            subscribers.remove(agentId);
        }
    }

    public Set<String> subscribers(String topic) {
        Set<String> subscribers = topicSubscribers.get(topic);
        return subscribers != null ? Set.copyOf(subscribers) : Set.of();
    }

    /**
     * Delivers a copy of {@code message} to every subscriber of {@code topic} other than the
     * sender, through the direct send path.
     *
     * @return number of subscribers the message was queued for
     */
    public int publish(String topic, Message message) {
        Set<String> subscribers = topicSubscribers.get(topic);
        if (subscribers == null || subscribers.isEmpty()) {
            log.debug("No subscribers for topic {}", topic);
            return 0;
        }
        int delivered = 0;
        for (String subscriber : subscribers) {
            if (subscriber.equals(message.sender())) {
                continue;
            }
            if (send(message.withRecipient(subscriber))) {
                delivered++;
            }
        }
        return delivered;
    }

    // -- Inspection -----------------------------------------------------------

    private void recordHistory(Message message) {
        if (historySize == 0) {
            return;
        }
        history.addLast(message);
        if (historyCount.incrementAndGet() > historySize) {
            if (history.pollFirst() != null) {
                historyCount.decrementAndGet();
            }
        }
    }

    /** Most recent messages sent, oldest first. */
    public List<Message> history() {
        return new ArrayList<>(history);
    }

    public int queueSize(String agentId) {
        Mailbox mailbox = mailboxes.get(agentId);
        return mailbox != null ? mailbox.size() : 0;
    }

    public BusStatistics statistics() {
        var sizes = new HashMap<String, Integer>();
        mailboxes.forEach((id, mailbox) -> sizes.put(id, mailbox.size()));
        return new BusStatistics(
                totalMessages.get(),
                broadcasts.get(),
                directMessages.get(),
                dropped.get(),
                expired.get(),
                mailboxes.size(),
                pendingResponses.size(),
                sizes);
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    /** Closes every mailbox, waking blocked receivers. */
    public void shutdown() {
        for (String agentId : List.copyOf(mailboxes.keySet())) {
            unregister(agentId);
        }
        pendingResponses.values().forEach(f -> f.cancel(false));
        pendingResponses.clear();
    }
}
