package com.agentmesh.core.bus;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Envelope delivered through the {@link MessageBus}.
 *
 * @param id               unique message id, also the correlation key for replies
 * @param sender           sending agent id
 * @param recipient        target agent id, or {@link #BROADCAST} for every registered agent
 * @param type             message type
 * @param priority         higher values are delivered first
 * @param payload          arbitrary content
 * @param timestamp        creation time
 * @param ttl              time to live; {@link Duration#ZERO} means the message never expires
 * @param correlationId    id of the message this one answers (nullable)
 * @param requiresResponse whether the sender waits for a reply
 */
public record Message(
    String id,
    String sender,
    String recipient,
    MessageType type,
    int priority,
    Object payload,
    Instant timestamp,
    Duration ttl,
    String correlationId,
    boolean requiresResponse
) {

    public static final String BROADCAST = "*";
    public static final int DEFAULT_PRIORITY = 5;

    public Message {
        id = id != null ? id : UUID.randomUUID().toString();
        timestamp = timestamp != null ? timestamp : Instant.now();
        ttl = ttl != null ? ttl : Duration.ZERO;
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must not be negative");
        }
    }

    public static Message of(String sender, String recipient, MessageType type, Object payload) {
        return new Message(null, sender, recipient, type, DEFAULT_PRIORITY, payload, null,
                Duration.ZERO, null, false);
    }

    public static Message request(String sender, String recipient, MessageType type, int priority,
                                  Object payload, Duration ttl) {
        return new Message(null, sender, recipient, type, priority, payload, null, ttl, null, true);
    }

    /** Builds a reply addressed to this message's sender and correlated with its id. */
    public Message replyTo(String sender, MessageType type, Object payload) {
        return new Message(null, sender, this.sender, type, priority, payload, null,
                Duration.ZERO, id, false);
    }

    public Message withRecipient(String newRecipient) {
        return new Message(UUID.randomUUID().toString(), sender, newRecipient, type, priority, payload,
                timestamp, ttl, correlationId, requiresResponse);
    }

    public Message withPriority(int newPriority) {
        return new Message(id, sender, recipient, type, newPriority, payload, timestamp, ttl,
                correlationId, requiresResponse);
    }

    public boolean isBroadcast() {
        return BROADCAST.equals(recipient);
    }

    public boolean isExpired(Instant now) {
        if (ttl.isZero()) {
            return false;
        }
        return now.isAfter(timestamp.plus(ttl));
    }
}
