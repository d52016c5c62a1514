package com.agentmesh.core.bus;

import com.agentmesh.core.model.AgentUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MessageBusTest {

    private MessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new MessageBus(3, 5);
        bus.register("alpha");
        bus.register("beta");
        bus.register("gamma");
    }

    @AfterEach
    void tearDown() {
        bus.shutdown();
    }

    private static Message at(String sender, String recipient, int priority, String payload) {
        return new Message(null, sender, recipient, MessageType.NOTIFICATION, priority, payload,
                null, Duration.ZERO, null, false);
    }

    @Nested
    @DisplayName("Direct delivery")
    class DirectDelivery {

        @Test
        @DisplayName("higher priority is received first, FIFO within a priority")
        void priorityThenFifo() {
            bus.send(at("alpha", "beta", 1, "low"));
            bus.send(at("alpha", "beta", 9, "urgent"));
            bus.send(at("alpha", "beta", 1, "low-2"));

            assertEquals("urgent", bus.receive("beta", Duration.ZERO).orElseThrow().payload());
            assertEquals("low", bus.receive("beta", Duration.ZERO).orElseThrow().payload());
            assertEquals("low-2", bus.receive("beta", Duration.ZERO).orElseThrow().payload());
            assertTrue(bus.receive("beta", Duration.ZERO).isEmpty());
        }

        @Test
        @DisplayName("full queue drops the message and counts it")
        void fullQueueDrops() {
            for (int i = 0; i < 3; i++) {
                assertTrue(bus.send(at("alpha", "beta", 5, "m" + i)));
            }
            assertFalse(bus.send(at("alpha", "beta", 5, "overflow")));

            assertEquals(3, bus.queueSize("beta"));
            assertEquals(1, bus.statistics().dropped());
        }

        @Test
        @DisplayName("unknown recipient is dropped")
        void unknownRecipient() {
            assertFalse(bus.send(at("alpha", "nobody", 5, "hello")));
            assertEquals(1, bus.statistics().dropped());
        }

        @Test
        @DisplayName("receive for an unregistered agent returns empty")
        void receiveUnregistered() {
            assertTrue(bus.receive("nobody", Duration.ofMillis(10)).isEmpty());
        }

        @Test
        @DisplayName("a zero timeout polls an empty mailbox without waiting")
        void zeroTimeoutPolls() throws Exception {
            var polled = CompletableFuture.supplyAsync(() -> bus.receive("beta", Duration.ZERO));
            assertTrue(polled.get(1, TimeUnit.SECONDS).isEmpty());
        }

        @Test
        @DisplayName("a null timeout waits until a message arrives")
        void nullTimeoutBlocks() throws Exception {
            var waiting = CompletableFuture.supplyAsync(() -> bus.receive("beta", null));
            Thread.sleep(100);
            assertFalse(waiting.isDone());

            bus.send(at("alpha", "beta", 5, "late"));
            assertEquals("late", waiting.get(2, TimeUnit.SECONDS).orElseThrow().payload());
        }

        @Test
        @DisplayName("unregister discards queued messages")
        void unregisterDiscards() {
            bus.send(at("alpha", "beta", 5, "pending"));
            bus.unregister("beta");

            assertFalse(bus.isRegistered("beta"));
            assertEquals(1, bus.statistics().dropped());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("a message past its TTL is not sent")
        void expiredNotSent() {
            var stale = new Message(null, "alpha", "beta", MessageType.NOTIFICATION, 5, "old",
                    Instant.now().minusSeconds(10), Duration.ofSeconds(1), null, false);

            assertFalse(bus.send(stale));
            assertEquals(1, bus.statistics().expired());
            assertEquals(0, bus.queueSize("beta"));
        }

        @Test
        @DisplayName("zero TTL never expires")
        void zeroTtlNeverExpires() {
            var ancient = new Message(null, "alpha", "beta", MessageType.NOTIFICATION, 5, "kept",
                    Instant.now().minus(Duration.ofDays(365)), Duration.ZERO, null, false);

            assertFalse(ancient.isExpired(Instant.now()));
            assertTrue(bus.send(ancient));
            assertEquals("kept", bus.receive("beta", Duration.ZERO).orElseThrow().payload());
        }

        @Test
        @DisplayName("a message that expires while queued is discarded on receive")
        void expiresInQueue() throws InterruptedException {
            var shortLived = Message.request("alpha", "beta", MessageType.REQUEST, 5, "brief", Duration.ofMillis(20));
            assertTrue(bus.send(shortLived));
            Thread.sleep(60);

            assertTrue(bus.receive("beta", Duration.ZERO).isEmpty());
            assertEquals(1, bus.statistics().expired());
        }
    }

    @Nested
    @DisplayName("Broadcast and topics")
    class BroadcastAndTopics {

        @Test
        @DisplayName("broadcast reaches every agent but the sender")
        void broadcastSkipsSender() {
            assertTrue(bus.send(at("alpha", Message.BROADCAST, 5, "all hands")));

            assertEquals(0, bus.queueSize("alpha"));
            assertEquals(1, bus.queueSize("beta"));
            assertEquals(1, bus.queueSize("gamma"));
            assertEquals(1, bus.statistics().broadcasts());
        }

        @Test
        @DisplayName("publish delivers to subscribers other than the sender")
        void publishToSubscribers() {
            bus.subscribe("beta", "deployments");
            bus.subscribe("gamma", "deployments");

            int delivered = bus.publish("deployments", at("beta", null, 5, "v2 live"));

            assertEquals(1, delivered);
            assertEquals(0, bus.queueSize("beta"));
            var received = bus.receive("gamma", Duration.ZERO).orElseThrow();
            assertEquals("gamma", received.recipient());
            assertEquals("v2 live", received.payload());
        }

        @Test
        @DisplayName("publish with no subscribers delivers nothing")
        void publishWithoutSubscribers() {
            assertEquals(0, bus.publish("quiet", at("alpha", null, 5, "anyone?")));
        }

        @Test
        @DisplayName("unregistering removes the agent from its topics")
        void unregisterLeavesTopics() {
            bus.subscribe("beta", "news");
            bus.unregister("beta");
            assertTrue(bus.subscribers("news").isEmpty());
        }
    }

    @Nested
    @DisplayName("Request and response")
    class RequestResponse {

        @Test
        @DisplayName("reply correlated with the request completes the waiting sender")
        void correlatedReply() {
            CompletableFuture.runAsync(() -> {
                var request = bus.receive("beta", Duration.ofSeconds(5)).orElseThrow();
                bus.send(request.replyTo("beta", MessageType.RESPONSE, "pong"));
            });

            var reply = bus.sendAndWaitResponse(
                    Message.request("alpha", "beta", MessageType.REQUEST, 5, "ping", Duration.ZERO),
                    Duration.ofSeconds(5));

            assertEquals("pong", reply.payload());
            assertEquals(0, bus.queueSize("alpha"), "reply should not be queued for the sender");
            assertEquals(0, bus.statistics().pendingResponses());
        }

        @Test
        @DisplayName("no reply within the timeout raises ResponseTimeoutException")
        void timesOut() {
            var request = Message.request("alpha", "beta", MessageType.REQUEST, 5, "ping", Duration.ZERO);
            assertThrows(ResponseTimeoutException.class,
                    () -> bus.sendAndWaitResponse(request, Duration.ofMillis(50)));
            assertEquals(0, bus.statistics().pendingResponses());
        }

        @Test
        @DisplayName("undeliverable request raises AgentUnavailableException")
        void undeliverable() {
            var request = Message.request("alpha", "nobody", MessageType.REQUEST, 5, "ping", Duration.ZERO);
            assertThrows(AgentUnavailableException.class,
                    () -> bus.sendAndWaitResponse(request, Duration.ofSeconds(1)));
        }

        @Test
        @DisplayName("shutdown wakes a blocked receiver")
        void shutdownWakesReceiver() throws Exception {
            var waiting = CompletableFuture.supplyAsync(() -> bus.receive("gamma", null));
            Thread.sleep(50);
            bus.shutdown();
            assertTrue(waiting.get(2, TimeUnit.SECONDS).isEmpty());
        }
    }

    @Test
    @DisplayName("history keeps only the most recent messages")
    void historyIsBounded() {
        for (int i = 0; i < 8; i++) {
            bus.send(at("alpha", Message.BROADCAST, 5, "m" + i));
            bus.receive("beta", Duration.ZERO);
            bus.receive("gamma", Duration.ZERO);
        }
        var history = bus.history();
        assertEquals(5, history.size());
        assertEquals("m3", history.get(0).payload());
        assertEquals(8, bus.statistics().totalMessages());
    }
}
