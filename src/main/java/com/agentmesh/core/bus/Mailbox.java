package com.agentmesh.core.bus;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded per-agent priority queue. Higher priority first, FIFO by enqueue order within a
 * priority. Each mailbox has its own lock so agents never contend with each other.
 */
final class Mailbox {

    private record Entry(Message message, long sequence) {}

    private static final Comparator<Entry> ORDER =
            Comparator.comparingInt((Entry e) -> e.message().priority()).reversed()
                    .thenComparingLong(Entry::sequence);

    private final String agentId;
    private final int capacity;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean closed;

    Mailbox(String agentId, int capacity) {
        this.agentId = agentId;
        this.capacity = capacity;
    }

    String agentId() {
        return agentId;
    }

    /** Returns false if the mailbox is full or closed. */
    boolean offer(Message message) {
        lock.lock();
        try {
            if (closed || queue.size() >= capacity) {
                return false;
            }
            queue.add(new Entry(message, sequence.getAndIncrement()));
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next live message. Expired messages met on the way are discarded and
     * reported to {@code onExpired}.
     *
     * @param timeout maximum wait; null means wait until a message arrives or the mailbox closes,
     *                zero or negative returns at once
     */
    Optional<Message> take(Duration timeout, Consumer<Message> onExpired) throws InterruptedException {
        long remainingNanos = timeout != null ? timeout.toNanos() : Long.MAX_VALUE;
        lock.lockInterruptibly();
        try {
            while (true) {
                Entry head = queue.poll();
                while (head != null && head.message().isExpired(Instant.now())) {
                    onExpired.accept(head.message());
                    head = queue.poll();
                }
                if (head != null) {
                    return Optional.of(head.message());
                }
                if (closed || remainingNanos <= 0) {
                    return Optional.empty();
                }
                if (timeout == null) {
                    notEmpty.await();
                } else {
                    remainingNanos = notEmpty.awaitNanos(remainingNanos);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /** Closes the mailbox, wakes waiting receivers and returns how many messages were discarded. */
    int close() {
        lock.lock();
        try {
            closed = true;
            int discarded = queue.size();
            queue.clear();
            notEmpty.signalAll();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        return closed;
    }
}
