package com.delta.opportunities.pipeline.submission;

import java.time.Duration;
import java.time.Instant;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded priority queue for one platform: lower tier first, then earlier deadline (none last),
 * then arrival order.
 */
public class PlatformSubmissionQueue {
    private final String platform;
    private final int capacity;
    private final PriorityQueue<QueuedSubmission> queue = new PriorityQueue<>(QueuedSubmission.PRIORITY);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong sequence = new AtomicLong();

    public PlatformSubmissionQueue(String platform, int capacity) {
        this.platform = platform;
        this.capacity = Math.max(1, capacity);
    }

    public String platform() {
        return platform;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Returns false when the queue is full or the attempt is already queued.
     */
    public boolean offer(long attemptId, long applicationId, int tier, Instant deadline) {
        lock.lock();
        try {
            if (queue.size() >= capacity) {
                return false;
            }
            for (QueuedSubmission queued : queue) {
                if (queued.attemptId() == attemptId) {
                    return false;
                }
            }
            queue.add(new QueuedSubmission(attemptId, applicationId, tier, deadline, sequence.incrementAndGet()));
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public QueuedSubmission poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return queue.poll();
        } finally {
            lock.unlock();
        }
    }

    public int removeApplication(long applicationId) {
        lock.lock();
        try {
            int before = queue.size();
            queue.removeIf(queued -> queued.applicationId() == applicationId);
            return before - queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
}
