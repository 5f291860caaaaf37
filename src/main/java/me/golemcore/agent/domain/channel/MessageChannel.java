package me.golemcore.agent.domain.channel;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO channel between one producer side and one consumer side.
 *
 * <p>
 * Either side may {@link #close()} the channel:
 * <ul>
 * <li>the producer closes to signal end-of-stream; items already queued are
 * still delivered, after which receivers observe exhaustion</li>
 * <li>the consumer closes to signal it is no longer listening; further sends
 * are rejected</li>
 * </ul>
 *
 * <p>
 * A full channel suspends the sender until space frees up, the channel closes,
 * or the send times out. No item is ever dropped silently: a rejected send is
 * reported through the return value.
 *
 * @param <T>
 *            item type
 */
public class MessageChannel<T> {

    private final int capacity;
    private final Deque<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed = false;

    public MessageChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Blocks until the item is queued or the channel is closed.
     *
     * @return {@code true} if queued, {@code false} if the channel is closed
     */
    public boolean send(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        lock.lockInterruptibly();
        try {
            while (!closed && queue.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            queue.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits at most {@code timeout} for space.
     *
     * @return {@code true} if queued, {@code false} if the channel is closed or
     *         still full when the timeout elapsed
     */
    public boolean offer(T item, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!closed && queue.size() >= capacity) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            if (closed) {
                return false;
            }
            queue.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available or the channel is exhausted.
     *
     * @return the next item, or {@code null} once closed and drained
     */
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                notEmpty.await();
            }
            return takeLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits at most {@code timeout} for an item.
     *
     * @return the next item, or {@code null} on timeout or exhaustion; use
     *         {@link #isExhausted()} to tell the two apart
     */
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return takeLocked();
        } finally {
            lock.unlock();
        }
    }

    private T takeLocked() {
        T item = queue.pollFirst();
        if (item != null) {
            notFull.signal();
        }
        return item;
    }

    /**
     * Closes the channel and wakes every waiting sender and receiver. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closed and nothing left to receive.
     */
    public boolean isExhausted() {
        lock.lock();
        try {
            return closed && queue.isEmpty();
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
