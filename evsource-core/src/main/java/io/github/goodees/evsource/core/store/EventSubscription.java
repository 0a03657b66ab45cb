package io.github.goodees.evsource.core.store;

/*-
 * #%L
 * evsource-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.evsource.core.Event;
import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Subscription to events committed by a store.
 *
 * <p>A subscription first yields the historical events it was created with, then the events the store
 * {@linkplain #offer(Event) offers} to it after creation, until it is {@linkplain #close() closed}. Live events are
 * buffered in a bounded queue. When the queue is full, the event is dropped for this subscriber and a warning is
 * logged. The store never waits for a slow subscriber.
 *
 * <p>Consumers read with {@link #next(long, TimeUnit)}, {@link #take()} or {@link #forEach(Consumer)}. All of them
 * return promptly when the subscription is closed from another thread, and respond to interruption.
 */
public class EventSubscription implements AutoCloseable {
    private final String name;
    private final Predicate<? super Event> filter;
    private final Deque<Event> history;
    private final Deque<Event> live = new ArrayDeque<>();
    private final int capacity;
    private final Consumer<EventSubscription> onClose;
    private final Logger logger;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    /**
     * Create new subscription.
     * @param name name used in log messages
     * @param filter events the subscription is interested in
     * @param history events to yield before any live event
     * @param capacity maximum number of buffered live events
     * @param onClose callback for the publisher to unregister the subscription
     * @param logger logger to report dropped events to
     */
    public EventSubscription(String name, Predicate<? super Event> filter, Collection<Event> history, int capacity,
                             Consumer<EventSubscription> onClose, Logger logger) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Subscription capacity must be positive, got " + capacity);
        }
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.filter = Objects.requireNonNull(filter, "Filter must be specified");
        this.history = new ArrayDeque<>(Objects.requireNonNull(history, "History must be specified"));
        this.capacity = capacity;
        this.onClose = Objects.requireNonNull(onClose, "Close callback must be specified");
        this.logger = Objects.requireNonNull(logger, "Logger must be specified");
    }

    public String getName() {
        return name;
    }

    /**
     * Offer a committed event. Never blocks.
     * @param event the event
     * @return true if the event was buffered, false if it did not match, was dropped, or subscription is closed
     */
    public boolean offer(Event event) {
        if (closed || !filter.test(event)) {
            return false;
        }
        lock.lock();
        try {
            if (live.size() >= capacity) {
                dropped.incrementAndGet();
                logger.warn("Subscriber {} queue full, dropping event {} of aggregate {}", name, event.getId(),
                        event.getAggregateId());
                return false;
            }
            live.addLast(event);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retrieve next event without waiting.
     * @return next event, or null if none is available
     */
    public Event poll() {
        lock.lock();
        try {
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for the next event up to given time.
     * @param timeout maximum time to wait
     * @param unit unit of timeout
     * @return next event, or null on timeout or when the subscription is closed
     * @throws InterruptedException when waiting thread is interrupted
     */
    public Event next(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (true) {
                Event event = dequeue();
                if (event != null || closed || nanos <= 0) {
                    return event;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for the next event.
     * @return next event, or null when the subscription is closed
     * @throws InterruptedException when waiting thread is interrupted
     */
    public Event take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                Event event = dequeue();
                if (event != null || closed) {
                    return event;
                }
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pass every event to the consumer until the subscription is closed.
     * @param consumer consumer of the events, may close the subscription to stop the iteration
     * @throws InterruptedException when the iterating thread is interrupted
     */
    public void forEach(Consumer<? super Event> consumer) throws InterruptedException {
        Event event;
        while ((event = take()) != null) {
            consumer.accept(event);
        }
    }

    private Event dequeue() {
        if (closed) {
            return null;
        }
        Event event = history.pollFirst();
        if (event == null) {
            event = live.pollFirst();
        }
        if (event != null) {
            delivered.incrementAndGet();
        }
        return event;
    }

    public long getDeliveredEvents() {
        return delivered.get();
    }

    public long getDroppedEvents() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    // will not throw exception
    @Override
    public void close() {
        if (closed) {
            return;
        }
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            history.clear();
            live.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
        logger.debug("Subscription {} closed after {} events, {} dropped", name, delivered.get(), dropped.get());
    }

    @Override
    public String toString() {
        return "EventSubscription[name=" + name + ", closed=" + closed + ", delivered=" + delivered.get()
                + ", dropped=" + dropped.get() + "]";
    }
}
