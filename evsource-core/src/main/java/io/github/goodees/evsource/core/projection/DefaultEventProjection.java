package io.github.goodees.evsource.core.projection;

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
import io.github.goodees.evsource.core.EventType;
import io.github.goodees.evsource.core.RetryStrategy;
import io.github.goodees.evsource.core.store.EventStore;
import io.github.goodees.evsource.core.store.EventStoreException;
import io.github.goodees.evsource.core.store.EventSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Projection engine with a fixed pool of workers.
 *
 * <p>Submitted events go to a bounded input queue. A distributor thread moves each event to the queue of worker
 * {@code hash(aggregateId) mod backgroundWorkers}, so all events of an aggregate are applied by one worker in
 * submission order. Nothing blocks the submitter: an event that does not fit into a queue is dropped with a warning.
 *
 * <p>Every projection has its own lock, so a handler is never called concurrently for one projection, while different
 * projections progress in parallel.
 */
public class DefaultEventProjection implements EventProjection {
    static final int REBUILD_LIMIT_PER_TYPE = 10000;

    private static final AtomicInteger ENGINE_COUNTER = new AtomicInteger();

    private enum Lifecycle {
        NEW, RUNNING, STOPPING, STOPPED
    }

    private final EventStore store;
    private final ProjectionConfig config;
    private final RetryStrategy retryStrategy;
    private final Clock clock;
    private final Logger logger;
    private final String name;

    private final ConcurrentMap<String, Registration> projections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ProjectionHandler> handlers = new ConcurrentHashMap<>();
    private final List<EventSubscription> connections = new CopyOnWriteArrayList<>();

    private final BlockingQueue<Event> input;
    private final List<BlockingQueue<Event>> workerQueues;
    private final AtomicLong pending = new AtomicLong();
    private final Object drainMonitor = new Object();

    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong eventsFailed = new AtomicLong();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final AtomicLong workerEvents = new AtomicLong();
    private final AtomicLong workerNanos = new AtomicLong();
    private volatile Instant lastProcessed;

    private volatile Lifecycle lifecycle = Lifecycle.NEW;
    private ExecutorService executor;
    private ScheduledExecutorService reporter;

    public DefaultEventProjection(EventStore store) {
        this(store, ProjectionConfig.defaults());
    }

    public DefaultEventProjection(EventStore store, ProjectionConfig config) {
        this(store, config, Clock.systemUTC(), LoggerFactory.getLogger(DefaultEventProjection.class));
    }

    public DefaultEventProjection(EventStore store, ProjectionConfig config, Clock clock, Logger logger) {
        this.store = Objects.requireNonNull(store, "Event store must be specified");
        this.config = Objects.requireNonNull(config, "Configuration must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
        this.logger = Objects.requireNonNull(logger, "Logger must be specified");
        this.retryStrategy = config.retryStrategy();
        this.name = "evsource-projection-" + ENGINE_COUNTER.incrementAndGet();
        this.input = new ArrayBlockingQueue<>(config.inputQueueCapacity());
        this.workerQueues = new ArrayList<>(config.getBackgroundWorkers());
        for (int i = 0; i < config.getBackgroundWorkers(); i++) {
            workerQueues.add(new ArrayBlockingQueue<>(config.getBatchSize()));
        }
    }

    @Override
    public void createProjection(Projection projection) throws ProjectionException {
        Objects.requireNonNull(projection, "Projection must be specified");
        ProjectionHandler handler = validate(projection);
        synchronized (projections) {
            if (projections.size() >= config.getMaxProjections()) {
                throw ProjectionException.limitReached(config.getMaxProjections());
            }
            if (projections.containsKey(projection.getId())) {
                throw ProjectionException.duplicate(projection.getId());
            }
            Instant now = clock.instant();
            Projection created = ImmutableProjection.copyOf(projection)
                    .withCreatedAt(projection.getCreatedAt().orElse(now))
                    .withUpdatedAt(now);
            projections.put(created.getId(), new Registration(created, handler));
        }
        logger.info("Projection {} of type {} created with handler {}", projection.getId(), projection.getType(),
                handler.getHandlerType());
    }

    @Override
    public void updateProjection(Projection projection) throws ProjectionException {
        Objects.requireNonNull(projection, "Projection must be specified");
        Registration registration = require(projection.getId());
        ProjectionHandler handler = validate(projection);
        registration.lock.lock();
        try {
            Projection current = registration.projection;
            ImmutableProjection updated = ImmutableProjection.copyOf(projection)
                    .withCreatedAt(current.getCreatedAt())
                    .withUpdatedAt(clock.instant())
                    .withVersion(current.getVersion() + 1);
            if (!projection.getData().isPresent()) {
                updated = updated.withData(current.getData());
            }
            registration.projection = updated;
            registration.handler = handler;
        } finally {
            registration.lock.unlock();
        }
        logger.info("Projection {} updated", projection.getId());
    }

    @Override
    public void deleteProjection(String projectionId) throws ProjectionException {
        if (projectionId == null || projections.remove(projectionId) == null) {
            throw ProjectionException.notFound(projectionId);
        }
        logger.info("Projection {} deleted", projectionId);
    }

    @Override
    public Projection getProjection(String projectionId) throws ProjectionException {
        return require(projectionId).current();
    }

    @Override
    public List<Projection> listProjections(ProjectionFilter filter) {
        Objects.requireNonNull(filter, "Filter must be specified");
        Stream<Projection> matching = projections.values().stream()
                .map(Registration::current)
                .filter(filter::matches)
                .sorted(Comparator.comparing(Projection::getId))
                .skip(filter.getOffset());
        if (filter.getLimit() > 0) {
            matching = matching.limit(filter.getLimit());
        }
        return matching.collect(Collectors.toList());
    }

    @Override
    public boolean processEvent(Event event) {
        Objects.requireNonNull(event, "Event must be specified");
        Lifecycle state = lifecycle;
        if (state == Lifecycle.STOPPING || state == Lifecycle.STOPPED) {
            drop(event, "engine is stopped");
            return false;
        }
        pending.incrementAndGet();
        if (!input.offer(event)) {
            completed();
            drop(event, "input queue is full");
            return false;
        }
        return true;
    }

    @Override
    public int processEvents(List<Event> events) {
        int accepted = 0;
        for (Event event : events) {
            if (processEvent(event)) {
                accepted++;
            }
        }
        return accepted;
    }

    @Override
    public long rebuildProjection(String projectionId) throws ProjectionException {
        Registration registration = require(projectionId);
        logger.info("Rebuilding projection {}", projectionId);
        long started = System.nanoTime();
        registration.reset();
        Projection projection = registration.projection;
        List<Event> events;
        if (projection.getAggregateId().isPresent()) {
            events = store.getAllEvents(projection.getAggregateId().get());
        } else {
            events = new ArrayList<>();
            for (EventType type : projection.getEventTypes()) {
                events.addAll(store.getEventsByType(type, REBUILD_LIMIT_PER_TYPE));
            }
            events.sort(Event.CHRONOLOGICAL);
        }
        long applied = 0;
        for (Event event : events) {
            if (!projection.accepts(event)) {
                continue;
            }
            try {
                if (apply(registration, event)) {
                    applied++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Rebuild of projection {} interrupted after {} events", projectionId, applied);
                return applied;
            }
        }
        logger.info("Projection {} rebuilt from {} events, {} applied in {} ms", projectionId, events.size(), applied,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return applied;
    }

    @Override
    public int rebuildAllProjections() {
        List<String> ids = new ArrayList<>(projections.keySet());
        ids.sort(Comparator.naturalOrder());
        int rebuilt = 0;
        for (String id : ids) {
            try {
                rebuildProjection(id);
                rebuilt++;
            } catch (ProjectionException e) {
                logger.warn("Failed to rebuild projection {}", id, e);
            }
        }
        return rebuilt;
    }

    @Override
    public ProjectionState getProjectionState(String projectionId) throws ProjectionException {
        return require(projectionId).state();
    }

    @Override
    public void resetProjection(String projectionId) throws ProjectionException {
        require(projectionId).reset();
        logger.info("Projection {} reset", projectionId);
    }

    @Override
    public ProjectionStats getProjectionStats() {
        Map<String, Long> byType = new TreeMap<>();
        long total = 0;
        long active = 0;
        for (Registration registration : projections.values()) {
            Projection projection = registration.projection;
            byType.merge(projection.getType().typeName(), 1L, Long::sum);
            total++;
            if (projection.isActive()) {
                active++;
            }
        }
        long processed = eventsProcessed.get();
        long failed = eventsFailed.get();
        long handled = workerEvents.get();
        return ImmutableProjectionStats.builder()
                .totalProjections(total)
                .activeProjections(active)
                .eventsProcessed(processed)
                .projectionsByType(byType)
                .averageProcessingTime(Duration.ofNanos(handled == 0 ? 0 : workerNanos.get() / handled))
                .errorRate(processed + failed == 0 ? 0 : (double) failed / (processed + failed))
                .lastProcessed(Optional.ofNullable(lastProcessed))
                .backgroundWorkers(workerQueues.size())
                .droppedEvents(droppedEvents.get())
                .build();
    }

    @Override
    public ProjectionMetrics getProjectionMetrics(String projectionId) throws ProjectionException {
        return require(projectionId).metrics(clock.instant());
    }

    @Override
    public void registerHandler(String handlerType, ProjectionHandler handler) {
        Objects.requireNonNull(handlerType, "Handler type must be specified");
        Objects.requireNonNull(handler, "Handler must be specified");
        handlers.put(handlerType, handler);
        logger.info("Projection handler {} registered", handlerType);
    }

    @Override
    public Optional<ProjectionHandler> getHandler(String handlerType) {
        return Optional.ofNullable(handlerType == null ? null : handlers.get(handlerType));
    }

    @Override
    public EventSubscription connect(EventStore source) throws EventStoreException {
        EventSubscription subscription = source.subscribe(event -> true, config.inputQueueCapacity());
        connections.add(subscription);
        Thread feeder = new Thread(() -> feed(subscription), name + "-" + subscription.getName());
        feeder.setDaemon(true);
        feeder.start();
        logger.info("Projection engine {} connected to event store as {}", name, subscription.getName());
        return subscription;
    }

    private void feed(EventSubscription subscription) {
        try {
            subscription.forEach(this::processEvent);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Feeding of {} from {} interrupted", name, subscription.getName());
        } finally {
            connections.remove(subscription);
            subscription.close();
        }
    }

    @Override
    public synchronized void startBackgroundProcessor() {
        if (lifecycle == Lifecycle.RUNNING) {
            logger.info("Projection engine {} already started", name);
            return;
        }
        if (lifecycle != Lifecycle.NEW) {
            throw new IllegalStateException("Projection engine " + name + " was already stopped");
        }
        int workers = workerQueues.size();
        executor = Executors.newFixedThreadPool(workers + 1, namedThreads(name));
        executor.execute(this::distribute);
        for (int i = 0; i < workers; i++) {
            int index = i;
            executor.execute(() -> work(index, workerQueues.get(index)));
        }
        Duration reportInterval = config.getStateUpdateInterval();
        if (!reportInterval.isZero() && !reportInterval.isNegative()) {
            reporter = Executors.newSingleThreadScheduledExecutor(namedThreads(name + "-stats"));
            reporter.scheduleAtFixedRate(this::reportStats, reportInterval.toMillis(), reportInterval.toMillis(),
                    TimeUnit.MILLISECONDS);
        }
        lifecycle = Lifecycle.RUNNING;
        logger.info("Projection engine {} started with {} workers, input capacity {}", name, workers,
                config.inputQueueCapacity());
    }

    @Override
    public synchronized void stopBackgroundProcessor() {
        if (lifecycle == Lifecycle.STOPPED) {
            return;
        }
        Lifecycle previous = lifecycle;
        lifecycle = Lifecycle.STOPPING;
        for (EventSubscription connection : connections) {
            connection.close();
        }
        if (previous == Lifecycle.RUNNING && !awaitDrain(config.getShutdownTimeout())) {
            logger.warn("Projection engine {} did not drain within {}, {} events undelivered", name,
                    config.getShutdownTimeout(), pending.get());
        }
        lifecycle = Lifecycle.STOPPED;
        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Projection workers of {} did not terminate within {}", name,
                            config.getShutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for workers of {} to terminate", name);
            }
        }
        if (reporter != null) {
            reporter.shutdownNow();
        }
        input.clear();
        workerQueues.forEach(BlockingQueue::clear);
        logger.info("Projection engine {} stopped", name);
    }

    private boolean awaitDrain(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (drainMonitor) {
            while (pending.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(drainMonitor, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    private void completed() {
        if (pending.decrementAndGet() <= 0) {
            synchronized (drainMonitor) {
                drainMonitor.notifyAll();
            }
        }
    }

    private void drop(Event event, String reason) {
        droppedEvents.incrementAndGet();
        logger.warn("Projection engine {} dropping event {} of aggregate {}: {}", name, event.getId(),
                event.getAggregateId(), reason);
    }

    private void distribute() {
        long timeout = config.getBatchTimeout().toMillis();
        while (lifecycle != Lifecycle.STOPPED) {
            Event event;
            try {
                event = input.poll(timeout, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event != null) {
                int index = workerIndex(event.getAggregateId(), workerQueues.size());
                if (!workerQueues.get(index).offer(event)) {
                    completed();
                    drop(event, "queue of worker " + index + " is full");
                }
            }
        }
    }

    static int workerIndex(String aggregateId, int workers) {
        return Math.floorMod(Objects.hashCode(aggregateId), workers);
    }

    private void work(int index, BlockingQueue<Event> queue) {
        long timeout = config.getBatchTimeout().toMillis();
        while (lifecycle != Lifecycle.STOPPED) {
            Event event;
            try {
                event = queue.poll(timeout, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                continue;
            }
            try {
                applyToAll(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Worker {} of {} interrupted while applying event {}", index, name, event.getId());
                return;
            } finally {
                completed();
            }
        }
    }

    private void applyToAll(Event event) throws InterruptedException {
        long started = System.nanoTime();
        for (Registration registration : projections.values()) {
            Projection projection = registration.projection;
            if (projection.isActive() && projection.accepts(event)) {
                apply(registration, event);
            }
        }
        workerEvents.incrementAndGet();
        workerNanos.addAndGet(System.nanoTime() - started);
    }

    /**
     * Apply single event to single projection, recording the outcome.
     * @return true if the handler applied the event
     */
    private boolean apply(Registration registration, Event event) throws InterruptedException {
        registration.lock.lock();
        try {
            ProjectionHandler handler = registration.handler;
            String projectionId = registration.projection.getId();
            long started = System.nanoTime();
            AtomicBoolean handled = new AtomicBoolean();
            AtomicReference<Object> result = new AtomicReference<>();
            Exception failure = retryStrategy.execute(event, () -> {
                handled.set(handler.canHandle(event));
                if (handled.get()) {
                    result.set(handler.project(event, registration.projection));
                }
            });
            if (failure != null) {
                registration.failed(failure, clock.instant());
                eventsFailed.incrementAndGet();
                logger.error("Projection {} failed to apply event {} of aggregate {} at version {}", projectionId,
                        event.getId(), event.getAggregateId(), event.getVersion(), failure);
                return false;
            }
            if (!handled.get()) {
                return false;
            }
            if (result.get() != null) {
                registration.projection = ImmutableProjection.copyOf(registration.projection).withData(result.get());
            }
            Instant now = clock.instant();
            registration.processed(event, System.nanoTime() - started, now);
            eventsProcessed.incrementAndGet();
            lastProcessed = now;
            return true;
        } finally {
            registration.lock.unlock();
        }
    }

    private void reportStats() {
        ProjectionStats stats = getProjectionStats();
        logger.debug("Projection engine {}: {} projections ({} active), {} events processed, error rate {}, "
                + "{} dropped, {} pending", name, stats.getTotalProjections(), stats.getActiveProjections(),
                stats.getEventsProcessed(), stats.getErrorRate(), stats.getDroppedEvents(), pending.get());
    }

    private ProjectionHandler validate(Projection projection) throws ProjectionException {
        if (isBlank(projection.getId())) {
            throw ProjectionException.invalid("projection ID is required");
        }
        if (isBlank(projection.getName())) {
            throw ProjectionException.invalid("projection name is required");
        }
        if (projection.getEventTypes().isEmpty()) {
            throw ProjectionException.invalid("at least one event type is required");
        }
        if (projection.getHandler().isPresent()) {
            return projection.getHandler().get();
        }
        return projection.getHandlerType()
                .map(handlers::get)
                .orElseThrow(() -> ProjectionException.invalid("projection handler is required"));
    }

    private Registration require(String projectionId) throws ProjectionException {
        Registration registration = projectionId == null ? null : projections.get(projectionId);
        if (registration == null) {
            throw ProjectionException.notFound(projectionId);
        }
        return registration;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Live state of one projection. Mutable fields are guarded by {@link #lock}.
     */
    private static final class Registration {
        final ReentrantLock lock = new ReentrantLock();
        volatile Projection projection;
        volatile ProjectionHandler handler;

        private String lastEventId;
        private long lastVersion;
        private Instant lastEventTime;
        private long eventsProcessed;
        private long errorsCount;
        private Instant lastError;
        private String errorMessage;
        private long latencyNanos;
        private Instant firstProcessed;
        private Instant lastProcessed;

        Registration(Projection projection, ProjectionHandler handler) {
            this.projection = projection;
            this.handler = handler;
        }

        void processed(Event event, long latency, Instant now) {
            lastEventId = event.getId();
            lastVersion = event.getVersion();
            lastEventTime = event.getTimestamp();
            eventsProcessed++;
            latencyNanos += latency;
            if (firstProcessed == null) {
                firstProcessed = now;
            }
            lastProcessed = now;
        }

        void failed(Exception failure, Instant now) {
            errorsCount++;
            lastError = now;
            errorMessage = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        }

        void reset() {
            lock.lock();
            try {
                lastEventId = null;
                lastVersion = 0;
                lastEventTime = null;
                eventsProcessed = 0;
                errorsCount = 0;
                lastError = null;
                errorMessage = null;
                latencyNanos = 0;
                firstProcessed = null;
                lastProcessed = null;
            } finally {
                lock.unlock();
            }
        }

        Projection current() {
            lock.lock();
            try {
                return ImmutableProjection.copyOf(projection).withLastProcessed(Optional.ofNullable(lastProcessed));
            } finally {
                lock.unlock();
            }
        }

        ProjectionState state() {
            lock.lock();
            try {
                return ImmutableProjectionState.builder()
                        .projectionId(projection.getId())
                        .lastEventId(Optional.ofNullable(lastEventId))
                        .lastVersion(lastVersion)
                        .lastProcessed(Optional.ofNullable(lastEventTime))
                        .eventsProcessed(eventsProcessed)
                        .errorsCount(errorsCount)
                        .lastError(Optional.ofNullable(lastError))
                        .errorMessage(Optional.ofNullable(errorMessage))
                        .build();
            } finally {
                lock.unlock();
            }
        }

        ProjectionMetrics metrics(Instant now) {
            lock.lock();
            try {
                long attempted = eventsProcessed + errorsCount;
                double errorRate = attempted == 0 ? 0 : (double) errorsCount / attempted;
                double eventsPerSecond = 0;
                if (firstProcessed != null) {
                    double seconds = Duration.between(firstProcessed, now).toNanos() / 1e9;
                    eventsPerSecond = eventsProcessed / Math.max(seconds, 1.0);
                }
                return ImmutableProjectionMetrics.builder()
                        .projectionId(projection.getId())
                        .eventsProcessed(eventsProcessed)
                        .eventsPerSecond(eventsPerSecond)
                        .averageLatency(Duration.ofNanos(eventsProcessed == 0 ? 0 : latencyNanos / eventsProcessed))
                        .errorRate(errorRate)
                        .lastProcessed(Optional.ofNullable(lastProcessed))
                        .health(ProjectionMetrics.Health.fromErrorRate(errorRate))
                        .build();
            } finally {
                lock.unlock();
            }
        }
    }
}
