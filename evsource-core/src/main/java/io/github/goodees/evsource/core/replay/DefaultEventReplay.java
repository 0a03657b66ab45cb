package io.github.goodees.evsource.core.replay;

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
import io.github.goodees.evsource.core.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Replay engine reading events from an {@link EventStore}.
 *
 * <p>A handler failure is retried according to {@link ReplayConfig#retryStrategy()}. When the event keeps failing, it
 * is counted as failed, or the replay is aborted when {@link ReplayConfig#isStopOnError()} is set.
 */
public class DefaultEventReplay implements EventReplay {
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final EventStore store;
    private final ReplayConfig config;
    private final RetryStrategy retryStrategy;
    private final Clock clock;
    private final Logger logger;

    private long totalReplays;
    private long successfulReplays;
    private long failedReplays;
    private long totalEventsReplayed;
    private long totalReplayNanos;
    private Instant lastReplayTime;
    private String lastReplayError;

    public DefaultEventReplay(EventStore store) {
        this(store, ReplayConfig.defaults());
    }

    public DefaultEventReplay(EventStore store, ReplayConfig config) {
        this(store, config, Clock.systemUTC(), LoggerFactory.getLogger(DefaultEventReplay.class));
    }

    public DefaultEventReplay(EventStore store, ReplayConfig config, Clock clock, Logger logger) {
        this.store = Objects.requireNonNull(store, "Event store must be specified");
        this.config = Objects.requireNonNull(config, "Configuration must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
        this.logger = Objects.requireNonNull(logger, "Logger must be specified");
        this.retryStrategy = config.retryStrategy();
    }

    @Override
    public ReplayProgress replayEvents(String aggregateId, long fromVersion, long toVersion, ReplayHandler handler)
            throws ReplayException {
        List<Event> events = store.getEvents(aggregateId, fromVersion, toVersion);
        return replay("aggregate " + aggregateId, events, handler, config.getStrategy());
    }

    @Override
    public ReplayProgress replayAllEvents(String aggregateId, ReplayHandler handler) throws ReplayException {
        return replay("aggregate " + aggregateId, store.getAllEvents(aggregateId), handler, config.getStrategy());
    }

    @Override
    public ReplayProgress replayEventsByType(EventType type, Instant fromTime, ReplayHandler handler)
            throws ReplayException {
        List<Event> events = new ArrayList<>();
        for (Event event : store.getEventsByType(type, 0)) {
            if (!event.getTimestamp().isBefore(fromTime)) {
                events.add(event);
            }
        }
        return replay("type " + type, events, handler, config.getStrategy());
    }

    @Override
    public ReplayProgress replayFromSnapshot(String aggregateId, long snapshotVersion, ReplayHandler handler)
            throws ReplayException {
        Objects.requireNonNull(handler, "Handler must be specified");
        Snapshot snapshot;
        try {
            snapshot = store.getSnapshot(aggregateId);
        } catch (EventStoreException e) {
            ReplayException failure = ReplayException.storeFailure("load snapshot", e);
            recordReplay(false, Duration.ZERO, 0, failure.getMessage());
            throw failure;
        }
        if (snapshot.getVersion() != snapshotVersion) {
            ReplayException failure = ReplayException.snapshotMismatch(aggregateId, snapshotVersion,
                    snapshot.getVersion());
            recordReplay(false, Duration.ZERO, 0, failure.getMessage());
            throw failure;
        }
        try {
            handler.restoreSnapshot(snapshot);
        } catch (Exception e) {
            ReplayException failure = ReplayException.snapshotRestoreFailed(aggregateId, e);
            recordReplay(false, Duration.ZERO, 0, failure.getMessage());
            throw failure;
        }
        logger.debug("Restored {} from snapshot of aggregate {} at version {}", handler.getHandlerType(),
                aggregateId, snapshotVersion);
        List<Event> events = store.getEvents(aggregateId, snapshotVersion + 1, Long.MAX_VALUE);
        return replay("aggregate " + aggregateId, events, handler, ReplayStrategy.SEQUENTIAL);
    }

    @Override
    public <S> S replayToState(String aggregateId, long targetVersion, StateReplayHandler<S> handler)
            throws ReplayException {
        List<Event> events = store.getEvents(aggregateId, 1, targetVersion);
        replay("aggregate " + aggregateId, events, handler, ReplayStrategy.SEQUENTIAL);
        return handler.getState();
    }

    private ReplayProgress replay(String subject, List<Event> events, ReplayHandler handler, ReplayStrategy strategy)
            throws ReplayException {
        Objects.requireNonNull(handler, "Handler must be specified");
        ProgressTracker tracker = new ProgressTracker(events.size(), clock.instant());
        logger.debug("Replaying {} events of {} to {} using {} strategy", events.size(), subject,
                handler.getHandlerType(), strategy);
        try {
            switch (strategy) {
                case PARALLEL:
                    replayParallel(events, handler, tracker);
                    break;
                case BATCH:
                    replayBatch(events, handler, tracker);
                    break;
                default:
                    replaySequential(events, handler, tracker);
            }
        } catch (ReplayException e) {
            tracker.aborted(e.getMessage());
            ReplayProgress progress = tracker.snapshot();
            recordReplay(false, progress.getElapsedTime(), progress.getProcessedEvents(), e.getMessage());
            logger.warn("Replay of {} aborted: {}", subject, e.getMessage());
            throw e;
        }
        tracker.completed();
        ReplayProgress progress = tracker.snapshot();
        recordReplay(true, progress.getElapsedTime(), progress.getProcessedEvents(), null);
        logger.debug("Replay of {} finished: {} processed, {} failed, {} skipped in {}", subject,
                progress.getProcessedEvents(), progress.getFailedEvents(), progress.getSkippedEvents(),
                progress.getElapsedTime());
        return progress;
    }

    private void replaySequential(List<Event> events, ReplayHandler handler, ProgressTracker tracker)
            throws ReplayException {
        for (Event event : events) {
            if (Thread.currentThread().isInterrupted()) {
                throw ReplayException.interrupted(new InterruptedException("Replay thread interrupted"),
                        tracker.snapshot());
            }
            replayEvent(event, handler, tracker);
        }
    }

    private void replayBatch(List<Event> events, ReplayHandler handler, ProgressTracker tracker)
            throws ReplayException {
        int batchSize = config.getBatchSize();
        for (int start = 0; start < events.size(); start += batchSize) {
            int end = Math.min(start + batchSize, events.size());
            replaySequential(events.subList(start, end), handler, tracker);
            logger.debug("Replayed batch of events {}..{} of {}", start + 1, end, events.size());
        }
    }

    private void replayParallel(List<Event> events, ReplayHandler handler, ProgressTracker tracker)
            throws ReplayException {
        int workers = Math.min(config.getParallelWorkers(), events.size());
        if (workers == 0) {
            return;
        }
        Queue<Event> queue = new ConcurrentLinkedQueue<>(events);
        AtomicReference<ReplayException> abort = new AtomicReference<>();
        String poolName = "evsource-replay-" + POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers,
                r -> new Thread(r, poolName + "-" + threadCounter.incrementAndGet()));
        List<Future<?>> futures = new ArrayList<>(workers);
        try {
            for (int i = 0; i < workers; i++) {
                futures.add(pool.submit(() -> {
                    Event event;
                    while (abort.get() == null && !Thread.currentThread().isInterrupted()
                            && (event = queue.poll()) != null) {
                        try {
                            replayEvent(event, handler, tracker);
                        } catch (ReplayException e) {
                            abort.compareAndSet(null, e);
                        }
                    }
                }));
            }
            pool.shutdown();
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            abort.compareAndSet(null, ReplayException.interrupted(e, tracker.snapshot()));
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            abort.compareAndSet(null, ReplayException.workerFailed(e.getCause(), tracker.snapshot()));
        } finally {
            pool.shutdownNow();
        }
        if (abort.get() != null) {
            throw abort.get();
        }
    }

    private void replayEvent(Event event, ReplayHandler handler, ProgressTracker tracker) throws ReplayException {
        AtomicBoolean handled = new AtomicBoolean();
        Exception failure;
        try {
            failure = retryStrategy.execute(event, () -> {
                handled.set(handler.canHandle(event));
                if (handled.get()) {
                    handler.handle(event);
                }
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ReplayException.interrupted(e, tracker.snapshot());
        }
        if (failure == null && !handled.get()) {
            tracker.skipped();
        } else if (failure == null) {
            tracker.processed(event);
        } else {
            tracker.failed(event, failure);
            if (config.isStopOnError()) {
                throw ReplayException.failedAt(event.getVersion(), failure, tracker.snapshot());
            }
            logger.warn("Replay of event {} of aggregate {} at version {} failed", event.getId(),
                    event.getAggregateId(), event.getVersion(), failure);
        }
        notifyProgress(tracker);
    }

    private void notifyProgress(ProgressTracker tracker) {
        if (config.getProgressListener().isPresent()) {
            try {
                config.getProgressListener().get().onProgress(tracker.snapshot());
            } catch (RuntimeException e) {
                logger.warn("Replay progress listener failed", e);
            }
        }
    }

    private synchronized void recordReplay(boolean success, Duration elapsed, long eventsReplayed, String error) {
        totalReplays++;
        if (success) {
            successfulReplays++;
            totalEventsReplayed += eventsReplayed;
        } else {
            failedReplays++;
            lastReplayError = error;
        }
        totalReplayNanos += elapsed.toNanos();
        lastReplayTime = clock.instant();
    }

    @Override
    public synchronized ReplayStats getReplayStats() {
        return ImmutableReplayStats.builder()
                .totalReplays(totalReplays)
                .successfulReplays(successfulReplays)
                .failedReplays(failedReplays)
                .totalEventsReplayed(totalEventsReplayed)
                .averageReplayTime(Duration.ofNanos(totalReplays == 0 ? 0 : totalReplayNanos / totalReplays))
                .lastReplayTime(Optional.ofNullable(lastReplayTime))
                .lastReplayError(Optional.ofNullable(lastReplayError))
                .build();
    }
}
