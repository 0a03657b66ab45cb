package io.github.goodees.evsource.store.inmemory;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.evsource.core.Event;
import io.github.goodees.evsource.core.EventType;
import io.github.goodees.evsource.core.Payload;
import io.github.goodees.evsource.core.store.AggregateInfo;
import io.github.goodees.evsource.core.store.CompactionStats;
import io.github.goodees.evsource.core.store.EventStore;
import io.github.goodees.evsource.core.store.EventStoreException;
import io.github.goodees.evsource.core.store.EventStoreHealth;
import io.github.goodees.evsource.core.store.EventStoreInfo;
import io.github.goodees.evsource.core.store.EventStoreStats;
import io.github.goodees.evsource.core.store.EventSubscription;
import io.github.goodees.evsource.core.store.EventValidator;
import io.github.goodees.evsource.core.store.ImmutableCompactionStats;
import io.github.goodees.evsource.core.store.ImmutableEventStoreHealth;
import io.github.goodees.evsource.core.store.ImmutableEventStoreInfo;
import io.github.goodees.evsource.core.store.ImmutableEventStoreStats;
import io.github.goodees.evsource.core.store.JacksonSerialization;
import io.github.goodees.evsource.core.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Event store keeping all data in memory. Useful for tests, and as reference for durable implementations.
 *
 * <p>All writes are serialized by an exclusive lock, reads share a read lock. Committed events are offered to
 * subscribers while the write lock is held, so every subscriber observes events in commit order. Subscribers never
 * block the store, an event that does not fit into a subscriber queue is dropped for that subscriber.
 */
public class InMemoryEventStore implements EventStore {
    static final String STORE_VERSION = "1.0.0";

    private final EventStoreConfig config;
    private final EventValidator validator;
    private final Clock clock;
    private final Logger logger;
    private final Instant startTime;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<StoredEvent>> events = new HashMap<>();
    private final Map<String, AggregateState> aggregates = new HashMap<>();
    private final Map<String, Snapshot> snapshots = new HashMap<>();
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong subscriptionCounter = new AtomicLong();

    // guarded by write lock
    private final Map<String, Long> eventsByType = new LinkedHashMap<>();
    private long totalEvents;
    private long bytesWritten;
    private long storeSize;
    private long writeOperations;
    private long snapshotCount;
    private Instant lastEvent;
    private Instant lastCompaction;
    private long compactionsCount;
    private long eventsCompacted;
    private long eventsPruned;
    private long spaceReclaimed;

    private final AtomicLong readOperations = new AtomicLong();
    private final AtomicLong streamOperations = new AtomicLong();

    private final ScheduledExecutorService maintenance;
    private volatile boolean closed;

    public InMemoryEventStore() {
        this(EventStoreConfig.defaults());
    }

    public InMemoryEventStore(EventStoreConfig config) {
        this(config, LoggerFactory.getLogger(InMemoryEventStore.class.getName() + "." + config.getNodeId()));
    }

    public InMemoryEventStore(EventStoreConfig config, Logger logger) {
        this(config, JacksonSerialization.defaultObjectMapper(), Clock.systemUTC(), logger);
    }

    /**
     * Create the store.
     * @param config configuration
     * @param objectMapper mapper used to measure size of events
     * @param clock clock for snapshot creation and maintenance
     * @param logger logger of the store
     */
    public InMemoryEventStore(EventStoreConfig config, ObjectMapper objectMapper, Clock clock, Logger logger) {
        this.config = Objects.requireNonNull(config, "Configuration must be specified");
        this.validator = new EventValidator(objectMapper, config.getMaxEventSize());
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
        this.logger = Objects.requireNonNull(logger, "Logger must be specified");
        this.startTime = clock.instant();
        this.maintenance = config.isMaintenanceEnabled() ? startMaintenance() : null;
        logger.info("In-memory event store {} initialized, maintenance {}", config.getNodeId(),
                maintenance == null ? "disabled" : "every " + config.getMaintenanceInterval());
    }

    private ScheduledExecutorService startMaintenance() {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "evsource-maintenance-" + config.getNodeId());
            t.setDaemon(true);
            return t;
        });
        long interval = config.getMaintenanceInterval().toMillis();
        executor.scheduleWithFixedDelay(this::runMaintenance, interval, interval, TimeUnit.MILLISECONDS);
        return executor;
    }

    void runMaintenance() {
        Instant threshold = clock.instant().minus(config.getEventTTL());
        logger.debug("Running maintenance, pruning events before {}", threshold);
        try {
            pruneEvents(threshold);
        } catch (EventStoreException e) {
            logger.warn("Maintenance of store {} skipped: {}", config.getNodeId(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Maintenance of store {} failed", config.getNodeId(), e);
        }
    }

    @Override
    public void saveEvents(List<Event> batch) throws EventStoreException {
        Objects.requireNonNull(batch, "Events must be specified");
        if (batch.isEmpty()) {
            return;
        }
        ensureOpen();
        int[] sizes = new int[batch.size()];
        for (int i = 0; i < sizes.length; i++) {
            sizes[i] = validator.check(batch.get(i));
        }
        lock.writeLock().lock();
        try {
            ensureOpen();
            checkContinuity(batch);
            for (int i = 0; i < sizes.length; i++) {
                commit(batch.get(i), sizes[i]);
            }
            writeOperations++;
        } finally {
            lock.writeLock().unlock();
        }
        if (logger.isDebugEnabled()) {
            for (Event event : batch) {
                logger.debug("Event saved: {} type {} aggregate {} version {}", event.getId(), event.getType(),
                        event.getAggregateId(), event.getVersion());
            }
        }
    }

    private void checkContinuity(List<Event> batch) throws EventStoreException {
        Map<String, Long> batchVersions = new HashMap<>();
        for (Event event : batch) {
            String aggregateId = event.getAggregateId();
            long last = batchVersions.containsKey(aggregateId) ? batchVersions.get(aggregateId) : lastVersionOf(aggregateId);
            if (event.getVersion() != last + 1) {
                throw last == 0
                        ? EventStoreException.firstVersion(aggregateId, event.getVersion())
                        : EventStoreException.versionGap(aggregateId, last + 1, event.getVersion());
            }
            batchVersions.put(aggregateId, event.getVersion());
        }
    }

    private long lastVersionOf(String aggregateId) {
        AggregateState state = aggregates.get(aggregateId);
        return state == null ? 0 : state.version;
    }

    private void commit(Event event, int size) {
        events.computeIfAbsent(event.getAggregateId(), id -> new ArrayList<>()).add(new StoredEvent(event, size));

        AggregateState state = aggregates.get(event.getAggregateId());
        if (state == null) {
            state = new AggregateState(event.getAggregateId(), event.getAggregateType(), event.getTimestamp());
            aggregates.put(event.getAggregateId(), state);
        }
        state.version = event.getVersion();
        state.eventCount++;
        state.lastEvent = event.getTimestamp();
        state.size += size;

        totalEvents++;
        bytesWritten += size;
        storeSize += size;
        eventsByType.merge(event.getType().typeName(), 1L, Long::sum);
        lastEvent = event.getTimestamp();

        for (EventSubscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    @Override
    public List<Event> getEvents(String aggregateId, long fromVersion, long toVersion) {
        lock.readLock().lock();
        try {
            List<Event> result = new ArrayList<>();
            for (StoredEvent stored : aggregateLog(aggregateId)) {
                long version = stored.event.getVersion();
                if (version >= fromVersion && version <= toVersion) {
                    result.add(stored.event);
                }
            }
            readOperations.incrementAndGet();
            logger.debug("Retrieved {} events of aggregate {} in versions {}..{}", result.size(), aggregateId,
                    fromVersion, toVersion);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Event> getAllEvents(String aggregateId) {
        lock.readLock().lock();
        try {
            List<Event> result = new ArrayList<>();
            for (StoredEvent stored : aggregateLog(aggregateId)) {
                result.add(stored.event);
            }
            readOperations.incrementAndGet();
            logger.debug("Retrieved all {} events of aggregate {}", result.size(), aggregateId);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Event> getEventsByType(EventType type, int limit) {
        Objects.requireNonNull(type, "Event type must be specified");
        List<Event> result = findAll(e -> e.getType() == type, limit);
        logger.debug("Retrieved {} events of type {}", result.size(), type);
        return result;
    }

    @Override
    public List<Event> getEventsByTimeRange(Instant start, Instant end, int limit) {
        Objects.requireNonNull(start, "Start must be specified");
        Objects.requireNonNull(end, "End must be specified");
        List<Event> result = findAll(e -> e.getTimestamp().isAfter(start) && e.getTimestamp().isBefore(end), limit);
        logger.debug("Retrieved {} events between {} and {}", result.size(), start, end);
        return result;
    }

    private List<Event> findAll(Predicate<Event> predicate, int limit) {
        lock.readLock().lock();
        try {
            List<Event> result = collect(predicate);
            readOperations.incrementAndGet();
            return limit > 0 && result.size() > limit ? new ArrayList<>(result.subList(0, limit)) : result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Event> collect(Predicate<Event> predicate) {
        List<Event> result = new ArrayList<>();
        for (List<StoredEvent> log : events.values()) {
            for (StoredEvent stored : log) {
                if (predicate.test(stored.event)) {
                    result.add(stored.event);
                }
            }
        }
        result.sort(Event.CHRONOLOGICAL);
        return result;
    }

    @Override
    public EventSubscription streamEvents(String aggregateId, long fromVersion) throws EventStoreException {
        Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        lock.readLock().lock();
        try {
            ensureOpen();
            List<Event> history = new ArrayList<>();
            for (StoredEvent stored : aggregateLog(aggregateId)) {
                if (stored.event.getVersion() >= fromVersion) {
                    history.add(stored.event);
                }
            }
            EventSubscription subscription = register("stream-" + aggregateId,
                    e -> aggregateId.equals(e.getAggregateId()), history, config.getStreamBufferSize());
            logger.debug("Event stream {} started from version {} with {} stored events", subscription.getName(),
                    fromVersion, history.size());
            return subscription;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public EventSubscription streamAllEvents(Instant fromTime) throws EventStoreException {
        Objects.requireNonNull(fromTime, "Start time must be specified");
        Predicate<Event> filter = e -> !e.getTimestamp().isBefore(fromTime);
        lock.readLock().lock();
        try {
            ensureOpen();
            List<Event> history = collect(filter);
            EventSubscription subscription = register("stream-all", filter, history, config.getStreamBufferSize());
            logger.debug("Event stream {} started from {} with {} stored events", subscription.getName(), fromTime,
                    history.size());
            return subscription;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public EventSubscription subscribe(Predicate<? super Event> filter, int bufferSize) throws EventStoreException {
        lock.readLock().lock();
        try {
            ensureOpen();
            EventSubscription subscription = register("subscriber", filter, Collections.emptyList(), bufferSize);
            logger.debug("Subscriber {} registered", subscription.getName());
            return subscription;
        } finally {
            lock.readLock().unlock();
        }
    }

    private EventSubscription register(String prefix, Predicate<? super Event> filter, Collection<Event> history,
                                       int bufferSize) {
        String name = prefix + "-" + subscriptionCounter.incrementAndGet();
        EventSubscription subscription = new EventSubscription(name, filter, history, bufferSize,
                subscriptions::remove, logger);
        subscriptions.add(subscription);
        streamOperations.incrementAndGet();
        return subscription;
    }

    @Override
    public AggregateInfo getAggregateInfo(String aggregateId) throws EventStoreException {
        lock.readLock().lock();
        try {
            AggregateState state = aggregates.get(aggregateId);
            if (state == null) {
                throw EventStoreException.aggregateNotFound(aggregateId);
            }
            return state.toInfo();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public EventStoreStats getEventStats() {
        lock.readLock().lock();
        try {
            CompactionStats compaction = ImmutableCompactionStats.builder()
                    .lastCompaction(Optional.ofNullable(lastCompaction))
                    .compactionsCount(compactionsCount)
                    .eventsCompacted(eventsCompacted)
                    .eventsPruned(eventsPruned)
                    .spaceReclaimed(spaceReclaimed)
                    .build();
            return ImmutableEventStoreStats.builder()
                    .totalEvents(totalEvents)
                    .totalAggregates(aggregates.size())
                    .eventsByType(eventsByType)
                    .storeSize(storeSize)
                    .writeOperations(writeOperations)
                    .readOperations(readOperations.get())
                    .streamOperations(streamOperations.get())
                    .snapshotCount(snapshotCount)
                    .lastEvent(Optional.ofNullable(lastEvent))
                    .averageEventSize(totalEvents == 0 ? 0 : (double) bytesWritten / totalEvents)
                    .compactionStats(compaction)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public EventStoreInfo getStoreInfo() {
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("max_events_per_file", config.getMaxEventsPerFile());
        configuration.put("compaction_threshold", config.getCompactionThreshold());
        configuration.put("snapshot_interval", config.getSnapshotInterval().toString());
        configuration.put("snapshot_retention", config.getSnapshotRetention());
        configuration.put("max_event_size", config.getMaxEventSize());
        configuration.put("event_ttl", config.getEventTTL().toString());
        configuration.put("stream_buffer_size", config.getStreamBufferSize());
        configuration.put("maintenance_interval", config.getMaintenanceInterval().toString());
        return ImmutableEventStoreInfo.builder()
                .storeType(config.getStoreType())
                .version(STORE_VERSION)
                .nodeId(config.getNodeId())
                .startTime(startTime)
                .addSupportedFeatures(EventStoreInfo.FEATURE_SAVE_EVENTS, EventStoreInfo.FEATURE_GET_EVENTS,
                        EventStoreInfo.FEATURE_STREAM_EVENTS, EventStoreInfo.FEATURE_SNAPSHOTS,
                        EventStoreInfo.FEATURE_COMPACTION, EventStoreInfo.FEATURE_PRUNING)
                .configuration(configuration)
                .build();
    }

    @Override
    public void createSnapshot(String aggregateId, long version, Payload data) throws EventStoreException {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            ensureOpen();
            AggregateState state = aggregates.get(aggregateId);
            if (state == null) {
                throw EventStoreException.aggregateNotFound(aggregateId);
            }
            Event target = null;
            for (StoredEvent stored : aggregateLog(aggregateId)) {
                if (stored.event.getVersion() == version) {
                    target = stored.event;
                    break;
                }
            }
            if (target == null) {
                throw EventStoreException.versionNotFound(aggregateId, version);
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("node_id", config.getNodeId());
            metadata.put("created_at", now.toString());
            snapshots.put(aggregateId, new Snapshot(aggregateId, target.getAggregateType(), version, data, now,
                    config.getNodeId(), metadata));
            state.lastSnapshot = now;
            snapshotCount++;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Snapshot of aggregate {} created at version {}", aggregateId, version);
    }

    @Override
    public Snapshot getSnapshot(String aggregateId) throws EventStoreException {
        lock.readLock().lock();
        try {
            Snapshot snapshot = snapshots.get(aggregateId);
            if (snapshot == null) {
                throw EventStoreException.snapshotNotFound(aggregateId);
            }
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public EventStoreHealth health() {
        lock.readLock().lock();
        try {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("total_aggregates", aggregates.size());
            metadata.put("write_operations", writeOperations);
            metadata.put("read_operations", readOperations.get());
            metadata.put("snapshot_count", snapshotCount);
            metadata.put("subscribers", subscriptions.size());
            return ImmutableEventStoreHealth.builder()
                    .status(closed ? EventStoreHealth.Status.STOPPED : EventStoreHealth.Status.HEALTHY)
                    .storeType(config.getStoreType())
                    .nodeId(config.getNodeId())
                    .timestamp(clock.instant())
                    .eventCount(totalEvents)
                    .storeSize(storeSize)
                    .metadata(metadata)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int compactEvents(String aggregateId, long targetVersion) throws EventStoreException {
        int compacted = 0;
        lock.writeLock().lock();
        try {
            ensureOpen();
            if (!aggregates.containsKey(aggregateId)) {
                throw EventStoreException.aggregateNotFound(aggregateId);
            }
            List<StoredEvent> log = aggregateLog(aggregateId);
            long reclaimed = 0;
            for (Iterator<StoredEvent> it = log.iterator(); it.hasNext(); ) {
                StoredEvent stored = it.next();
                if (stored.event.getVersion() > targetVersion) {
                    break;
                }
                it.remove();
                reclaimed += stored.size;
                compacted++;
            }
            if (compacted > 0) {
                storeSize -= reclaimed;
                spaceReclaimed += reclaimed;
                eventsCompacted += compacted;
                compactionsCount++;
                lastCompaction = clock.instant();
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (compacted > 0) {
            logger.info("Compacted {} events of aggregate {} up to version {}", compacted, aggregateId, targetVersion);
        }
        return compacted;
    }

    @Override
    public int pruneEvents(Instant before) throws EventStoreException {
        Objects.requireNonNull(before, "Threshold must be specified");
        int pruned = 0;
        lock.writeLock().lock();
        try {
            ensureOpen();
            long reclaimed = 0;
            for (List<StoredEvent> log : events.values()) {
                for (Iterator<StoredEvent> it = log.iterator(); it.hasNext(); ) {
                    StoredEvent stored = it.next();
                    if (!stored.event.getTimestamp().isAfter(before)) {
                        it.remove();
                        reclaimed += stored.size;
                        pruned++;
                    }
                }
            }
            storeSize -= reclaimed;
            spaceReclaimed += reclaimed;
            eventsPruned += pruned;
        } finally {
            lock.writeLock().unlock();
        }
        if (pruned > 0) {
            logger.info("Pruned {} events older than {}", pruned, before);
        }
        return pruned;
    }

    private List<StoredEvent> aggregateLog(String aggregateId) {
        List<StoredEvent> log = events.get(aggregateId);
        return log == null ? Collections.emptyList() : log;
    }

    private void ensureOpen() throws EventStoreException {
        if (closed) {
            throw EventStoreException.closed();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lock.writeLock().unlock();
        }
        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        for (EventSubscription subscription : subscriptions) {
            subscription.close();
        }
        logger.info("In-memory event store {} closed", config.getNodeId());
    }

    private static final class StoredEvent {
        final Event event;
        final int size;

        StoredEvent(Event event, int size) {
            this.event = event;
            this.size = size;
        }
    }

    private static final class AggregateState {
        final String aggregateId;
        final String aggregateType;
        final Instant firstEvent;
        long version;
        long eventCount;
        long size;
        Instant lastEvent;
        Instant lastSnapshot;

        AggregateState(String aggregateId, String aggregateType, Instant firstEvent) {
            this.aggregateId = aggregateId;
            this.aggregateType = aggregateType;
            this.firstEvent = firstEvent;
        }

        AggregateInfo toInfo() {
            return new AggregateInfo(aggregateId, aggregateType, version, eventCount, firstEvent, lastEvent,
                    lastSnapshot, size);
        }
    }
}
