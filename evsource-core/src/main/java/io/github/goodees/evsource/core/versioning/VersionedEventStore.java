package io.github.goodees.evsource.core.versioning;

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
import io.github.goodees.evsource.core.Payload;
import io.github.goodees.evsource.core.store.AggregateInfo;
import io.github.goodees.evsource.core.store.EventStore;
import io.github.goodees.evsource.core.store.EventStoreException;
import io.github.goodees.evsource.core.store.EventStoreHealth;
import io.github.goodees.evsource.core.store.EventStoreInfo;
import io.github.goodees.evsource.core.store.EventStoreStats;
import io.github.goodees.evsource.core.store.EventSubscription;
import io.github.goodees.evsource.core.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Event store that passes every write through {@link EventVersioning} before handing it to the underlying store.
 * Events may be saved with version 0 and get the next version of their aggregate assigned, explicit versions are
 * subject to conflict resolution.
 *
 * <p>Writes through this store are serialized, so that the ledger and the underlying store stay in step. When the
 * underlying store rejects a batch, the ledgers of the affected aggregates are dropped and reloaded on next write.
 * Reads are passed through unchanged.
 */
public class VersionedEventStore implements EventStore {
    private final EventStore delegate;
    private final EventVersioning versioning;
    private final Logger logger;
    private final ReentrantLock writeLock = new ReentrantLock();

    public VersionedEventStore(EventStore delegate, EventVersioning versioning) {
        this(delegate, versioning, LoggerFactory.getLogger(VersionedEventStore.class));
    }

    public VersionedEventStore(EventStore delegate, EventVersioning versioning, Logger logger) {
        this.delegate = Objects.requireNonNull(delegate, "Event store must be specified");
        this.versioning = Objects.requireNonNull(versioning, "Versioning must be specified");
        this.logger = Objects.requireNonNull(logger, "Logger must be specified");
    }

    public EventVersioning getVersioning() {
        return versioning;
    }

    @Override
    public void saveEvents(List<Event> events) throws EventStoreException {
        Objects.requireNonNull(events, "Events must be specified");
        if (events.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            Set<String> touched = new LinkedHashSet<>();
            List<Event> resolved = new ArrayList<>(events.size());
            try {
                for (Event event : events) {
                    if (event == null || event.getAggregateId() == null || event.getAggregateId().trim().isEmpty()) {
                        throw EventStoreException.invalidEvent(event, "aggregate ID is required");
                    }
                    touched.add(event.getAggregateId());
                    long version = versioning.incrementVersion(event.getAggregateId(), event);
                    resolved.add(event.withVersion(version));
                }
                delegate.saveEvents(resolved);
            } catch (EventStoreException | RuntimeException e) {
                for (String aggregateId : touched) {
                    versioning.forget(aggregateId);
                }
                logger.debug("Versioned write of {} events rejected: {}", events.size(), e.getMessage());
                throw e;
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Event> getEvents(String aggregateId, long fromVersion, long toVersion) {
        return delegate.getEvents(aggregateId, fromVersion, toVersion);
    }

    @Override
    public List<Event> getAllEvents(String aggregateId) {
        return delegate.getAllEvents(aggregateId);
    }

    @Override
    public List<Event> getEventsByType(EventType type, int limit) {
        return delegate.getEventsByType(type, limit);
    }

    @Override
    public List<Event> getEventsByTimeRange(Instant start, Instant end, int limit) {
        return delegate.getEventsByTimeRange(start, end, limit);
    }

    @Override
    public EventSubscription streamEvents(String aggregateId, long fromVersion) throws EventStoreException {
        return delegate.streamEvents(aggregateId, fromVersion);
    }

    @Override
    public EventSubscription streamAllEvents(Instant fromTime) throws EventStoreException {
        return delegate.streamAllEvents(fromTime);
    }

    @Override
    public EventSubscription subscribe(Predicate<? super Event> filter, int bufferSize) throws EventStoreException {
        return delegate.subscribe(filter, bufferSize);
    }

    @Override
    public AggregateInfo getAggregateInfo(String aggregateId) throws EventStoreException {
        return delegate.getAggregateInfo(aggregateId);
    }

    @Override
    public EventStoreStats getEventStats() {
        return delegate.getEventStats();
    }

    @Override
    public EventStoreInfo getStoreInfo() {
        return delegate.getStoreInfo();
    }

    @Override
    public void createSnapshot(String aggregateId, long version, Payload data) throws EventStoreException {
        delegate.createSnapshot(aggregateId, version, data);
    }

    @Override
    public Snapshot getSnapshot(String aggregateId) throws EventStoreException {
        return delegate.getSnapshot(aggregateId);
    }

    @Override
    public EventStoreHealth health() {
        return delegate.health();
    }

    @Override
    public int compactEvents(String aggregateId, long targetVersion) throws EventStoreException {
        return delegate.compactEvents(aggregateId, targetVersion);
    }

    @Override
    public int pruneEvents(Instant before) throws EventStoreException {
        return delegate.pruneEvents(before);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
