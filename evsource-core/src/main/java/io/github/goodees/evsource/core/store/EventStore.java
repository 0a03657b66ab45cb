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
import io.github.goodees.evsource.core.EventType;
import io.github.goodees.evsource.core.Payload;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Append-only ledger of events, versioned per aggregate.
 *
 * <p>For every aggregate the stored versions form the sequence {@code 1, 2, 3, ...} without gaps or repeats. A batch
 * passed to {@link #saveEvents(List)} is either committed as a whole or not at all. Committed events are published to
 * {@linkplain #subscribe(Predicate, int) subscribers}, this is the only way consumers such as projections learn about
 * new events.
 *
 * <p>Implementations are thread safe.
 */
public interface EventStore extends AutoCloseable {

    /**
     * Save single event.
     * @param event the event
     * @throws EventStoreException when the event is invalid or does not follow the last version of its aggregate
     * @see #saveEvents(List)
     */
    default void saveEvent(Event event) throws EventStoreException {
        saveEvents(Collections.singletonList(event));
    }

    /**
     * Atomically save a batch of events. Every event is validated, and continuity of versions is checked for every
     * aggregate in the batch before anything is committed. Empty batch is a no-op.
     *
     * @param events the events in version order
     * @throws EventStoreException with fault {@code VALIDATION} for malformed events, {@code CONTINUITY} for version
     *                             gaps. In both cases nothing is stored.
     */
    void saveEvents(List<Event> events) throws EventStoreException;

    /**
     * Read events of an aggregate within version range.
     * @param aggregateId the aggregate
     * @param fromVersion lowest version, inclusive
     * @param toVersion highest version, inclusive
     * @return events in ascending version order, empty list for unknown aggregate
     */
    List<Event> getEvents(String aggregateId, long fromVersion, long toVersion);

    /**
     * Read all retained events of an aggregate.
     * @param aggregateId the aggregate
     * @return events in ascending version order, empty list for unknown aggregate
     */
    List<Event> getAllEvents(String aggregateId);

    /**
     * Read events of given type across all aggregates.
     * @param type event type
     * @param limit maximum number of events, {@code limit <= 0} means unbounded
     * @return events ordered by timestamp, then aggregate and version
     */
    List<Event> getEventsByType(EventType type, int limit);

    /**
     * Read events across all aggregates that happened strictly between two instants.
     * @param start exclusive lower bound
     * @param end exclusive upper bound
     * @param limit maximum number of events, {@code limit <= 0} means unbounded
     * @return events ordered by timestamp, then aggregate and version
     */
    List<Event> getEventsByTimeRange(Instant start, Instant end, int limit);

    /**
     * Stream events of an aggregate. The subscription yields stored events with version at least
     * {@code fromVersion}, then every event of the aggregate committed later, until it is closed.
     * @param aggregateId the aggregate
     * @param fromVersion first version to yield
     * @return new independent subscription
     * @throws EventStoreException when the store is closed
     */
    EventSubscription streamEvents(String aggregateId, long fromVersion) throws EventStoreException;

    /**
     * Stream events of all aggregates. The subscription yields stored events with timestamp at or after
     * {@code fromTime}, then every such event committed later, until it is closed.
     * @param fromTime earliest timestamp to yield
     * @return new independent subscription
     * @throws EventStoreException when the store is closed
     */
    EventSubscription streamAllEvents(Instant fromTime) throws EventStoreException;

    /**
     * Subscribe to events committed from now on.
     * @param filter events of interest
     * @param bufferSize capacity of the subscriber queue. Events are dropped when it is full.
     * @return new subscription
     * @throws EventStoreException when the store is closed
     */
    EventSubscription subscribe(Predicate<? super Event> filter, int bufferSize) throws EventStoreException;

    /**
     * Rollup of an aggregate.
     * @param aggregateId the aggregate
     * @return the info
     * @throws EventStoreException with fault {@code NOT_FOUND} when no event of the aggregate was ever stored
     */
    AggregateInfo getAggregateInfo(String aggregateId) throws EventStoreException;

    EventStoreStats getEventStats();

    EventStoreInfo getStoreInfo();

    /**
     * Store snapshot of an aggregate, replacing the previous one.
     * @param aggregateId the aggregate
     * @param version version the snapshot represents. Event with exactly this version must be stored.
     * @param data snapshot payload
     * @throws EventStoreException with fault {@code NOT_FOUND} when aggregate or version is not stored
     */
    void createSnapshot(String aggregateId, long version, Payload data) throws EventStoreException;

    /**
     * Latest snapshot of an aggregate.
     * @param aggregateId the aggregate
     * @return the snapshot
     * @throws EventStoreException with fault {@code NOT_FOUND} when no snapshot exists
     */
    Snapshot getSnapshot(String aggregateId) throws EventStoreException;

    EventStoreHealth health();

    /**
     * Irreversibly discard events of an aggregate with version up to target. Intended to be called once a snapshot
     * covers the range. Version of the aggregate is not affected.
     * @param aggregateId the aggregate
     * @param targetVersion highest version to discard
     * @return number of discarded events
     * @throws EventStoreException with fault {@code NOT_FOUND} for unknown aggregate
     */
    int compactEvents(String aggregateId, long targetVersion) throws EventStoreException;

    /**
     * Irreversibly discard events of all aggregates with timestamp at or before given instant, regardless of snapshots.
     * @param before the threshold
     * @return number of discarded events
     * @throws EventStoreException when the store is closed
     */
    int pruneEvents(Instant before) throws EventStoreException;

    /**
     * Close all subscriptions and stop background maintenance. Subsequent writes fail.
     */
    @Override
    void close();
}
