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
import io.github.goodees.evsource.core.store.EventStoreException;

import java.util.List;

/**
 * Keeps the version ledger of aggregates and arbitrates between the version a caller presents and the version the
 * log holds.
 *
 * <p>Every write attempts version {@code current + 1}. An event carrying a different, non-zero version is a
 * {@linkplain VersionConflict conflict}, which is recorded and resolved by the configured
 * {@link ConflictResolution}. Only {@link ConflictResolution#REJECT} surfaces as an exception.
 */
public interface EventVersioning {

    /**
     * Version ledger of an aggregate. The ledger is created from the store on first access, aggregate unknown to the
     * store starts at version 0.
     * @param aggregateId the aggregate
     * @return copy of the ledger
     * @throws EventStoreException when the store cannot be read
     */
    VersionInfo getVersion(String aggregateId) throws EventStoreException;

    /**
     * Assign next version to an event.
     * @param aggregateId the aggregate
     * @param event the event. Version 0 means the version should be assigned.
     * @return the version the event should be stored with
     * @throws EventStoreException with fault {@code OPTIMISTIC_LOCK} when the event conflicts and conflicts are rejected
     */
    long incrementVersion(String aggregateId, Event event) throws EventStoreException;

    /**
     * Check that the aggregate is at expected version. Mismatch is recorded as a conflict. No version is changed.
     * @param aggregateId the aggregate
     * @param expectedVersion version the caller expects
     * @throws EventStoreException with fault {@code OPTIMISTIC_LOCK} on mismatch
     */
    void validateVersion(String aggregateId, long expectedVersion) throws EventStoreException;

    /**
     * Newest history entries of an aggregate.
     * @param aggregateId the aggregate
     * @param limit maximum number of entries, {@code limit <= 0} returns all retained entries
     * @return entries, oldest first
     * @throws EventStoreException when the store cannot be read
     */
    List<VersionHistoryEntry> getVersionHistory(String aggregateId, int limit) throws EventStoreException;

    void addVersionHistory(String aggregateId, VersionHistoryEntry entry) throws EventStoreException;

    /**
     * Apply configured policy to a conflict.
     * @param conflict the conflict
     * @return resolved version
     * @throws EventStoreException with fault {@code OPTIMISTIC_LOCK} when the policy rejects conflicts
     */
    long resolveVersionConflict(VersionConflict conflict) throws EventStoreException;

    /**
     * Conflicts recorded for an aggregate, oldest first.
     * @param aggregateId the aggregate
     * @return recorded conflicts
     */
    List<VersionConflict> getVersionConflicts(String aggregateId);

    VersioningStats getVersioningStats();

    /**
     * Drop cached ledger of an aggregate, so that it is read from the store on next access. Recorded conflicts are
     * kept.
     * @param aggregateId the aggregate
     */
    void forget(String aggregateId);
}
