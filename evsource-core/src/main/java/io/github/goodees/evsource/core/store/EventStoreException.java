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

/**
 * Exception generated when an operation on the event store or on versioning fails. None of the failures described here
 * has side effects, the caller may fix the input and try again.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /** Malformed input, e. g. event without id. */
        VALIDATION,
        /** Versions of stored events would not form gapless sequence. */
        CONTINUITY,
        /** Aggregate, version or snapshot does not exist. */
        NOT_FOUND,
        /** Expected version differs from the actual one and the conflict was rejected. */
        OPTIMISTIC_LOCK,
        /** Store is closed or otherwise unusable. */
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException invalidEvent(Event event, String reason) {
        return new EventStoreException(Fault.VALIDATION, "Event validation failed: " + reason
                + (event != null && event.getId() != null ? " (event " + event.getId() + ")" : ""), null);
    }

    public static EventStoreException versionGap(String aggregateId, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.CONTINUITY, "Aggregate " + aggregateId
                + " version gap detected: expected " + expectedVersion + ", got " + actualVersion, null);
    }

    public static EventStoreException firstVersion(String aggregateId, long actualVersion) {
        return new EventStoreException(Fault.CONTINUITY, "First event version should be 1 for aggregate "
                + aggregateId + ", got " + actualVersion, null);
    }

    public static EventStoreException aggregateNotFound(String aggregateId) {
        return new EventStoreException(Fault.NOT_FOUND, "Aggregate not found: " + aggregateId, null);
    }

    public static EventStoreException versionNotFound(String aggregateId, long version) {
        return new EventStoreException(Fault.NOT_FOUND, "Version " + version + " not found for aggregate "
                + aggregateId, null);
    }

    public static EventStoreException snapshotNotFound(String aggregateId) {
        return new EventStoreException(Fault.NOT_FOUND, "Snapshot not found for aggregate: " + aggregateId, null);
    }

    public static EventStoreException optimisticLock(String aggregateId, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateId
                + " version conflict: expected " + expectedVersion + ", got " + actualVersion, null);
    }

    public static EventStoreException versionMismatch(String aggregateId, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateId
                + " version mismatch: expected " + expectedVersion + ", actual " + actualVersion, null);
    }

    public static EventStoreException closed() {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event store is closed", null);
    }

    public static EventStoreException serializationFailed(Event event, Throwable cause) {
        return new EventStoreException(Fault.VALIDATION, "Failed to serialize event " + event.getId()
                + " for validation. " + cause.getMessage(), cause);
    }
}
