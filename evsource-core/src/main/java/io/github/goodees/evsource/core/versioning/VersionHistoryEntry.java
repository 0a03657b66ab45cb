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

import io.github.goodees.evsource.core.EventType;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of a version assigned to an aggregate.
 */
public final class VersionHistoryEntry {
    private final long version;
    private final String eventId;
    private final Instant timestamp;
    private final EventType eventType;
    private final String description;

    public VersionHistoryEntry(long version, String eventId, Instant timestamp, EventType eventType,
                               String description) {
        this.version = version;
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.eventType = eventType;
        this.description = description;
    }

    public VersionHistoryEntry(long version, String eventId, Instant timestamp, EventType eventType) {
        this(version, eventId, timestamp, eventType, null);
    }

    public long getVersion() {
        return version;
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public EventType getEventType() {
        return eventType;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VersionHistoryEntry)) {
            return false;
        }
        VersionHistoryEntry that = (VersionHistoryEntry) o;
        return version == that.version && Objects.equals(eventId, that.eventId)
                && Objects.equals(timestamp, that.timestamp) && eventType == that.eventType
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, eventId, timestamp, eventType, description);
    }

    @Override
    public String toString() {
        return "VersionHistoryEntry[version=" + version + ", event=" + eventId + ", type=" + eventType + "]";
    }
}
