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

import java.time.Instant;
import java.util.Optional;

/**
 * Rollup of an aggregate as seen by the store. Instances are snapshots, the store creates a new one on every change.
 */
public final class AggregateInfo {
    private final String aggregateId;
    private final String aggregateType;
    private final long version;
    private final long eventCount;
    private final Instant firstEvent;
    private final Instant lastEvent;
    private final Instant lastSnapshot;
    private final long size;

    public AggregateInfo(String aggregateId, String aggregateType, long version, long eventCount, Instant firstEvent,
                         Instant lastEvent, Instant lastSnapshot, long size) {
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.version = version;
        this.eventCount = eventCount;
        this.firstEvent = firstEvent;
        this.lastEvent = lastEvent;
        this.lastSnapshot = lastSnapshot;
        this.size = size;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * Version of the last event ever saved for the aggregate. Compaction and pruning do not lower it.
     * @return current version
     */
    public long getVersion() {
        return version;
    }

    /**
     * Number of events saved for the aggregate.
     * @return event count
     */
    public long getEventCount() {
        return eventCount;
    }

    public Optional<Instant> getFirstEvent() {
        return Optional.ofNullable(firstEvent);
    }

    public Optional<Instant> getLastEvent() {
        return Optional.ofNullable(lastEvent);
    }

    public Optional<Instant> getLastSnapshot() {
        return Optional.ofNullable(lastSnapshot);
    }

    /**
     * Approximate size of saved events in bytes.
     * @return size estimate
     */
    public long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return "AggregateInfo[id=" + aggregateId + ", type=" + aggregateType + ", version=" + version + ", events="
                + eventCount + ", lastEvent=" + lastEvent + ", lastSnapshot=" + lastSnapshot + "]";
    }
}
