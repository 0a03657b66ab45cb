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

import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Configuration of {@link InMemoryEventStore}. File and snapshot related options are not used by the in-memory store,
 * they are carried so that the same configuration can be reported and passed to durable implementations.
 */
@Value.Immutable
@ValueStyle
public abstract class EventStoreConfig {
    public static final long DEFAULT_MAX_EVENT_SIZE = 1024 * 1024;

    @Value.Default
    public String getStoreType() {
        return "in-memory";
    }

    @Value.Default
    public String getNodeId() {
        return "eventstore-" + Instant.now().getEpochSecond();
    }

    @Value.Default
    public int getMaxEventsPerFile() {
        return 10000;
    }

    @Value.Default
    public int getCompactionThreshold() {
        return 5000;
    }

    @Value.Default
    public Duration getSnapshotInterval() {
        return Duration.ofHours(1);
    }

    @Value.Default
    public int getSnapshotRetention() {
        return 10;
    }

    /**
     * Maximum size of JSON serialized event in bytes.
     * @return maximum event size
     */
    @Value.Default
    public long getMaxEventSize() {
        return DEFAULT_MAX_EVENT_SIZE;
    }

    /**
     * Age after which events are pruned by background maintenance.
     * @return time to live of events
     */
    @Value.Default
    public Duration getEventTTL() {
        return Duration.ofDays(30);
    }

    /**
     * Capacity of queue of every subscriber.
     * @return buffer size
     */
    @Value.Default
    public int getStreamBufferSize() {
        return 10000;
    }

    /**
     * Period of background maintenance. Zero disables maintenance.
     * @return maintenance interval
     */
    @Value.Default
    public Duration getMaintenanceInterval() {
        return Duration.ZERO;
    }

    public boolean isMaintenanceEnabled() {
        return isPositive(getMaintenanceInterval()) && isPositive(getEventTTL());
    }

    @Value.Check
    protected void check() {
        if (getStreamBufferSize() <= 0) {
            throw new IllegalStateException("Stream buffer size must be positive, got " + getStreamBufferSize());
        }
        if (getMaintenanceInterval().isNegative()) {
            throw new IllegalStateException("Maintenance interval must not be negative");
        }
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    public static ImmutableEventStoreConfig.Builder builder() {
        return ImmutableEventStoreConfig.builder();
    }

    public static EventStoreConfig defaults() {
        return builder().build();
    }
}
