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

import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time statistics of an event store.
 */
@Value.Immutable
@ValueStyle
public abstract class EventStoreStats {

    public abstract long getTotalEvents();

    public abstract long getTotalAggregates();

    /**
     * Number of saved events per {@linkplain io.github.goodees.evsource.core.EventType#typeName() type name}.
     * @return counters by type
     */
    public abstract Map<String, Long> getEventsByType();

    public abstract long getStoreSize();

    public abstract long getWriteOperations();

    public abstract long getReadOperations();

    public abstract long getStreamOperations();

    public abstract long getSnapshotCount();

    public abstract Optional<Instant> getLastEvent();

    public abstract double getAverageEventSize();

    public abstract CompactionStats getCompactionStats();
}
