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
 * Health report of an event store.
 */
@Value.Immutable
@ValueStyle
public abstract class EventStoreHealth {

    public enum Status {
        HEALTHY, STOPPED
    }

    public abstract Status getStatus();

    public abstract String getStoreType();

    public abstract String getNodeId();

    public abstract Instant getTimestamp();

    public abstract long getEventCount();

    public abstract long getStoreSize();

    public abstract Optional<String> getLastError();

    public abstract Map<String, Object> getMetadata();

    public boolean isHealthy() {
        return getStatus() == Status.HEALTHY;
    }
}
