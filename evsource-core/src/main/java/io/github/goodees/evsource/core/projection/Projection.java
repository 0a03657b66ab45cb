package io.github.goodees.evsource.core.projection;

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
import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Definition of a projection together with its current data.
 *
 * <p>Instances are snapshots. The engine keeps the live copy and hands out a fresh instance from
 * {@link EventProjection#getProjection(String)} every time.
 */
@Value.Immutable
@ValueStyle
public abstract class Projection {

    public abstract String getId();

    public abstract String getName();

    public abstract ProjectionType getType();

    /**
     * Restrict the projection to a single aggregate.
     * @return aggregate id
     */
    public abstract Optional<String> getAggregateId();

    public abstract Optional<String> getAggregateType();

    /**
     * Event types the projection consumes. At least one is required.
     * @return event types
     */
    public abstract Set<EventType> getEventTypes();

    /**
     * Name under which the handler was {@linkplain EventProjection#registerHandler(String, ProjectionHandler)
     * registered}. Used when no handler instance is given.
     * @return handler type
     */
    public abstract Optional<String> getHandlerType();

    @Value.Auxiliary
    public abstract Optional<ProjectionHandler> getHandler();

    @Value.Auxiliary
    public abstract Optional<Object> getData();

    public abstract Map<String, Object> getMetadata();

    @Value.Default
    public boolean isActive() {
        return true;
    }

    @Value.Default
    public long getVersion() {
        return 0;
    }

    public abstract Optional<Instant> getCreatedAt();

    public abstract Optional<Instant> getUpdatedAt();

    @Value.Auxiliary
    public abstract Optional<Instant> getLastProcessed();

    /**
     * Whether the event passes event type and aggregate filters of this projection.
     * @param event the event
     * @return true if the projection is interested in the event
     */
    public boolean accepts(Event event) {
        if (!getEventTypes().contains(event.getType())) {
            return false;
        }
        if (getAggregateId().isPresent() && !getAggregateId().get().equals(event.getAggregateId())) {
            return false;
        }
        return !getAggregateType().isPresent() || getAggregateType().get().equals(event.getAggregateType());
    }

    public static ImmutableProjection.Builder builder() {
        return ImmutableProjection.builder();
    }
}
