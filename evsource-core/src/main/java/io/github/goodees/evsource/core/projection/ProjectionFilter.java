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

import io.github.goodees.evsource.core.EventType;
import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * Criteria of {@link EventProjection#listProjections(ProjectionFilter)}. Absent criteria match everything.
 */
@Value.Immutable
@ValueStyle
public abstract class ProjectionFilter {

    public abstract Optional<ProjectionType> getType();

    public abstract Optional<String> getAggregateId();

    public abstract Optional<String> getAggregateType();

    public abstract Optional<EventType> getEventType();

    public abstract Optional<Boolean> getActive();

    /**
     * Maximum number of results, {@code 0} for unlimited.
     * @return limit
     */
    @Value.Default
    public int getLimit() {
        return 0;
    }

    @Value.Default
    public int getOffset() {
        return 0;
    }

    public boolean matches(Projection projection) {
        if (getType().isPresent() && getType().get() != projection.getType()) {
            return false;
        }
        if (getAggregateId().isPresent() && !getAggregateId().equals(projection.getAggregateId())) {
            return false;
        }
        if (getAggregateType().isPresent() && !getAggregateType().equals(projection.getAggregateType())) {
            return false;
        }
        if (getEventType().isPresent() && !projection.getEventTypes().contains(getEventType().get())) {
            return false;
        }
        return !getActive().isPresent() || getActive().get() == projection.isActive();
    }

    @Value.Check
    protected void check() {
        if (getLimit() < 0 || getOffset() < 0) {
            throw new IllegalStateException("Limit and offset must not be negative");
        }
    }

    public static ImmutableProjectionFilter.Builder builder() {
        return ImmutableProjectionFilter.builder();
    }

    public static ProjectionFilter all() {
        return builder().build();
    }
}
