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

import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Value.Immutable
@ValueStyle
public abstract class ProjectionStats {

    public abstract long getTotalProjections();

    public abstract long getActiveProjections();

    public abstract long getEventsProcessed();

    /**
     * Count of projections keyed by {@link ProjectionType#typeName()}.
     * @return projections by type
     */
    public abstract Map<String, Long> getProjectionsByType();

    /**
     * Average time a worker spent on one event, across all matching projections.
     * @return processing time
     */
    public abstract Duration getAverageProcessingTime();

    public abstract double getErrorRate();

    public abstract Optional<Instant> getLastProcessed();

    public abstract int getBackgroundWorkers();

    /**
     * Events dropped because the input or a worker queue was full, or the engine was stopped.
     * @return dropped events
     */
    public abstract long getDroppedEvents();
}
