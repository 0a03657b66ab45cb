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

import java.time.Instant;
import java.util.Optional;

/**
 * Position of a projection in the event stream and its failure record.
 */
@Value.Immutable
@ValueStyle
public abstract class ProjectionState {

    public abstract String getProjectionId();

    public abstract Optional<String> getLastEventId();

    public abstract long getLastVersion();

    /**
     * Timestamp of the last applied event.
     * @return event timestamp
     */
    public abstract Optional<Instant> getLastProcessed();

    public abstract long getEventsProcessed();

    /**
     * Number of events the handler failed to apply, after retries.
     * @return error count
     */
    public abstract long getErrorsCount();

    public abstract Optional<Instant> getLastError();

    public abstract Optional<String> getErrorMessage();
}
