package io.github.goodees.evsource.core.replay;

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
import java.util.Optional;

/**
 * Progress of a single replay. Every event is either processed, failed or skipped by the handler, so when a replay
 * completes {@code processed + failed + skipped == total}.
 */
@Value.Immutable
@ValueStyle
public abstract class ReplayProgress {

    public abstract long getTotalEvents();

    public abstract long getProcessedEvents();

    public abstract long getFailedEvents();

    /**
     * Events the handler declined to handle.
     * @return number of skipped events
     */
    public abstract long getSkippedEvents();

    /**
     * Highest version successfully processed.
     * @return version, 0 if none
     */
    public abstract long getCurrentVersion();

    public abstract Instant getStartTime();

    public abstract Duration getElapsedTime();

    /**
     * Share of events already replayed.
     * @return percentage between 0 and 100
     */
    public abstract double getPercentage();

    public abstract boolean isComplete();

    public abstract Optional<String> getLastError();

    public static ReplayProgress empty(Instant startTime) {
        return ImmutableReplayProgress.builder()
                .totalEvents(0)
                .processedEvents(0)
                .failedEvents(0)
                .skippedEvents(0)
                .currentVersion(0)
                .startTime(startTime)
                .elapsedTime(Duration.ZERO)
                .percentage(100)
                .complete(true)
                .build();
    }
}
