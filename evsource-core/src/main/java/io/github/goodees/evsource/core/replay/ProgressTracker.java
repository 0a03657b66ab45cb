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

import io.github.goodees.evsource.core.Event;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable counterpart of {@link ReplayProgress}, shared by the threads of one replay.
 */
final class ProgressTracker {
    private final long totalEvents;
    private final Instant startTime;
    private final long startNanos = System.nanoTime();

    private long processedEvents;
    private long failedEvents;
    private long skippedEvents;
    private long currentVersion;
    private boolean complete;
    private String lastError;

    ProgressTracker(long totalEvents, Instant startTime) {
        this.totalEvents = totalEvents;
        this.startTime = startTime;
    }

    synchronized void processed(Event event) {
        processedEvents++;
        currentVersion = Math.max(currentVersion, event.getVersion());
    }

    synchronized void failed(Event event, Throwable failure) {
        failedEvents++;
        lastError = "event " + event.getId() + " at version " + event.getVersion() + ": " + failure.getMessage();
    }

    synchronized void skipped() {
        skippedEvents++;
    }

    synchronized void completed() {
        complete = true;
    }

    synchronized void aborted(String error) {
        lastError = error;
    }

    synchronized ReplayProgress snapshot() {
        long done = processedEvents + failedEvents + skippedEvents;
        ImmutableReplayProgress.Builder builder = ImmutableReplayProgress.builder()
                .totalEvents(totalEvents)
                .processedEvents(processedEvents)
                .failedEvents(failedEvents)
                .skippedEvents(skippedEvents)
                .currentVersion(currentVersion)
                .startTime(startTime)
                .elapsedTime(Duration.ofNanos(System.nanoTime() - startNanos))
                .percentage(totalEvents == 0 ? 100.0 : done * 100.0 / totalEvents)
                .complete(complete);
        if (lastError != null) {
            builder.lastError(lastError);
        }
        return builder.build();
    }
}
