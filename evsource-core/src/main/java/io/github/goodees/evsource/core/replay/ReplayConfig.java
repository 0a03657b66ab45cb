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

import io.github.goodees.evsource.core.RetryStrategy;
import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration of {@link DefaultEventReplay}.
 */
@Value.Immutable
@ValueStyle
public abstract class ReplayConfig {

    @Value.Default
    public ReplayStrategy getStrategy() {
        return ReplayStrategy.SEQUENTIAL;
    }

    /**
     * Size of chunks of {@link ReplayStrategy#BATCH} replay.
     * @return batch size
     */
    @Value.Default
    public int getBatchSize() {
        return 1000;
    }

    @Value.Default
    public int getParallelWorkers() {
        return 16;
    }

    /**
     * Whether replay aborts on first event that keeps failing after retries.
     * @return true to abort
     */
    @Value.Default
    public boolean isStopOnError() {
        return false;
    }

    /**
     * Number of retries after the first failed attempt to handle an event.
     * @return retries
     */
    @Value.Default
    public int getMaxRetries() {
        return 3;
    }

    @Value.Default
    public Duration getRetryDelay() {
        return Duration.ofSeconds(1);
    }

    @Value.Auxiliary
    public abstract Optional<ReplayProgressListener> getProgressListener();

    public RetryStrategy retryStrategy() {
        return getMaxRetries() > 0 ? RetryStrategy.fixedRetries(getMaxRetries(), getRetryDelay())
                : RetryStrategy.noRetries();
    }

    @Value.Check
    protected void check() {
        if (getBatchSize() <= 0) {
            throw new IllegalStateException("Batch size must be positive, got " + getBatchSize());
        }
        if (getParallelWorkers() <= 0) {
            throw new IllegalStateException("Parallel workers must be positive, got " + getParallelWorkers());
        }
        if (getMaxRetries() < 0) {
            throw new IllegalStateException("Max retries must not be negative, got " + getMaxRetries());
        }
    }

    public static ImmutableReplayConfig.Builder builder() {
        return ImmutableReplayConfig.builder();
    }

    public static ReplayConfig defaults() {
        return builder().build();
    }
}
