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

import io.github.goodees.evsource.core.RetryStrategy;
import io.github.goodees.evsource.core.ValueStyle;
import org.immutables.value.Value;

import java.time.Duration;

/**
 * Configuration of {@link DefaultEventProjection}.
 */
@Value.Immutable
@ValueStyle
public abstract class ProjectionConfig {

    @Value.Default
    public int getMaxProjections() {
        return 10000;
    }

    /**
     * Number of worker threads. Events of one aggregate are always handled by the same worker.
     * @return worker count
     */
    @Value.Default
    public int getBackgroundWorkers() {
        return 20;
    }

    /**
     * Capacity of every worker queue. The input queue holds {@code batchSize * backgroundWorkers} events.
     * @return batch size
     */
    @Value.Default
    public int getBatchSize() {
        return 1000;
    }

    /**
     * How long threads wait for new events before checking for shutdown.
     * @return poll timeout
     */
    @Value.Default
    public Duration getBatchTimeout() {
        return Duration.ofSeconds(1);
    }

    /**
     * Retries of a failed handler call before the failure is recorded.
     * @return retry attempts
     */
    @Value.Default
    public int getRetryAttempts() {
        return 3;
    }

    @Value.Default
    public Duration getRetryDelay() {
        return Duration.ofMillis(100);
    }

    /**
     * Period of logging engine statistics. Zero disables it.
     * @return interval
     */
    @Value.Default
    public Duration getStateUpdateInterval() {
        return Duration.ofSeconds(10);
    }

    /**
     * Time allowed for draining queued events when the engine stops.
     * @return shutdown timeout
     */
    @Value.Default
    public Duration getShutdownTimeout() {
        return Duration.ofSeconds(5);
    }

    public int inputQueueCapacity() {
        return getBatchSize() * getBackgroundWorkers();
    }

    public RetryStrategy retryStrategy() {
        return getRetryAttempts() > 0 ? RetryStrategy.fixedRetries(getRetryAttempts(), getRetryDelay())
                : RetryStrategy.noRetries();
    }

    @Value.Check
    protected void check() {
        if (getMaxProjections() <= 0) {
            throw new IllegalStateException("Max projections must be positive, got " + getMaxProjections());
        }
        if (getBackgroundWorkers() <= 0) {
            throw new IllegalStateException("Background workers must be positive, got " + getBackgroundWorkers());
        }
        if (getBatchSize() <= 0) {
            throw new IllegalStateException("Batch size must be positive, got " + getBatchSize());
        }
        if ((long) getBatchSize() * getBackgroundWorkers() > Integer.MAX_VALUE) {
            throw new IllegalStateException("Input queue capacity of " + getBatchSize() + " events per worker for "
                    + getBackgroundWorkers() + " workers is too large");
        }
        if (getBatchTimeout().isNegative() || getBatchTimeout().isZero()) {
            throw new IllegalStateException("Batch timeout must be positive");
        }
        if (getRetryAttempts() < 0) {
            throw new IllegalStateException("Retry attempts must not be negative, got " + getRetryAttempts());
        }
    }

    public static ImmutableProjectionConfig.Builder builder() {
        return ImmutableProjectionConfig.builder();
    }

    public static ProjectionConfig defaults() {
        return builder().build();
    }
}
