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
import java.util.Optional;

/**
 * Throughput, latency and health of a single projection.
 */
@Value.Immutable
@ValueStyle
public abstract class ProjectionMetrics {

    public enum Health {
        HEALTHY, DEGRADED, FAILING;

        static final double DEGRADED_ERROR_RATE = 0.05;
        static final double FAILING_ERROR_RATE = 0.5;

        public static Health fromErrorRate(double errorRate) {
            if (errorRate >= FAILING_ERROR_RATE) {
                return FAILING;
            } else if (errorRate >= DEGRADED_ERROR_RATE) {
                return DEGRADED;
            } else {
                return HEALTHY;
            }
        }
    }

    public abstract String getProjectionId();

    public abstract long getEventsProcessed();

    /**
     * Events applied per second since the first event after creation or reset.
     * @return throughput
     */
    public abstract double getEventsPerSecond();

    public abstract Duration getAverageLatency();

    /**
     * Share of failed events among all events handed to the projection.
     * @return rate between 0 and 1
     */
    public abstract double getErrorRate();

    public abstract Optional<Instant> getLastProcessed();

    public abstract Health getHealth();
}
