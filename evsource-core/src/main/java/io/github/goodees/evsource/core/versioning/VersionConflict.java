package io.github.goodees.evsource.core.versioning;

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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Mismatch between the version an aggregate expects and the version presented by a caller.
 */
public final class VersionConflict {
    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;
    private final Instant conflictTime;
    private final String resolution;

    public VersionConflict(String aggregateId, long expectedVersion, long actualVersion, Instant conflictTime) {
        this(aggregateId, expectedVersion, actualVersion, conflictTime, null);
    }

    private VersionConflict(String aggregateId, long expectedVersion, long actualVersion, Instant conflictTime,
                            String resolution) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
        this.conflictTime = Objects.requireNonNull(conflictTime, "Conflict time must be specified");
        this.resolution = resolution;
    }

    VersionConflict withResolution(String resolution) {
        return new VersionConflict(aggregateId, expectedVersion, actualVersion, conflictTime, resolution);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    public Instant getConflictTime() {
        return conflictTime;
    }

    /**
     * Outcome of the conflict, e. g. {@code resolved to 4} or {@code rejected}.
     * @return resolution text, empty when the conflict was only detected
     */
    public Optional<String> getResolution() {
        return Optional.ofNullable(resolution);
    }

    @Override
    public String toString() {
        return "VersionConflict[aggregate=" + aggregateId + ", expected=" + expectedVersion + ", actual="
                + actualVersion + ", resolution=" + resolution + "]";
    }
}
