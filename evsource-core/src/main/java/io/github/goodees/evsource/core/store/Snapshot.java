package io.github.goodees.evsource.core.store;

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

import io.github.goodees.evsource.core.Payload;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Materialized state of an aggregate at given version. Store keeps at most one snapshot per aggregate, newer snapshot
 * replaces the older one.
 */
public final class Snapshot {
    private final String aggregateId;
    private final String aggregateType;
    private final long version;
    private final Payload data;
    private final Instant createdAt;
    private final String createdBy;
    private final Map<String, String> metadata;

    public Snapshot(String aggregateId, String aggregateType, long version, Payload data, Instant createdAt,
                    String createdBy, Map<String, String> metadata) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.aggregateType = aggregateType;
        this.version = version;
        this.data = data == null ? Payload.empty() : data;
        this.createdAt = Objects.requireNonNull(createdAt, "Creation time must be specified");
        this.createdBy = createdBy;
        this.metadata = metadata == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * Entity version
     * @return the version aggregate was in when this snapshot was generated
     */
    public long getVersion() {
        return version;
    }

    public Payload getData() {
        return data;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Node that created the snapshot.
     * @return node id of the store
     */
    public String getCreatedBy() {
        return createdBy;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public int getSize() {
        return data.size();
    }

    @Override
    public String toString() {
        return "Snapshot[aggregate=" + aggregateId + ", version=" + version + ", createdAt=" + createdAt
                + ", createdBy=" + createdBy + "]";
    }
}
