package io.github.goodees.evsource.core;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable fact about a single aggregate instance.
 *
 * <p>For a fixed aggregate id the stored events form a gapless sequence of versions starting at 1. The store owns an
 * event once it is saved, and it is never changed afterwards. Derived copies are created with {@link #withVersion(long)}
 * or {@link #toBuilder()}.</p>
 *
 * <p>A version of {@code 0} marks an event whose version was not chosen by the producer. Such events need to pass
 * through {@link io.github.goodees.evsource.core.versioning.EventVersioning} before the store accepts them.</p>
 */
@JsonDeserialize(builder = Event.Builder.class)
// allow for future changes in an event
@JsonIgnoreProperties(ignoreUnknown = true)
// Put key values at the front
@JsonPropertyOrder({ "id", "aggregateId", "version", "type", "timestamp" })
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Event {
    /**
     * Order of events across aggregates: by timestamp, then aggregate id and version.
     */
    public static final Comparator<Event> CHRONOLOGICAL = Comparator.comparing(Event::getTimestamp)
            .thenComparing(Event::getAggregateId)
            .thenComparingLong(Event::getVersion);

    private final String id;
    private final EventType type;
    private final String aggregateId;
    private final String aggregateType;
    private final long version;
    private final Payload data;
    private final Map<String, String> metadata;
    private final Instant timestamp;
    private final String nodeId;
    private final String causationId;
    private final String correlationId;

    private Event(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.aggregateId = builder.aggregateId;
        this.aggregateType = builder.aggregateType;
        this.version = builder.version;
        this.data = builder.data == null ? Payload.empty() : builder.data;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.timestamp = builder.timestamp;
        this.nodeId = builder.nodeId;
        this.causationId = builder.causationId;
        this.correlationId = builder.correlationId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .aggregateId(aggregateId)
                .aggregateType(aggregateType)
                .version(version)
                .data(data)
                .metadata(metadata)
                .timestamp(timestamp)
                .nodeId(nodeId)
                .causationId(causationId)
                .correlationId(correlationId);
    }

    /**
     * Copy of this event carrying different version.
     * @param newVersion version of the copy
     * @return this instance if the version is the same, a copy otherwise
     */
    public Event withVersion(long newVersion) {
        return newVersion == version ? this : toBuilder().version(newVersion).build();
    }

    /**
     * Unique id of the event.
     * @return the id
     */
    public String getId() {
        return id;
    }

    public EventType getType() {
        return type;
    }

    /**
     * The id of the aggregate this event relates to.
     * @return the aggregate id
     */
    public String getAggregateId() {
        return aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * The version of the aggregate after this event is applied.
     * @return 1-based version, or 0 when not yet assigned
     */
    public long getVersion() {
        return version;
    }

    public Payload getData() {
        return data;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * The time when an event occurred.
     * @return the instant of event creation
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Node the event originated on.
     * @return node id or null
     */
    public String getNodeId() {
        return nodeId;
    }

    public String getCausationId() {
        return causationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        Event event = (Event) o;
        return version == event.version
                && Objects.equals(id, event.id)
                && type == event.type
                && Objects.equals(aggregateId, event.aggregateId)
                && Objects.equals(aggregateType, event.aggregateType)
                && Objects.equals(data, event.data)
                && Objects.equals(metadata, event.metadata)
                && Objects.equals(timestamp, event.timestamp)
                && Objects.equals(nodeId, event.nodeId)
                && Objects.equals(causationId, event.causationId)
                && Objects.equals(correlationId, event.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, aggregateId, version);
    }

    @Override
    public String toString() {
        return "Event[id=" + id + ", type=" + type + ", aggregate=" + aggregateId + ", version=" + version
                + ", timestamp=" + timestamp + "]";
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String id;
        private EventType type;
        private String aggregateId;
        private String aggregateType;
        private long version;
        private Payload data;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private Instant timestamp;
        private String nodeId;
        private String causationId;
        private String correlationId;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EventType type) {
            this.type = type;
            return this;
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder data(Payload data) {
            this.data = data;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder putMetadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }
}
