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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory of well formed events for tests. Timestamp of an event is {@link #BASE} plus its version in seconds.
 */
public final class TestEvents {
    public static final Instant BASE = Instant.parse("2018-03-01T10:00:00Z");
    public static final String AGGREGATE_TYPE = "order";

    private TestEvents() {
    }

    public static Event event(String aggregateId, long version, EventType type) {
        return builder(aggregateId, version, type).build();
    }

    public static Event event(String aggregateId, long version) {
        return event(aggregateId, version, version == 1 ? EventType.CREATE : EventType.UPDATE);
    }

    public static Event.Builder builder(String aggregateId, long version, EventType type) {
        return Event.builder()
                .id(aggregateId + "-" + version)
                .type(type)
                .aggregateId(aggregateId)
                .aggregateType(AGGREGATE_TYPE)
                .version(version)
                .data(Payload.ofText("text/plain", type + " " + version))
                .timestamp(BASE.plusSeconds(version));
    }

    /**
     * Events of an aggregate with consecutive versions.
     * @param aggregateId the aggregate
     * @param from first version
     * @param to last version, inclusive
     * @return the events
     */
    public static List<Event> events(String aggregateId, long from, long to) {
        List<Event> events = new ArrayList<>();
        for (long version = from; version <= to; version++) {
            events.add(event(aggregateId, version));
        }
        return events;
    }

    public static long[] versions(List<Event> events) {
        return events.stream().mapToLong(Event::getVersion).toArray();
    }

    public static long[] range(long from, long to) {
        long[] result = new long[(int) (to - from + 1)];
        for (int i = 0; i < result.length; i++) {
            result[i] = from + i;
        }
        return result;
    }
}
