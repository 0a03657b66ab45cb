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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.evsource.core.store.JacksonSerialization;
import org.junit.Test;

import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

public class EventTest {
    private final ObjectMapper mapper = JacksonSerialization.defaultObjectMapper();

    @Test
    public void with_version_copies_only_when_version_differs() {
        Event event = TestEvents.event("order-1", 0);
        assertSame(event, event.withVersion(0));
        Event versioned = event.withVersion(4);
        assertNotSame(event, versioned);
        assertEquals(4, versioned.getVersion());
        assertEquals(event.getId(), versioned.getId());
        assertEquals(event.getData(), versioned.getData());
    }

    @Test
    public void json_uses_type_names_and_iso_timestamps() throws IOException {
        Event event = TestEvents.builder("order-1", 2, EventType.UPDATE).putMetadata("user", "alice").build();
        String json = mapper.writeValueAsString(event);
        assertThat(json, containsString("\"type\":\"update\""));
        assertThat(json, containsString("\"timestamp\":\"2018-03-01T10:00:02Z\""));
        assertEquals(event, mapper.readValue(json, Event.class));
    }

    @Test
    public void event_type_is_resolved_ignoring_case() {
        assertEquals(EventType.SNAPSHOT, EventType.fromName(" Snapshot"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknown_event_type_is_rejected() {
        EventType.fromName("rename");
    }
}
