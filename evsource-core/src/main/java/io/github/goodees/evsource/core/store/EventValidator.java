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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.evsource.core.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks events for required fields and maximal serialized size before they are stored. Payload content is never
 * inspected.
 */
public class EventValidator {
    private final ObjectMapper objectMapper;
    private final long maxEventSize;

    /**
     * Create validator.
     * @param objectMapper mapper used to measure JSON size of an event
     * @param maxEventSize maximum size of serialized event in bytes, non-positive value disables the check
     */
    public EventValidator(ObjectMapper objectMapper, long maxEventSize) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper must be specified");
        this.maxEventSize = maxEventSize;
    }

    /**
     * Collect all problems of an event.
     * @param event the event to check
     * @return list of problems, empty if the event is valid
     */
    public List<String> validate(Event event) {
        List<String> errors = new ArrayList<>();
        if (event == null) {
            errors.add("event must not be null");
            return errors;
        }
        if (isBlank(event.getId())) {
            errors.add("event ID is required");
        }
        if (isBlank(event.getAggregateId())) {
            errors.add("aggregate ID is required");
        }
        if (event.getType() == null) {
            errors.add("event type is required");
        }
        if (event.getVersion() <= 0) {
            errors.add("event version must be positive");
        }
        if (event.getTimestamp() == null) {
            errors.add("event timestamp is required");
        }
        return errors;
    }

    /**
     * Validate an event, including its serialized size.
     * @param event the event to check
     * @return serialized size of the event in bytes
     * @throws EventStoreException with fault {@link EventStoreException.Fault#VALIDATION} describing all problems
     */
    public int check(Event event) throws EventStoreException {
        List<String> errors = validate(event);
        if (!errors.isEmpty()) {
            throw EventStoreException.invalidEvent(event, String.join(", ", errors));
        }
        int size = serializedSize(event);
        if (maxEventSize > 0 && size > maxEventSize) {
            throw EventStoreException.invalidEvent(event, "event size " + size
                    + " exceeds maximum allowed size " + maxEventSize);
        }
        return size;
    }

    int serializedSize(Event event) throws EventStoreException {
        try {
            return objectMapper.writeValueAsBytes(event).length;
        } catch (JsonProcessingException e) {
            throw EventStoreException.serializationFailed(event, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
