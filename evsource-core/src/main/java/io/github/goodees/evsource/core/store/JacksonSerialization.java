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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.evsource.core.Payload;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON serialization of a single class with Jackson. Payload type tag is the name of the class.
 * @param <T> serialized type
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public JacksonSerialization(ObjectMapper objectMapper, Class<T> type) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper must be specified");
        this.type = Objects.requireNonNull(type, "Type must be specified");
    }

    public JacksonSerialization(Class<T> type) {
        this(defaultObjectMapper(), type);
    }

    /**
     * Object mapper with java.time support and ISO timestamps, as used by the store for size checks.
     * @return new object mapper
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String payloadType(T object) {
        return type.getName();
    }

    @Override
    public Payload serialize(T object) {
        try {
            return Payload.of(payloadType(object), objectMapper.writeValueAsBytes(object));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public T deserialize(Payload payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        if (!payload.getType().isEmpty() && !type.getName().equals(payload.getType())) {
            throw new IllegalArgumentException("Payload of type " + payload.getType() + " cannot be read as "
                    + type.getName());
        }
        try {
            return objectMapper.readValue(payload.getContent(), type);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot deserialize payload of type " + payload.getType(), e);
        }
    }

    @Override
    public T toSerializable(Object o) {
        return type.isInstance(o) ? type.cast(o) : null;
    }
}
