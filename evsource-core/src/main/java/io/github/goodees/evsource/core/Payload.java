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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Opaque payload of an event or a snapshot. The engine never looks inside, it only carries a type tag that tells the
 * reader how the content was produced, and the content itself.
 *
 * <p>Converting domain objects to and from payloads is the task of a {@link io.github.goodees.evsource.core.store.Serialization}.
 */
public final class Payload {
    private static final byte[] NO_CONTENT = new byte[0];
    private static final Payload EMPTY = new Payload("", NO_CONTENT);

    private final String type;
    private final byte[] content;

    @JsonCreator
    private Payload(@JsonProperty("type") String type, @JsonProperty("content") byte[] content) {
        this.type = type == null ? "" : type;
        this.content = content == null ? NO_CONTENT : content.clone();
    }

    public static Payload of(String type, byte[] content) {
        Objects.requireNonNull(content, "Content must be specified");
        return new Payload(type, content);
    }

    public static Payload ofText(String type, String content) {
        Objects.requireNonNull(content, "Content must be specified");
        return new Payload(type, content.getBytes(StandardCharsets.UTF_8));
    }

    public static Payload empty() {
        return EMPTY;
    }

    /**
     * Type tag of the content, e. g. a class name or media type. Empty string when not specified.
     * @return type tag
     */
    @JsonProperty("type")
    public String getType() {
        return type;
    }

    /**
     * Copy of the content.
     * @return content bytes
     */
    @JsonProperty("content")
    public byte[] getContent() {
        return content.clone();
    }

    @JsonIgnore
    public String asText() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @JsonIgnore
    public int size() {
        return content.length;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return content.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Payload)) {
            return false;
        }
        Payload payload = (Payload) o;
        return type.equals(payload.type) && Arrays.equals(content, payload.content);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "Payload[type=" + type + ", size=" + content.length + "]";
    }
}
