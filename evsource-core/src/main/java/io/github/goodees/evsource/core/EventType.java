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
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of change an event describes. The textual name is what gets serialized and what type based queries and
 * projection filters compare.
 */
public enum EventType {
    CREATE, UPDATE, DELETE, SNAPSHOT, RESTORE, CUSTOM;

    private final String typeName = name().toLowerCase(Locale.ROOT);

    @JsonValue
    public String typeName() {
        return typeName;
    }

    /**
     * Resolve the type from its textual name, ignoring case.
     * @param name the name, e. g. {@code update}
     * @return matching type
     * @throws IllegalArgumentException when no type has such name
     */
    @JsonCreator
    public static EventType fromName(String name) {
        if (name != null) {
            for (EventType type : values()) {
                if (type.typeName.equalsIgnoreCase(name.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + name);
    }

    @Override
    public String toString() {
        return typeName;
    }
}
