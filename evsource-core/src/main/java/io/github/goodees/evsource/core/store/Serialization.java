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

/**
 * Conversion of domain objects to and from the opaque {@link Payload} of events and snapshots.
 *
 * <p>Payloads are kept in the store for a long time, therefore serialization should be able to read every past form
 * of the object it ever produced. The type tag of the payload is the place to encode such form, the engine never
 * interprets it.
 *
 * @param <T> type of serialized objects
 */
public interface Serialization<T> {
    /**
     * Determine the type tag for the payload of an object.
     * @param object object to be serialized
     * @return type tag
     */
    String payloadType(T object);

    /**
     * Serialize the object into a payload.
     * @param object object to serialize
     * @return payload carrying the serialized object
     * @throws IllegalArgumentException when the object cannot be serialized
     */
    Payload serialize(T object);

    /**
     * Deserialize a payload. As noted above, serialization must support reading all past forms of payloads.
     *
     * @param payload payload to deserialize
     * @return deserialized object or null if the payload is empty
     * @throws IllegalArgumentException when the payload is not readable by this serialization
     */
    T deserialize(Payload payload);

    /**
     * Return object of correct type, if its class is supported.
     *
     * @param o object to cast
     * @return casted object, or <code>null</code> if instance is of unsupported type.
     */
    T toSerializable(Object o);
}
