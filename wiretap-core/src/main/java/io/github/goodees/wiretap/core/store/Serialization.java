package io.github.goodees.wiretap.core.store;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
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

/**
 * Converts event payloads and projection states to and from their stored String form.
 *
 * <p>Stored data outlive the code that wrote them, so serialization must support reading all past versions of
 * payloads.
 *
 * @param <T> type of serialized objects
 */
public interface Serialization<T> {
    /**
     * Determine version of payload to be used for serialization.
     * @param object object to be serialized
     * @return payload version.
     */
    int payloadVersion(T object);

    /**
     * Type discriminator stored along the payload.
     * @param object object to be serialized
     * @return type name
     */
    String typeOf(T object);

    /**
     * Serialize the object into a String payload.
     * @param object object to serialize
     * @return String serialization of the object
     * @throws EventStoreException when object cannot be serialized
     */
    String serialize(T object) throws EventStoreException;

    /**
     * Deserialize a payload given its version.
     *
     * @param payloadVersion the version of the payload as stored in the store
     * @param payload payload to deserialize
     * @param type a type discriminator if supported by underlying storage, <code>null</code> otherwise
     * @return deserialized object, or null if the payload is of type unknown to running code
     * @throws EventStoreException when payload is corrupt
     */
    T deserialize(int payloadVersion, String payload, String type) throws EventStoreException;

    /**
     * Return object of correct type, if its class is supported.
     *
     * @param o object to cast
     * @return casted object, or <code>null</code> if instance is of unsupported type.
     */
    T toSerializable(Object o);
}
