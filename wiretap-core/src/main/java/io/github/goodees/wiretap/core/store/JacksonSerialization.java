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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.wiretap.core.EventType;

import java.util.Objects;

/**
 * JSON serialization of a type hierarchy. Polymorphic hierarchies are expected to carry their own type
 * information, e.g. by {@link com.fasterxml.jackson.annotation.JsonTypeInfo}.
 *
 * <p>Payloads of a type id that running code does not know deserialize to {@code null}, corrupt payloads fail.
 *
 * @param <T> base type
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private final Class<T> baseType;
    private final ObjectWriter writer;
    private final ObjectReader reader;
    private final int payloadVersion;

    public JacksonSerialization(ObjectMapper mapper, Class<T> baseType) {
        this(mapper, baseType, 1);
    }

    public JacksonSerialization(ObjectMapper mapper, Class<T> baseType, int payloadVersion) {
        this.baseType = Objects.requireNonNull(baseType);
        this.writer = mapper.writerFor(baseType);
        this.reader = mapper.readerFor(baseType);
        this.payloadVersion = payloadVersion;
    }

    public static <T> JacksonSerialization<T> of(Class<T> baseType) {
        return new JacksonSerialization<>(createMapper(), baseType);
    }

    /**
     * Mapper configured for payloads: Optionals, java.time types written as ISO strings.
     * @return new mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public int payloadVersion(T object) {
        return payloadVersion;
    }

    @Override
    public String typeOf(T object) {
        return EventType.of(object);
    }

    @Override
    public String serialize(T object) throws EventStoreException {
        try {
            return writer.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw EventStoreException.serializationFailed(object, e);
        }
    }

    @Override
    public T deserialize(int payloadVersion, String payload, String type) throws EventStoreException {
        try {
            return reader.readValue(payload);
        } catch (InvalidTypeIdException e) {
            return null;
        } catch (JsonProcessingException e) {
            throw EventStoreException.deserializationFailed(type, e);
        }
    }

    @Override
    public T toSerializable(Object o) {
        return baseType.isInstance(o) ? baseType.cast(o) : null;
    }
}
