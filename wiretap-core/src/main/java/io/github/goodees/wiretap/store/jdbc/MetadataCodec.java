package io.github.goodees.wiretap.store.jdbc;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.wiretap.core.store.EventStoreException;

import java.util.Collections;
import java.util.Map;

/**
 * Stores event metadata as a JSON object column.
 */
class MetadataCodec {
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<Map<String, String>>() {
    };

    private MetadataCodec() {

    }

    static String write(Map<String, String> metadata) throws EventStoreException {
        if (metadata.isEmpty()) {
            return null;
        }
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw EventStoreException.serializationFailed(metadata, e);
        }
    }

    static Map<String, String> read(String column) throws EventStoreException {
        if (column == null || column.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            return mapper.readValue(column, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw EventStoreException.deserializationFailed("metadata", e);
        }
    }
}
