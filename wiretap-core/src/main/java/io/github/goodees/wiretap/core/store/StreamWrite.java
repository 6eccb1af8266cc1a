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

import io.github.goodees.wiretap.core.StreamId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Events to be appended to one stream, guarded by the version the writer observed.
 * @param <E> payload type
 */
public final class StreamWrite<E> {
    private final StreamId streamId;
    private final long expectedVersion;
    private final List<E> events;
    private final Map<String, String> metadata;

    public StreamWrite(StreamId streamId, long expectedVersion, List<? extends E> events, Map<String, String> metadata) {
        this.streamId = Objects.requireNonNull(streamId, "Stream id must be specified");
        if (expectedVersion < EventStore.ANY_VERSION) {
            throw new IllegalArgumentException("Expected version " + expectedVersion + " of " + streamId
                    + " is not valid");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Write to " + streamId + " has no events");
        }
        this.expectedVersion = expectedVersion;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.metadata = metadata == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    public static <E> StreamWrite<E> of(StreamId streamId, long expectedVersion, List<? extends E> events) {
        return new StreamWrite<>(streamId, expectedVersion, events, null);
    }

    public StreamId getStreamId() {
        return streamId;
    }

    /**
     * Version the stream must have before the write. {@link EventStore#NO_STREAM} requires the stream not to
     * exist yet, {@link EventStore#ANY_VERSION} disables the check.
     * @return expected version
     */
    public long getExpectedVersion() {
        return expectedVersion;
    }

    public List<E> getEvents() {
        return events;
    }

    /**
     * Metadata attached to every event of this write.
     * @return metadata
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "StreamWrite[" + streamId + ", expected=" + expectedVersion + ", events=" + events.size() + "]";
    }
}
