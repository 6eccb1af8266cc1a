package io.github.goodees.wiretap.core;

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

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Immutable fact as recorded in the event store.
 *
 * <p>The envelope keeps everything the store knows about an event outside of its payload: the stream it belongs
 * to, its version within that stream, its position in the global order of the store, time-ordered event id,
 * timestamp of recording and free-form metadata.
 *
 * @param <E> type of payload
 */
public final class StoredEvent<E> {
    private final StreamId streamId;
    private final UUID eventId;
    private final long version;
    private final long position;
    private final Instant timestamp;
    private final E payload;
    private final Map<String, String> metadata;

    public StoredEvent(StreamId streamId, UUID eventId, long version, long position, Instant timestamp, E payload,
            Map<String, String> metadata) {
        this.streamId = Objects.requireNonNull(streamId, "Stream id must be specified");
        this.eventId = Objects.requireNonNull(eventId, "Event id must be specified");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        this.payload = Objects.requireNonNull(payload, "Payload must be specified");
        if (version < 1) {
            throw new IllegalArgumentException("Event version starts at 1, was " + version);
        }
        this.version = version;
        this.position = position;
        this.metadata = metadata == null || metadata.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    public StreamId getStreamId() {
        return streamId;
    }

    public UUID getEventId() {
        return eventId;
    }

    /**
     * The version of the stream after this event was appended. First event of a stream has version 1.
     * @return stream version
     */
    public long getVersion() {
        return version;
    }

    /**
     * Position in the global order of the store. Strictly increasing with every appended event across all streams.
     * @return global position
     */
    public long getPosition() {
        return position;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public E getPayload() {
        return payload;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public String getType() {
        return EventType.of(payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        StoredEvent<?> that = (StoredEvent<?>) o;
        return version == that.version && position == that.position && streamId.equals(that.streamId)
                && eventId.equals(that.eventId) && timestamp.equals(that.timestamp) && payload.equals(that.payload)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "StoredEvent[" + streamId + "@" + version + ", position=" + position + ", type=" + getType()
                + ", id=" + eventId + "]";
    }
}
