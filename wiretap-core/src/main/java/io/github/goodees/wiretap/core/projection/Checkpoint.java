package io.github.goodees.wiretap.core.projection;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.goodees.wiretap.core.StoredEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * Progress of a projection: global position and timestamp of the last event it applied.
 */
public final class Checkpoint implements Comparable<Checkpoint> {
    private final long position;
    private final Instant timestamp;

    @JsonCreator
    public Checkpoint(@JsonProperty("position") long position, @JsonProperty("timestamp") Instant timestamp) {
        if (position < 0) {
            throw new IllegalArgumentException("Checkpoint position must not be negative, was " + position);
        }
        this.position = position;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
    }

    public static Checkpoint of(StoredEvent<?> event) {
        return new Checkpoint(event.getPosition(), event.getTimestamp());
    }

    @JsonProperty("position")
    public long getPosition() {
        return position;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isBefore(Checkpoint other) {
        return position < other.position;
    }

    @Override
    public int compareTo(Checkpoint o) {
        return Long.compare(position, o.position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Checkpoint that = (Checkpoint) o;
        return position == that.position && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, timestamp);
    }

    @Override
    public String toString() {
        return "Checkpoint[" + position + " at " + timestamp + "]";
    }
}
