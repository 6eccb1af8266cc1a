package io.github.goodees.wiretap.core.command;

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
import io.github.goodees.wiretap.core.store.StreamWrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of successfully executed command.
 * @param <E> type of events
 */
public final class CommandResult<E> {
    private final List<StreamWrite<E>> writes;
    private final Map<StreamId, Long> streamVersions;
    private final int attempts;

    CommandResult(List<StreamWrite<E>> writes, Map<StreamId, Long> streamVersions, int attempts) {
        this.writes = Collections.unmodifiableList(new ArrayList<>(writes));
        this.streamVersions = Collections.unmodifiableMap(new LinkedHashMap<>(streamVersions));
        this.attempts = attempts;
    }

    /**
     * Events appended to the store, grouped by stream.
     * @return writes in order of emission
     */
    public List<StreamWrite<E>> getWrites() {
        return writes;
    }

    /**
     * All appended events, in order of their global positions.
     * @return events
     */
    public List<E> getEvents() {
        List<E> result = new ArrayList<>();
        writes.forEach(w -> result.addAll(w.getEvents()));
        return result;
    }

    public List<E> getEvents(StreamId streamId) {
        for (StreamWrite<E> write : writes) {
            if (write.getStreamId().equals(streamId)) {
                return write.getEvents();
            }
        }
        return Collections.emptyList();
    }

    /**
     * Versions of declared streams after the command. Streams the command did not write keep the version it
     * observed.
     * @return stream versions
     */
    public Map<StreamId, Long> getStreamVersions() {
        return streamVersions;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isEmpty() {
        return writes.isEmpty();
    }

    @Override
    public String toString() {
        return "CommandResult[writes=" + writes + ", versions=" + streamVersions + ", attempts=" + attempts + "]";
    }
}
