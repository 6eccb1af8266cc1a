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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Append-only store of events, organized in streams.
 *
 * <p>Every write is guarded by the version of the stream its author observed. Store never overwrites or removes
 * events, versions of a stream are contiguous starting at 1.
 *
 * @param <E> type of event payloads
 */
public interface EventStore<E> {
    /**
     * Expected version of a stream that does not exist yet.
     */
    long NO_STREAM = 0;
    /**
     * Expected version that disables the optimistic check.
     */
    long ANY_VERSION = -1;

    /**
     * Append events to single stream.
     * @param streamId target stream
     * @param expectedVersion version the stream must currently have
     * @param events events to append, in order
     * @return new version of the stream
     * @throws EventStoreException with fault {@link EventStoreException.Fault#OPTIMISTIC_LOCK} when the stream
     *     advanced, or other fault when storing fails
     */
    default long append(StreamId streamId, long expectedVersion, List<? extends E> events) throws EventStoreException {
        return append(Collections.singletonList(StreamWrite.of(streamId, expectedVersion, events))).get(streamId);
    }

    /**
     * Append events to several streams atomically. Either all expected versions match and all events are stored,
     * or nothing is stored. Global positions are assigned in order of the writes, and in order of events within
     * a write.
     * @param writes writes, at most one per stream
     * @return new versions of the written streams
     * @throws EventStoreException when any expected version does not match, or storing fails
     */
    Map<StreamId, Long> append(Collection<StreamWrite<E>> writes) throws EventStoreException;
}
