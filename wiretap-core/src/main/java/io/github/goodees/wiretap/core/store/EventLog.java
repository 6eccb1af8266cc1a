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

import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.StreamId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Reads persisted events.
 * This interface is usually implemented along with EventStore, sharing its storage and (de)serialization routines.
 *
 * @param <E> type of event payloads
 */
public interface EventLog<E> {
    /**
     * Read all events of given streams.
     * @param streamIds streams to read
     * @return accessor for the events in order of their global position
     * @throws EventStoreException when storage cannot be accessed
     */
    StoredEvents<E> readStreams(Collection<StreamId> streamIds) throws EventStoreException;

    /**
     * Read a page of the global feed. This is how projections follow the store.
     * @param selector streams to include
     * @param afterPosition only events with greater position are returned. 0 reads from the beginning
     * @param limit maximum number of events returned
     * @return accessor for the events in order of their global position
     * @throws EventStoreException when storage cannot be accessed
     */
    StoredEvents<E> readAfter(StreamSelector selector, long afterPosition, int limit) throws EventStoreException;

    /**
     * Current version of a stream.
     * @param streamId the stream
     * @return version of last event, or {@link EventStore#NO_STREAM} if the stream has no events
     * @throws EventStoreException when storage cannot be accessed
     */
    long streamVersion(StreamId streamId) throws EventStoreException;

    /**
     * Position of the most recently stored event.
     * @return head position, 0 for empty store
     * @throws EventStoreException when storage cannot be accessed
     */
    long headPosition() throws EventStoreException;

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events needs not to be materialized at once, rather it could for example
     * wrap a JDBC ResultSet. This also means that only one of methods foreach, reduce and toList may be called on
     * single instance, and only once.
     */
    interface StoredEvents<E> extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super StoredEvent<E>> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super StoredEvent<E>, R> reducer);

        default List<StoredEvent<E>> toList() {
            List<StoredEvent<E>> result = new ArrayList<>();
            foreach(result::add);
            return result;
        }

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
