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

import io.github.goodees.wiretap.core.StoredEvent;

import java.util.Optional;

/**
 * Materialized view derived from events.
 *
 * <p>State of a projection is fully derivable by replaying events from the beginning: applying events one by one
 * after {@link #reset()} yields the same state as applying them incrementally over time. Events at or below the
 * position of the last applied event are ignored, so redelivery is harmless.
 *
 * @param <S> type of state
 * @param <E> type of events
 */
public interface Projection<S, E> {
    String getName();

    /**
     * Current state. Callers must not modify it.
     * @return the state
     * @throws ProjectionException when state cannot be loaded
     */
    S getState() throws ProjectionException;

    void applyEvent(StoredEvent<E> event) throws ProjectionException;

    Optional<Checkpoint> lastCheckpoint() throws ProjectionException;

    /**
     * Record progress.
     * @param checkpoint new checkpoint
     * @throws ProjectionException with fault {@link ProjectionException.Fault#CHECKPOINT} when checkpoint precedes
     *     the last one
     */
    void setCheckpoint(Checkpoint checkpoint) throws ProjectionException;

    /**
     * Return to initial state and forget checkpoint.
     * @throws ProjectionException when state cannot be stored
     */
    void reset() throws ProjectionException;
}
