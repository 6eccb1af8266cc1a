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

import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.StreamId;

import java.util.Set;

/**
 * Business operation over a set of streams.
 *
 * <p>{@link CommandExecutor} reads all declared streams, folds their events into state using
 * {@link #apply(Object, StoredEvent)} starting at {@link #initialState()}, and passes the state to
 * {@link #handle(Object, Emitter)}. The events emitted there are appended to the store atomically, on condition
 * that none of the declared streams advanced in the meantime. Otherwise the whole command is attempted again.
 *
 * <p>Commands are therefore executed possibly several times, and must not have side effects outside of
 * emitted events.
 *
 * @param <S> type of state the command decides on
 * @param <E> type of events
 */
public interface Command<S, E> {
    /**
     * Streams the command reads and may write to. Must not be empty.
     * @return stream ids
     */
    Set<StreamId> streams();

    S initialState();

    /**
     * Evolve the state by a stored event of one of declared streams. Must be a pure function.
     * @param state state before the event
     * @param event the event
     * @return state after the event
     */
    S apply(S state, StoredEvent<E> event);

    /**
     * Decide on events to emit.
     * @param state state of declared streams
     * @param emitter sink of new events
     * @throws CommandException with fault {@link CommandException.Fault#REJECTED} when the command is refused
     */
    void handle(S state, Emitter<E> emitter) throws CommandException;

    /**
     * Sink of events produced by a command.
     */
    interface Emitter<E> {
        /**
         * Emit an event to a stream.
         * @param streamId one of the declared streams
         * @param event event payload
         * @throws CommandException with fault {@link CommandException.Fault#UNDECLARED_STREAM} if stream was not
         *     declared by the command
         */
        void emit(StreamId streamId, E event) throws CommandException;
    }
}
