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
import io.github.goodees.wiretap.core.store.EventStoreException;

import java.util.Set;

/**
 * Failure to execute a command.
 */
public class CommandException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * One of the streams advanced while the command executed.
         */
        CONFLICT,
        /**
         * Reading or storing the events failed.
         */
        STORE,
        /**
         * Folding the streams into state, or deciding on it, failed unexpectedly.
         */
        STATE,
        /**
         * The command refused to execute.
         */
        REJECTED,
        /**
         * The command emitted an event to a stream it did not declare.
         */
        UNDECLARED_STREAM,
        /**
         * Thread was interrupted while waiting for a retry.
         */
        INTERRUPTED
    }

    protected CommandException(Fault fault, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isConflict() {
        return fault == Fault.CONFLICT;
    }

    public static CommandException conflict(Object command, EventStoreException cause) {
        return new CommandException(Fault.CONFLICT, "Concurrent modification while executing " + command + ". "
                + cause.getMessage(), cause);
    }

    public static CommandException storeFailed(Object command, Throwable cause) {
        return new CommandException(Fault.STORE, "Store failed while executing " + command + ". "
                + cause.getMessage(), cause);
    }

    public static CommandException stateFailed(Object command, Throwable cause) {
        return new CommandException(Fault.STATE, "Cannot determine state for " + command + ". " + cause.getMessage(),
            cause);
    }

    public static CommandException rejected(String reason) {
        return new CommandException(Fault.REJECTED, reason, null);
    }

    public static CommandException rejected(String reason, Throwable cause) {
        return new CommandException(Fault.REJECTED, reason, cause);
    }

    public static CommandException undeclaredStream(StreamId streamId, Set<StreamId> declared) {
        return new CommandException(Fault.UNDECLARED_STREAM, "Event emitted to " + streamId
                + ", which is not among declared streams " + declared, null);
    }

    public static CommandException interrupted(Object command, InterruptedException cause) {
        return new CommandException(Fault.INTERRUPTED, "Interrupted while retrying " + command, cause);
    }
}
