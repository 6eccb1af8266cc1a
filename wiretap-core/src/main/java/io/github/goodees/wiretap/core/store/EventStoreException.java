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

/**
 * Failure of storing or reading events. The {@link Fault} tells the caller whether retry makes sense.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Expected version of a stream did not match. Retry after re-reading the stream.
         */
        OPTIMISTIC_LOCK,
        /**
         * Underlying storage failed.
         */
        TX_ERROR,
        /**
         * Payload could not be converted to or from its stored form.
         */
        SERIALIZATION,
        /**
         * Store was used incorrectly.
         */
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isConflict() {
        return fault == Fault.OPTIMISTIC_LOCK;
    }

    public static EventStoreException optimisticLock(StreamId streamId, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + streamId
                + " has advanced past expected version " + expectedVersion, null);
    }

    public static EventStoreException optimisticLock(StreamId streamId, long actualVersion, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + streamId + " append expected version "
                + expectedVersion + " while current version is " + actualVersion, null);
    }

    public static EventStoreException concurrentWrite(String streams, Throwable cause) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Concurrent write to " + streams + " detected. "
                + cause.getMessage(), cause);
    }

    public static EventStoreException storeFailed(String streams, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, "Store of " + streams + " failed. " + cause.getMessage(),
            cause);
    }

    public static EventStoreException readFailed(String what, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, "Reading " + what + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException serializationFailed(Object payload, Throwable cause) {
        return new EventStoreException(Fault.SERIALIZATION, "Cannot serialize " + payload + ". "
                + cause.getMessage(), cause);
    }

    public static EventStoreException deserializationFailed(String type, Throwable cause) {
        return new EventStoreException(Fault.SERIALIZATION, "Cannot deserialize payload of type " + type + ". "
                + cause.getMessage(), cause);
    }

    public static EventStoreException unknownEvent(StreamId streamId, long version, String type) {
        return new EventStoreException(Fault.SERIALIZATION, streamId + " Could not deserialize event " + version
                + " of type " + type, null);
    }

    public static EventStoreException duplicateStream(StreamId streamId) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Stream " + streamId
                + " is written more than once in single append", null);
    }

    public static EventStoreException invalidExpectedVersion(StreamId streamId, long expectedVersion) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Invalid expected version " + expectedVersion
                + " for stream " + streamId, null);
    }

    public static EventStoreException unsupported(Object payload) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + payload, null);
    }
}
