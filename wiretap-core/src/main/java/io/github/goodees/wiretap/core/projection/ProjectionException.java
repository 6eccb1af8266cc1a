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

/**
 * Failure of a projection.
 */
public class ProjectionException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Events could not be read from the store.
         */
        READ,
        /**
         * The projection function failed on an event.
         */
        APPLY,
        /**
         * Checkpoint could not be stored, or would move backwards.
         */
        CHECKPOINT,
        /**
         * State of the projection could not be loaded or saved.
         */
        STORAGE
    }

    protected ProjectionException(Fault fault, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    public static ProjectionException readFailed(String projection, Throwable cause) {
        return new ProjectionException(Fault.READ, projection + ": reading events failed. " + cause.getMessage(),
            cause);
    }

    public static ProjectionException applyFailed(String projection, StoredEvent<?> event, Throwable cause) {
        return new ProjectionException(Fault.APPLY, projection + ": applying " + event + " failed. "
                + cause.getMessage(), cause);
    }

    public static ProjectionException checkpointRegression(String projection, Checkpoint current,
            Checkpoint requested) {
        return new ProjectionException(Fault.CHECKPOINT, projection + ": checkpoint cannot move from " + current
                + " back to " + requested, null);
    }

    public static ProjectionException checkpointFailed(String projection, Throwable cause) {
        return new ProjectionException(Fault.CHECKPOINT, projection + ": storing checkpoint failed. "
                + cause.getMessage(), cause);
    }

    public static ProjectionException storageFailed(String projection, Throwable cause) {
        return new ProjectionException(Fault.STORAGE, projection + ": state storage failed. " + cause.getMessage(),
            cause);
    }

    public static ProjectionException concurrentUpdate(String projection, long expectedPosition) {
        return new ProjectionException(Fault.STORAGE, projection + ": state moved past position " + expectedPosition
                + " concurrently", null);
    }
}
