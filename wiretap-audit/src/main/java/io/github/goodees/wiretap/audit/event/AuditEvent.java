package io.github.goodees.wiretap.audit.event;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.github.goodees.wiretap.immutables.ImmutableEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Common attributes of audit events.
 */
public interface AuditEvent extends ImmutableEvent {
    UUID getRequestId();

    UUID getSessionId();

    /**
     * Time the proxy observed the signal, as opposed to the time the event was stored.
     * @return time of the signal
     */
    Instant getOccurredAt();

    /**
     * Diagnostics record signals that could not be applied. They do not move the lifecycle of a request.
     * @return true for diagnostic events
     */
    @JsonIgnore
    default boolean isDiagnostic() {
        return false;
    }
}
