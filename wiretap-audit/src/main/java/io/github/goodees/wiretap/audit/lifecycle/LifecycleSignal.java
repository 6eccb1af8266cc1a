package io.github.goodees.wiretap.audit.lifecycle;

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

import io.github.goodees.wiretap.audit.event.AuditEvent;
import io.github.goodees.wiretap.audit.event.LlmRequestFailedEvent;
import io.github.goodees.wiretap.audit.event.LlmRequestForwardedEvent;
import io.github.goodees.wiretap.audit.event.LlmRequestReceivedEvent;
import io.github.goodees.wiretap.audit.event.LlmResponseReceivedEvent;
import io.github.goodees.wiretap.audit.event.LlmResponseReturnedEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Input of the request lifecycle.
 */
public final class LifecycleSignal {
    public enum Kind {
        RECEIVED,
        FORWARDED,
        RESPONSE,
        RETURNED,
        FAILURE,
        CANCELLATION,
        /**
         * Anything else observed after the request, e.g. activity of other requests in the same session.
         */
        OTHER
    }

    private final Kind kind;
    private final Instant at;
    private final String reason;

    private LifecycleSignal(Kind kind, Instant at, String reason) {
        this.kind = Objects.requireNonNull(kind);
        this.at = Objects.requireNonNull(at, "Time of signal must be specified");
        this.reason = reason;
    }

    public static LifecycleSignal of(Kind kind, Instant at) {
        return new LifecycleSignal(kind, at, null);
    }

    public static LifecycleSignal failure(Instant at, String reason) {
        return new LifecycleSignal(Kind.FAILURE, at, reason);
    }

    public static LifecycleSignal cancellation(Instant at, String reason) {
        return new LifecycleSignal(Kind.CANCELLATION, at, reason);
    }

    /**
     * Classify an audit event from the point of view of one request.
     * @param requestId the request whose lifecycle is followed
     * @param event any audit event
     * @return the signal, or empty for diagnostics, which are not signals
     */
    public static Optional<LifecycleSignal> from(UUID requestId, AuditEvent event) {
        if (event.isDiagnostic()) {
            return Optional.empty();
        }
        Instant at = event.getOccurredAt();
        if (!event.getRequestId().equals(requestId)) {
            return Optional.of(of(Kind.OTHER, at));
        }
        if (event instanceof LlmRequestReceivedEvent) {
            return Optional.of(of(Kind.RECEIVED, at));
        } else if (event instanceof LlmRequestForwardedEvent) {
            return Optional.of(of(Kind.FORWARDED, at));
        } else if (event instanceof LlmResponseReceivedEvent) {
            return Optional.of(of(Kind.RESPONSE, at));
        } else if (event instanceof LlmResponseReturnedEvent) {
            return Optional.of(of(Kind.RETURNED, at));
        } else if (event instanceof LlmRequestFailedEvent) {
            LlmRequestFailedEvent failed = (LlmRequestFailedEvent) event;
            return Optional.of(failed.isCancelled() ? cancellation(at, failed.getReason())
                    : failure(at, failed.getReason()));
        }
        return Optional.of(of(Kind.OTHER, at));
    }

    public Kind getKind() {
        return kind;
    }

    public Instant getAt() {
        return at;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return kind + "@" + at;
    }
}
