package io.github.goodees.wiretap.audit.command;

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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Observation reported by the proxy for one request. Attributes not relevant to the kind of signal are absent.
 */
public final class AuditSignal {
    public enum Kind {
        REQUEST_RECEIVED,
        REQUEST_FORWARDED,
        RESPONSE_RECEIVED,
        RESPONSE_RETURNED,
        ERROR,
        CANCELLED
    }

    private final Kind kind;
    private final UUID requestId;
    private final UUID sessionId;
    private final Instant timestamp;
    private String method;
    private String uri;
    private Map<String, String> headers = Collections.emptyMap();
    private long bodySize;
    private byte[] body;
    private String targetUrl;
    private Instant startTime;
    private int status;
    private Duration duration;
    private String message;
    private String phase;

    private AuditSignal(Kind kind, UUID requestId, UUID sessionId, Instant timestamp) {
        this.kind = kind;
        this.requestId = requestId;
        this.sessionId = sessionId;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
    }

    public static AuditSignal requestReceived(UUID requestId, UUID sessionId, Instant timestamp, String method,
            String uri, Map<String, String> headers, long bodySize, byte[] body) {
        AuditSignal signal = new AuditSignal(Kind.REQUEST_RECEIVED, requestId, sessionId, timestamp);
        signal.method = Objects.requireNonNull(method, "Method must be specified");
        signal.uri = Objects.requireNonNull(uri, "URI must be specified");
        signal.headers = copy(headers);
        signal.bodySize = bodySize;
        signal.body = body == null ? null : body.clone();
        return signal;
    }

    public static AuditSignal requestForwarded(UUID requestId, UUID sessionId, Instant timestamp, String targetUrl,
            Instant startTime) {
        AuditSignal signal = new AuditSignal(Kind.REQUEST_FORWARDED, requestId, sessionId, timestamp);
        signal.targetUrl = Objects.requireNonNull(targetUrl, "Target URL must be specified");
        signal.startTime = startTime == null ? timestamp : startTime;
        return signal;
    }

    public static AuditSignal responseReceived(UUID requestId, UUID sessionId, Instant timestamp, int status,
            Map<String, String> headers, long bodySize, Duration duration) {
        AuditSignal signal = new AuditSignal(Kind.RESPONSE_RECEIVED, requestId, sessionId, timestamp);
        signal.status = status;
        signal.headers = copy(headers);
        signal.bodySize = bodySize;
        signal.duration = Objects.requireNonNull(duration, "Duration must be specified");
        return signal;
    }

    public static AuditSignal responseReturned(UUID requestId, UUID sessionId, Instant timestamp,
            Duration duration) {
        AuditSignal signal = new AuditSignal(Kind.RESPONSE_RETURNED, requestId, sessionId, timestamp);
        signal.duration = Objects.requireNonNull(duration, "Duration must be specified");
        return signal;
    }

    public static AuditSignal error(UUID requestId, UUID sessionId, Instant timestamp, String message,
            String phase) {
        AuditSignal signal = new AuditSignal(Kind.ERROR, requestId, sessionId, timestamp);
        signal.message = Objects.requireNonNull(message, "Message must be specified");
        signal.phase = phase;
        return signal;
    }

    public static AuditSignal cancelled(UUID requestId, UUID sessionId, Instant timestamp, String message) {
        AuditSignal signal = new AuditSignal(Kind.CANCELLED, requestId, sessionId, timestamp);
        signal.message = message == null ? "cancelled by client" : message;
        return signal;
    }

    private static Map<String, String> copy(Map<String, String> headers) {
        return headers == null || headers.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(headers));
    }

    public Kind getKind() {
        return kind;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Optional<String> getMethod() {
        return Optional.ofNullable(method);
    }

    public Optional<String> getUri() {
        return Optional.ofNullable(uri);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public long getBodySize() {
        return bodySize;
    }

    /**
     * Raw request body, when the proxy captured it.
     * @return copy of the body
     */
    public Optional<byte[]> getBody() {
        return Optional.ofNullable(body).map(byte[]::clone);
    }

    public Optional<String> getTargetUrl() {
        return Optional.ofNullable(targetUrl);
    }

    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public int getStatus() {
        return status;
    }

    public Optional<Duration> getDuration() {
        return Optional.ofNullable(duration);
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public Optional<String> getPhase() {
        return Optional.ofNullable(phase);
    }

    @Override
    public String toString() {
        return "AuditSignal[" + kind + " request=" + requestId + " session=" + sessionId + " at " + timestamp
                + (body == null ? "" : ", body of " + body.length + " bytes") + "]";
    }
}
