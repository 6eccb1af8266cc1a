package io.github.goodees.wiretap.audit.chain;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry of an {@link AuditLogChain}. Immutable once created.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonPropertyOrder({ "entryId", "sessionId", "requestId", "timestamp", "payload", "integrity", "context" })
public final class AuditLogEntry {
    private final UUID entryId;
    private final UUID sessionId;
    private final UUID requestId;
    private final Instant timestamp;
    private final AuditEntryType payload;
    private final IntegrityProof integrity;
    private final AuditContext context;

    @JsonCreator
    public AuditLogEntry(@JsonProperty("entryId") UUID entryId, @JsonProperty("sessionId") UUID sessionId,
            @JsonProperty("requestId") UUID requestId, @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("payload") AuditEntryType payload, @JsonProperty("integrity") IntegrityProof integrity,
            @JsonProperty("context") AuditContext context) {
        this.entryId = Objects.requireNonNull(entryId, "Entry id must be specified");
        this.sessionId = Objects.requireNonNull(sessionId, "Session id must be specified");
        this.requestId = requestId;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        this.payload = Objects.requireNonNull(payload, "Payload must be specified");
        this.integrity = Objects.requireNonNull(integrity, "Integrity proof must be specified");
        this.context = Objects.requireNonNull(context, "Context must be specified");
    }

    public UUID getEntryId() {
        return entryId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public Optional<UUID> getRequestId() {
        return Optional.ofNullable(requestId);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public AuditEntryType getPayload() {
        return payload;
    }

    public IntegrityProof getIntegrity() {
        return integrity;
    }

    public AuditContext getContext() {
        return context;
    }

    /**
     * Copy of this entry with other payload and the same proof. The copy does not verify, unless the payload
     * is equal.
     * @param payload replacement payload
     * @return the copy
     */
    public AuditLogEntry withPayload(AuditEntryType payload) {
        return new AuditLogEntry(entryId, sessionId, requestId, timestamp, payload, integrity, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        AuditLogEntry that = (AuditLogEntry) o;
        return entryId.equals(that.entryId) && sessionId.equals(that.sessionId)
                && Objects.equals(requestId, that.requestId) && timestamp.equals(that.timestamp)
                && payload.equals(that.payload) && integrity.equals(that.integrity) && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return entryId.hashCode();
    }

    @Override
    public String toString() {
        return "AuditLogEntry[#" + integrity.getSequenceNumber() + " " + entryId + ", session=" + sessionId
                + ", payload=" + payload + "]";
    }
}
