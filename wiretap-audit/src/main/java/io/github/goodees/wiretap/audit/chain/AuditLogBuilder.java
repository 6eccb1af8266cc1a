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

import io.github.goodees.wiretap.core.EventIds;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Collects attributes of an entry. Session id, payload and context are required; the proof is created when the
 * chain appends the entry.
 */
public class AuditLogBuilder {
    private UUID sessionId;
    private UUID requestId;
    private AuditEntryType payload;
    private AuditContext context;

    public AuditLogBuilder sessionId(UUID sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public AuditLogBuilder requestId(UUID requestId) {
        this.requestId = requestId;
        return this;
    }

    public AuditLogBuilder payload(AuditEntryType payload) {
        this.payload = payload;
        return this;
    }

    public AuditLogBuilder context(AuditContext context) {
        this.context = context;
        return this;
    }

    AuditLogEntry build(Hash256 previousHash, long sequenceNumber, Clock clock) throws AuditException {
        if (sessionId == null) {
            throw AuditException.missingField("sessionId");
        }
        if (payload == null) {
            throw AuditException.missingField("payload");
        }
        if (context == null) {
            throw AuditException.missingField("context");
        }
        Instant now = clock.instant();
        IntegrityProof integrity = IntegrityProof.create(CanonicalJson.write(payload), previousHash,
            sequenceNumber, now);
        return new AuditLogEntry(EventIds.next(), sessionId, requestId, now, payload, integrity, context);
    }
}
