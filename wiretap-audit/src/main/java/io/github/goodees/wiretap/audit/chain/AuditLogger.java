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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Owner of an audit chain. Stamps every entry with a fresh context; calls are serialized.
 */
public class AuditLogger {
    private static final Logger logger = LoggerFactory.getLogger(AuditLogger.class);

    private final AuditLogChain chain;
    private final Supplier<AuditContext> contextFactory;

    public AuditLogger(Supplier<AuditContext> contextFactory) {
        this(contextFactory, Clock.systemUTC());
    }

    public AuditLogger(Supplier<AuditContext> contextFactory, Clock clock) {
        this(new AuditLogChain(clock), contextFactory);
    }

    /**
     * Continue an existing chain.
     * @param chain the chain, owned by this logger from now on
     * @param contextFactory source of entry contexts
     */
    public AuditLogger(AuditLogChain chain, Supplier<AuditContext> contextFactory) {
        this.chain = chain;
        this.contextFactory = contextFactory;
    }

    public synchronized AuditLogEntry log(UUID sessionId, AuditEntryType payload, UUID requestId)
            throws AuditException {
        AuditLogEntry entry = chain.append(new AuditLogBuilder()
                .sessionId(sessionId)
                .requestId(requestId)
                .payload(payload)
                .context(contextFactory.get()));
        logger.debug("Appended {}", entry);
        return entry;
    }

    public AuditLogEntry log(UUID sessionId, AuditEntryType payload) throws AuditException {
        return log(sessionId, payload, null);
    }

    public synchronized void verifyIntegrity() throws AuditException {
        try {
            chain.verifyIntegrity();
        } catch (ChainIntegrityException e) {
            logger.error("Audit chain of {} entries failed verification: {}", chain.size(), e.getMessage());
            throw e;
        }
    }

    public synchronized List<AuditLogEntry> entries() {
        return new ArrayList<>(chain.entries());
    }

    public synchronized int size() {
        return chain.size();
    }
}
