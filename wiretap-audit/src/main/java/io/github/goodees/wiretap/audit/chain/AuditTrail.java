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

import io.github.goodees.wiretap.audit.event.AuditEvent;
import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.store.EventLog;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.StreamSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Feeds stored audit events into an audit chain. Remembers the position of the last recorded event, so that
 * replaying the log again only appends entries for new events.
 */
public class AuditTrail {
    private static final Logger logger = LoggerFactory.getLogger(AuditTrail.class);

    private final AuditLogger auditLogger;
    private long lastPosition;

    public AuditTrail(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    public synchronized Optional<AuditLogEntry> record(StoredEvent<AuditEvent> event) throws AuditException {
        if (event.getPosition() <= lastPosition) {
            return Optional.empty();
        }
        AuditEvent payload = event.getPayload();
        Optional<AuditEntryType> entry = AuditEntries.toEntry(payload);
        Optional<AuditLogEntry> result = Optional.empty();
        if (entry.isPresent()) {
            result = Optional.of(auditLogger.log(payload.getSessionId(), entry.get(), payload.getRequestId()));
        }
        lastPosition = event.getPosition();
        return result;
    }

    /**
     * Record all events of the log after the last recorded one.
     * @param log the event log
     * @param pageSize number of events read at once
     * @return number of appended entries
     * @throws AuditException when entry cannot be appended
     * @throws EventStoreException when log cannot be read
     */
    public int catchUp(EventLog<AuditEvent> log, int pageSize) throws AuditException, EventStoreException {
        int appended = 0;
        while (true) {
            List<StoredEvent<AuditEvent>> page;
            try (EventLog.StoredEvents<AuditEvent> events = log.readAfter(StreamSelector.all(), getLastPosition(),
                pageSize)) {
                page = events.toList();
            }
            if (page.isEmpty()) {
                break;
            }
            for (StoredEvent<AuditEvent> event : page) {
                if (record(event).isPresent()) {
                    appended++;
                }
            }
        }
        logger.debug("Audit trail caught up to position {} with {} new entries", getLastPosition(), appended);
        return appended;
    }

    public synchronized long getLastPosition() {
        return lastPosition;
    }

    public AuditLogger getAuditLogger() {
        return auditLogger;
    }
}
