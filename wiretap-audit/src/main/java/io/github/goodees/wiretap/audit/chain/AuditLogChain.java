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

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Sequence of entries, each bound to its predecessor. Entry {@code i} has sequence number {@code i} and refers to
 * the content hash of entry {@code i-1}; the first entry refers to none.
 *
 * <p>Not thread safe, a chain has a single owner, such as {@link AuditLogger}.
 */
public class AuditLogChain {
    private final Clock clock;
    private final List<AuditLogEntry> entries = new ArrayList<>();
    private Hash256 lastHash;

    public AuditLogChain() {
        this(Clock.systemUTC());
    }

    public AuditLogChain(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Chain of previously stored entries. The entries are not verified, call {@link #verifyIntegrity()} for that.
     * @param entries entries in chain order
     * @return chain that continues after the entries
     */
    public static AuditLogChain restore(List<AuditLogEntry> entries) {
        AuditLogChain chain = new AuditLogChain();
        chain.entries.addAll(entries);
        if (!entries.isEmpty()) {
            chain.lastHash = entries.get(entries.size() - 1).getIntegrity().getContentHash();
        }
        return chain;
    }

    public AuditLogEntry append(AuditLogBuilder builder) throws AuditException {
        AuditLogEntry entry = builder.build(lastHash, entries.size(), clock);
        entries.add(entry);
        lastHash = entry.getIntegrity().getContentHash();
        return entry;
    }

    /**
     * Walk the chain from the start, checking sequence number, link to the previous entry and content hash of
     * every entry.
     * @throws ChainIntegrityException at the first entry that does not match
     * @throws AuditException when a payload cannot be serialized
     */
    public void verifyIntegrity() throws AuditException {
        Hash256 expectedPrevious = null;
        for (int i = 0; i < entries.size(); i++) {
            IntegrityProof proof = entries.get(i).getIntegrity();
            if (proof.getSequenceNumber() != i) {
                throw ChainIntegrityException.invalidSequence(i, proof.getSequenceNumber());
            }
            if (!Objects.equals(proof.getPreviousEntryHash().orElse(null), expectedPrevious)) {
                throw ChainIntegrityException.brokenLink(i);
            }
            if (!proof.verify(CanonicalJson.write(entries.get(i).getPayload()))) {
                throw ChainIntegrityException.contentMismatch(i);
            }
            expectedPrevious = proof.getContentHash();
        }
    }

    public List<AuditLogEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
