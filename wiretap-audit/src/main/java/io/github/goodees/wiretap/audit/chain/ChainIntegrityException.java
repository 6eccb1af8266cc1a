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

/**
 * Entry of a chain does not match its proof. Signals tampering or corruption, the chain is not repaired.
 */
public class ChainIntegrityException extends AuditException {
    public enum Violation {
        SEQUENCE,
        LINKAGE,
        CONTENT
    }

    private final int index;
    private final Violation violation;

    ChainIntegrityException(int index, Violation violation, String message) {
        super(Fault.CHAIN_INTEGRITY, message, null);
        this.index = index;
        this.violation = violation;
    }

    static ChainIntegrityException invalidSequence(int index, long sequenceNumber) {
        return new ChainIntegrityException(index, Violation.SEQUENCE, "Invalid sequence number " + sequenceNumber
                + " at index " + index);
    }

    static ChainIntegrityException brokenLink(int index) {
        return new ChainIntegrityException(index, Violation.LINKAGE, "Hash chain broken at index " + index);
    }

    static ChainIntegrityException contentMismatch(int index) {
        return new ChainIntegrityException(index, Violation.CONTENT, "Content integrity violation at index "
                + index);
    }

    /**
     * Index of the first entry that failed verification.
     * @return zero based index
     */
    public int getIndex() {
        return index;
    }

    public Violation getViolation() {
        return violation;
    }
}
