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
 * Failure to build, append or verify audit entries.
 */
public class AuditException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Entry lacks attribute required for building it.
         */
        MISSING_FIELD,
        /**
         * Payload cannot be put to canonical form.
         */
        SERIALIZATION,
        /**
         * Chain does not match its proofs.
         */
        CHAIN_INTEGRITY
    }

    protected AuditException(Fault fault, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    public static AuditException missingField(String field) {
        return new AuditException(Fault.MISSING_FIELD, "Missing required field: " + field, null);
    }

    public static AuditException serializationFailed(Object payload, Throwable cause) {
        return new AuditException(Fault.SERIALIZATION, "Cannot serialize " + payload + ": " + cause.getMessage(),
                cause);
    }
}
