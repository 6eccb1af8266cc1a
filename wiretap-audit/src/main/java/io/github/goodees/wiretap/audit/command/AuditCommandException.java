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

/**
 * Signal cannot be turned into a command.
 */
public class AuditCommandException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Request or session id is missing, so the streams of the command cannot be determined.
         */
        INVALID_STREAM_ID,
        /**
         * Signal of other kind than the command records.
         */
        WRONG_SIGNAL
    }

    protected AuditCommandException(Fault fault, String message) {
        super(message);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    static AuditCommandException missingId(String what, AuditSignal signal) {
        return new AuditCommandException(Fault.INVALID_STREAM_ID, "Signal " + signal + " lacks " + what);
    }

    static AuditCommandException wrongSignal(Class<?> command, AuditSignal signal) {
        return new AuditCommandException(Fault.WRONG_SIGNAL, command.getSimpleName() + " cannot record "
                + signal.getKind());
    }
}
