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

import io.github.goodees.wiretap.audit.event.AuditEvent;
import io.github.goodees.wiretap.audit.event.LlmRequestFailedEvent;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleSignal;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState;
import io.github.goodees.wiretap.core.command.CommandException;

/**
 * Records failure or cancellation of a request. Accepted in every stage but the terminal ones.
 */
public class RecordRequestFailed extends RequestCommand {

    RecordRequestFailed(AuditSignal signal) throws AuditCommandException {
        super(signal, AuditSignal.Kind.ERROR, AuditSignal.Kind.CANCELLED);
    }

    public static RecordRequestFailed from(AuditSignal signal) throws AuditCommandException {
        return new RecordRequestFailed(signal);
    }

    private boolean isCancellation() {
        return signal.getKind() == AuditSignal.Kind.CANCELLED;
    }

    @Override
    protected LifecycleSignal.Kind lifecycleSignal() {
        return isCancellation() ? LifecycleSignal.Kind.CANCELLATION : LifecycleSignal.Kind.FAILURE;
    }

    @Override
    protected void record(LifecycleState state, Emitter<AuditEvent> emitter) throws CommandException {
        emitter.emit(requestStream(), LlmRequestFailedEvent.builder()
                .requestId(getRequestId())
                .sessionId(getSessionId())
                .occurredAt(signal.getTimestamp())
                .reason(signal.getMessage().orElse("unknown"))
                .phase(signal.getPhase())
                .cancelled(isCancellation())
                .build());
    }
}
