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
import io.github.goodees.wiretap.audit.event.InvalidTransitionEvent;
import io.github.goodees.wiretap.audit.lifecycle.InvalidTransitionException;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleSignal;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState;
import io.github.goodees.wiretap.audit.lifecycle.RequestLifecycle;
import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.command.Command;
import io.github.goodees.wiretap.core.command.CommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Records one signal of a request. Reads the session and the request stream and folds the lifecycle of the
 * request from them.
 *
 * <p>A signal the lifecycle accepts is recorded by {@link #record(LifecycleState, Emitter)}. Any other signal is
 * recorded as {@link InvalidTransitionEvent} on the request stream, and the command still succeeds.
 *
 * <p>Only events of the same request move the folded state, so implicit completion after a response never
 * happens here.
 */
public abstract class RequestCommand implements Command<LifecycleState, AuditEvent> {
    private static final Logger logger = LoggerFactory.getLogger(RequestCommand.class);

    protected final AuditSignal signal;
    private final StreamId sessionStream;
    private final StreamId requestStream;
    private final Set<StreamId> streams;

    protected RequestCommand(AuditSignal signal, AuditSignal.Kind... kinds) throws AuditCommandException {
        boolean matches = false;
        for (AuditSignal.Kind kind : kinds) {
            matches |= signal.getKind() == kind;
        }
        if (!matches) {
            throw AuditCommandException.wrongSignal(getClass(), signal);
        }
        if (signal.getRequestId() == null) {
            throw AuditCommandException.missingId("request id", signal);
        }
        if (signal.getSessionId() == null) {
            throw AuditCommandException.missingId("session id", signal);
        }
        this.signal = signal;
        this.sessionStream = StreamId.session(signal.getSessionId());
        this.requestStream = StreamId.request(signal.getRequestId());
        Set<StreamId> declared = new TreeSet<>();
        declared.add(sessionStream);
        declared.add(requestStream);
        this.streams = Collections.unmodifiableSet(declared);
    }

    public UUID getRequestId() {
        return signal.getRequestId();
    }

    public UUID getSessionId() {
        return signal.getSessionId();
    }

    public StreamId sessionStream() {
        return sessionStream;
    }

    public StreamId requestStream() {
        return requestStream;
    }

    @Override
    public Set<StreamId> streams() {
        return streams;
    }

    @Override
    public LifecycleState initialState() {
        return LifecycleState.notStarted(getRequestId());
    }

    @Override
    public LifecycleState apply(LifecycleState state, StoredEvent<AuditEvent> event) {
        return LifecycleSignal.from(getRequestId(), event.getPayload())
                .filter(s -> s.getKind() != LifecycleSignal.Kind.OTHER)
                .map(s -> RequestLifecycle.transition(state, s))
                .orElse(state);
    }

    @Override
    public void handle(LifecycleState state, Emitter<AuditEvent> emitter) throws CommandException {
        LifecycleSignal.Kind kind = lifecycleSignal();
        if (RequestLifecycle.accepts(state, kind)) {
            record(state, emitter);
        } else {
            String reason = InvalidTransitionException.describe(state.getStage(), kind);
            logger.debug("{} recorded as invalid transition: {}", this, reason);
            emitter.emit(requestStream, InvalidTransitionEvent.builder()
                    .requestId(getRequestId())
                    .sessionId(getSessionId())
                    .occurredAt(signal.getTimestamp())
                    .signal(kind)
                    .stage(state.getStage())
                    .reason(reason)
                    .build());
        }
    }

    /**
     * The lifecycle signal the audit signal represents.
     * @return kind of signal
     */
    protected abstract LifecycleSignal.Kind lifecycleSignal();

    /**
     * Emit the events of an accepted signal.
     * @param state the state of the request before the signal
     * @param emitter sink of events
     * @throws CommandException when emitting fails
     */
    protected abstract void record(LifecycleState state, Emitter<AuditEvent> emitter) throws CommandException;

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getRequestId() + "]";
    }
}
