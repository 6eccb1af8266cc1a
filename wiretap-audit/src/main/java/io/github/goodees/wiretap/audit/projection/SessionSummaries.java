package io.github.goodees.wiretap.audit.projection;

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
import io.github.goodees.wiretap.audit.event.LlmRequestReceivedEvent;
import io.github.goodees.wiretap.audit.event.LlmResponseReceivedEvent;
import io.github.goodees.wiretap.audit.event.RequestParsingFailedEvent;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleSignal;
import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.store.JacksonSerialization;
import io.github.goodees.wiretap.core.store.StreamSelector;
import io.github.goodees.wiretap.projection.inmemory.InMemoryProjection;
import io.github.goodees.wiretap.projection.jdbc.JdbcProjection;
import io.github.goodees.wiretap.projection.jdbc.JdbcProjectionSchema;
import io.github.goodees.wiretap.runner.ProjectionConfiguration;

import javax.sql.DataSource;
import java.util.Optional;

/**
 * Projection of audit events into {@link SessionSummaryState}.
 */
public final class SessionSummaries {
    public static final String NAME = "session-summaries";

    private SessionSummaries() {

    }

    /**
     * Fold one event into the state. Pure function, the state is not modified.
     * @param state state before the event
     * @param event stored audit event
     * @return state after the event
     */
    public static SessionSummaryState apply(SessionSummaryState state, StoredEvent<AuditEvent> event) {
        AuditEvent payload = event.getPayload();
        SessionSummary summary = state.session(payload.getSessionId())
                .orElseGet(() -> SessionSummary.start(payload.getSessionId(), payload.getOccurredAt()))
                .touch(payload.getOccurredAt());
        if (payload.isDiagnostic()) {
            summary = summary.withDiagnostic(payload instanceof RequestParsingFailedEvent);
        } else {
            Optional<LifecycleSignal> signal = LifecycleSignal.from(payload.getRequestId(), payload);
            if (signal.isPresent()) {
                summary = summary.withSignal(payload.getRequestId(), signal.get());
            }
            if (payload instanceof LlmRequestReceivedEvent) {
                summary = summary.withModel(((LlmRequestReceivedEvent) payload).getModelId());
            } else if (payload instanceof LlmResponseReceivedEvent) {
                summary = summary.withResponseTime(((LlmResponseReceivedEvent) payload).getDurationMs());
            }
        }
        return state.with(summary);
    }

    public static StreamSelector streams() {
        return StreamSelector.kinds(StreamId.SESSION, StreamId.REQUEST);
    }

    public static ProjectionConfiguration.Builder configuration() {
        ProjectionConfiguration.Builder builder = new ProjectionConfiguration.Builder();
        builder.selector(streams());
        return builder;
    }

    public static InMemoryProjection<SessionSummaryState, AuditEvent> inMemory() {
        return new InMemoryProjection<>(NAME, SessionSummaryState::empty, SessionSummaries::apply);
    }

    public static JdbcProjection<SessionSummaryState, AuditEvent> jdbc(DataSource ds, JdbcProjectionSchema schema) {
        return new JdbcProjection<>(ds, schema, NAME, new JacksonSerialization<>(JacksonSerialization.createMapper(),
                SessionSummaryState.class), SessionSummaryState::empty, SessionSummaries::apply);
    }
}
