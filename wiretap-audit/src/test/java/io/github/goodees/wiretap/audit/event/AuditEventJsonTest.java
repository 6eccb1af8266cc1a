package io.github.goodees.wiretap.audit.event;

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

import io.github.goodees.wiretap.audit.lifecycle.LifecycleSignal;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.JacksonSerialization;
import org.junit.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class AuditEventJsonTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final JacksonSerialization<AuditEvent> serialization = JacksonSerialization.of(AuditEvent.class);
    private final UUID requestId = UUID.randomUUID();
    private final UUID sessionId = UUID.randomUUID();

    private LlmRequestReceivedEvent received() {
        return LlmRequestReceivedEvent.builder()
                .requestId(requestId)
                .sessionId(sessionId)
                .occurredAt(T0)
                .method("POST")
                .uri("/v1/chat/completions")
                .headers(Collections.singletonMap("content-type", "application/json"))
                .bodySize(120)
                .provider("openai")
                .modelId("gpt-4")
                .prompt("user: Hello")
                .parameters(Collections.singletonMap("temperature", "0.2"))
                .build();
    }

    @Test
    public void type_is_derived_from_class_name() {
        assertEquals("LlmRequestReceived", serialization.typeOf(received()));
        assertEquals("InvalidTransition", serialization.typeOf(InvalidTransitionEvent.builder()
                .requestId(requestId)
                .sessionId(sessionId)
                .occurredAt(T0)
                .signal(LifecycleSignal.Kind.RECEIVED)
                .stage(LifecycleState.Stage.RECEIVED)
                .reason("Request already received")
                .build()));
    }

    @Test
    public void received_event_survives_serialization() throws EventStoreException {
        String json = serialization.serialize(received());

        assertThat(json, containsString("\"type\":\"LlmRequestReceived\""));
        assertThat(json, containsString("\"occurredAt\":\"2024-03-01T10:00:00Z\""));
        assertThat(json, not(containsString("diagnostic")));
        assertEquals(received(), serialization.deserialize(1, json, "LlmRequestReceived"));
    }

    @Test
    public void failed_event_keeps_cancellation_flag() throws EventStoreException {
        LlmRequestFailedEvent failed = LlmRequestFailedEvent.builder()
                .requestId(requestId)
                .sessionId(sessionId)
                .occurredAt(T0)
                .reason("cancelled by client")
                .cancelled(true)
                .build();

        AuditEvent read = serialization.deserialize(1, serialization.serialize(failed), "LlmRequestFailed");
        assertTrue(((LlmRequestFailedEvent) read).isCancelled());
        assertFalse(((LlmRequestFailedEvent) read).getPhase().isPresent());
    }

    @Test
    public void diagnostics_are_flagged() throws EventStoreException {
        String json = "{\"type\":\"RequestParsingFailed\",\"requestId\":\"" + requestId + "\",\"sessionId\":\""
                + sessionId + "\",\"occurredAt\":\"2024-03-01T10:00:00Z\",\"error\":\"Invalid JSON\","
                + "\"uri\":\"/v1/messages\",\"bodySize\":3}";

        AuditEvent event = serialization.deserialize(1, json, "RequestParsingFailed");
        assertTrue(event instanceof RequestParsingFailedEvent);
        assertTrue(event.isDiagnostic());
        assertFalse(received().isDiagnostic());
    }

    @Test
    public void unknown_event_type_is_skipped() throws EventStoreException {
        assertNull(serialization.deserialize(1, "{\"type\":\"SessionRenamed\",\"requestId\":\"" + requestId + "\"}",
                "SessionRenamed"));
    }
}
