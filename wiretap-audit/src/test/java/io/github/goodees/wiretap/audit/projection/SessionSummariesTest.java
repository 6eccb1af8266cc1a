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

import io.github.goodees.wiretap.audit.command.AuditCommandException;
import io.github.goodees.wiretap.audit.command.AuditRecorder;
import io.github.goodees.wiretap.audit.command.AuditSignal;
import io.github.goodees.wiretap.audit.event.AuditEvent;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState.Stage;
import io.github.goodees.wiretap.audit.parse.JsonRequestParser;
import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.command.CommandException;
import io.github.goodees.wiretap.core.command.CommandExecutor;
import io.github.goodees.wiretap.core.command.ExecutorConfiguration;
import io.github.goodees.wiretap.core.projection.ProjectionException;
import io.github.goodees.wiretap.core.store.StreamSelector;
import io.github.goodees.wiretap.projection.inmemory.InMemoryProjection;
import io.github.goodees.wiretap.runner.ProjectionRunner;
import io.github.goodees.wiretap.store.inmemory.InMemoryEventStore;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SessionSummariesTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final InMemoryEventStore<AuditEvent> store = new InMemoryEventStore<>();
    private final AuditRecorder recorder = new AuditRecorder(
            new CommandExecutor<>(store, store, ExecutorConfiguration.synchronous("audit")), new JsonRequestParser());

    private final UUID sessionId = UUID.randomUUID();

    private static String chat(String model) {
        return "{\"model\":\"" + model + "\",\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}";
    }

    private void receive(UUID session, UUID request, int second, String body)
            throws AuditCommandException, CommandException {
        recorder.record(AuditSignal.requestReceived(request, session, T0.plusSeconds(second), "POST",
                "/v1/chat/completions", null, body.length(), body.getBytes(StandardCharsets.UTF_8)));
    }

    private void forward(UUID request, int second) throws AuditCommandException, CommandException {
        recorder.record(AuditSignal.requestForwarded(request, sessionId, T0.plusSeconds(second), "https://upstream",
                null));
    }

    private void respond(UUID request, int second) throws AuditCommandException, CommandException {
        respond(request, second, 100);
    }

    private void respond(UUID request, int second, long durationMs) throws AuditCommandException, CommandException {
        recorder.record(AuditSignal.responseReceived(request, sessionId, T0.plusSeconds(second), 200, null, 10,
                Duration.ofMillis(durationMs)));
    }

    private SessionSummaryState replay() {
        List<StoredEvent<AuditEvent>> events = store.readAfter(StreamSelector.all(), 0, Integer.MAX_VALUE).toList();
        SessionSummaryState state = SessionSummaryState.empty();
        for (StoredEvent<AuditEvent> event : events) {
            state = SessionSummaries.apply(state, event);
        }
        return state;
    }

    private void recordScenario() throws AuditCommandException, CommandException {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        UUID third = UUID.randomUUID();
        receive(sessionId, first, 0, chat("gpt-4"));
        forward(first, 1);
        respond(first, 2);
        receive(sessionId, second, 3, chat("claude-3-haiku"));
        forward(second, 4);
        recorder.record(AuditSignal.error(second, sessionId, T0.plusSeconds(5), "upstream timeout", "forward"));
        receive(sessionId, third, 6, "{broken");
        forward(third, 7);
        forward(third, 8);
        receive(UUID.randomUUID(), UUID.randomUUID(), 9, chat("gpt-4"));
    }

    @Test
    public void summary_counts_requests_and_outcomes() throws AuditCommandException, CommandException {
        recordScenario();
        SessionSummaryState state = replay();

        assertEquals(2, state.sessionCount());
        assertEquals(4, state.totalRequests());
        SessionSummary summary = state.session(sessionId).get();
        assertEquals(3, summary.getRequestCount());
        assertEquals(1, summary.getCompletedCount());
        assertEquals(1, summary.getFailedCount());
        assertEquals(2, summary.getDiagnostics());
        assertEquals(1, summary.getParseFailures());
        assertTrue(summary.getModelsUsed().contains("gpt-4"));
        assertTrue(summary.getModelsUsed().contains("claude-3-haiku"));
        assertTrue(summary.getModelsUsed().contains("unknown-model"));
        assertEquals(T0, summary.getFirstActivity());
        assertEquals(T0.plusSeconds(8), summary.getLastActivity());
        assertTrue(summary.isActive());
        assertEquals(2, state.sessionsUsingModel("gpt-4").size());
    }

    @Test
    public void activity_of_other_request_completes_responded_request()
            throws AuditCommandException, CommandException {
        UUID first = UUID.randomUUID();
        receive(sessionId, first, 0, chat("gpt-4"));
        forward(first, 1);
        respond(first, 2);

        assertEquals(Stage.RESPONSE_RECEIVED, replay().session(sessionId).get().getRequests().get(first).getStage());
        assertEquals(Stage.COMPLETED, replay().requestLifecycle(first).get().getStage());

        receive(sessionId, UUID.randomUUID(), 3, chat("gpt-4"));
        SessionSummary summary = replay().session(sessionId).get();
        assertEquals(Stage.COMPLETED, summary.getRequests().get(first).getStage());
        assertEquals(T0.plusSeconds(3), summary.getRequests().get(first).getFinishedAt().get());
    }

    @Test
    public void average_response_time_covers_all_responses() throws AuditCommandException, CommandException {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        receive(sessionId, first, 0, chat("gpt-4"));
        forward(first, 1);
        respond(first, 2, 300);
        receive(sessionId, second, 3, chat("gpt-4"));
        forward(second, 4);
        respond(second, 5, 500);
        UUID quiet = UUID.randomUUID();
        receive(quiet, UUID.randomUUID(), 6, chat("gpt-4"));

        SessionSummaryState state = replay();
        SessionSummary summary = state.session(sessionId).get();
        assertEquals(2, summary.getResponses());
        assertEquals(Duration.ofMillis(400), summary.getAverageResponseTime().get());
        assertFalse(state.session(quiet).get().getAverageResponseTime().isPresent());
    }

    @Test
    public void inactive_sessions_have_unfinished_requests_and_no_recent_activity()
            throws AuditCommandException, CommandException {
        recordScenario();
        UUID finished = UUID.randomUUID();
        UUID cancelled = UUID.randomUUID();
        receive(finished, cancelled, 0, chat("gpt-4"));
        recorder.record(AuditSignal.cancelled(cancelled, finished, T0.plusSeconds(1), null));

        SessionSummaryState state = replay();
        // last activity of the scenario session is at 8 s, of the other open session at 9 s
        List<SessionSummary> stalled = state.inactiveSessions(Duration.ofSeconds(5),
            T0.plusSeconds(13).plusMillis(500));
        assertEquals(1, stalled.size());
        assertEquals(sessionId, stalled.get(0).getSessionId());
        assertEquals(2, state.inactiveSessions(Duration.ofSeconds(5), T0.plusSeconds(14)).size());
        assertTrue(state.inactiveSessions(Duration.ofHours(1), T0.plusSeconds(14)).isEmpty());
    }

    @Test
    public void stats_sum_up_all_sessions() throws AuditCommandException, CommandException {
        recordScenario();
        SessionStats stats = replay().stats();
        assertEquals(2, stats.getTotalSessions());
        assertEquals(2, stats.getActiveSessions());
        assertEquals(4, stats.getTotalRequests());
        assertEquals(1, stats.getCompletedRequests());
        assertEquals(1, stats.getFailedRequests());
        // gpt-4, claude-3-haiku and the fallback of the unparseable body
        assertEquals(3, stats.getDistinctModels());
        assertEquals(Duration.ofMillis(100), stats.getAverageResponseTime().get());

        SessionStats empty = SessionSummaryState.empty().stats();
        assertEquals(0, empty.getTotalSessions());
        assertFalse(empty.getAverageResponseTime().isPresent());
    }

    @Test
    public void unknown_request_has_no_lifecycle() {
        assertFalse(SessionSummaryState.empty().requestLifecycle(UUID.randomUUID()).isPresent());
        assertEquals(0, SessionSummaryState.empty().totalRequests());
    }

    @Test
    public void finished_session_is_not_active() throws AuditCommandException, CommandException {
        UUID request = UUID.randomUUID();
        receive(sessionId, request, 0, chat("gpt-4"));
        recorder.record(AuditSignal.cancelled(request, sessionId, T0.plusSeconds(1), null));

        SessionSummaryState state = replay();
        assertTrue(state.activeSessions().isEmpty());
        assertEquals("cancelled by client", state.requestLifecycle(request).get().getFailureReason().get());
    }

    @Test
    public void runner_builds_the_same_state_as_replay() throws AuditCommandException, CommandException,
            ProjectionException {
        recordScenario();
        InMemoryProjection<SessionSummaryState, AuditEvent> projection = SessionSummaries.inMemory();
        ProjectionRunner<AuditEvent> runner = new ProjectionRunner<>(projection, store,
                SessionSummaries.configuration().batchSize(4).build());

        while (runner.processBatch() > 0) {
            // drain
        }

        assertEquals(replay(), projection.getState());
        assertEquals(store.headPosition(), projection.lastCheckpoint().get().getPosition());
    }

    @Test
    public void rebuild_reproduces_the_state() throws AuditCommandException, CommandException, ProjectionException {
        recordScenario();
        InMemoryProjection<SessionSummaryState, AuditEvent> projection = SessionSummaries.inMemory();
        ProjectionRunner<AuditEvent> runner = new ProjectionRunner<>(projection, store,
                SessionSummaries.configuration().batchSize(3).build());
        runner.rebuild();
        SessionSummaryState first = projection.getState();

        runner.rebuild();

        assertEquals(first, projection.getState());
        assertEquals(replay(), first);
    }
}
