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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleSignal;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState;
import io.github.goodees.wiretap.audit.lifecycle.RequestLifecycle;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Activity of one session. Immutable, changes return a modified copy.
 */
public final class SessionSummary {
    private final UUID sessionId;
    private final Instant firstActivity;
    private final Instant lastActivity;
    private final Map<UUID, LifecycleState> requests;
    private final Set<String> modelsUsed;
    private final int diagnostics;
    private final int parseFailures;
    private final int responses;
    private final long responseTimeMs;

    @JsonCreator
    SessionSummary(@JsonProperty("sessionId") UUID sessionId, @JsonProperty("firstActivity") Instant firstActivity,
            @JsonProperty("lastActivity") Instant lastActivity,
            @JsonProperty("requests") Map<UUID, LifecycleState> requests,
            @JsonProperty("modelsUsed") Set<String> modelsUsed, @JsonProperty("diagnostics") int diagnostics,
            @JsonProperty("parseFailures") int parseFailures, @JsonProperty("responses") int responses,
            @JsonProperty("responseTimeMs") long responseTimeMs) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session id must be specified");
        this.firstActivity = Objects.requireNonNull(firstActivity);
        this.lastActivity = Objects.requireNonNull(lastActivity);
        this.requests = requests == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requests));
        this.modelsUsed = modelsUsed == null ? Collections.emptySet()
                : Collections.unmodifiableSet(new TreeSet<>(modelsUsed));
        this.diagnostics = diagnostics;
        this.parseFailures = parseFailures;
        this.responses = responses;
        this.responseTimeMs = responseTimeMs;
    }

    static SessionSummary start(UUID sessionId, Instant at) {
        return new SessionSummary(sessionId, at, at, null, null, 0, 0, 0, 0);
    }

    SessionSummary touch(Instant at) {
        Instant first = at.isBefore(firstActivity) ? at : firstActivity;
        Instant last = at.isAfter(lastActivity) ? at : lastActivity;
        return new SessionSummary(sessionId, first, last, requests, modelsUsed, diagnostics, parseFailures,
                responses, responseTimeMs);
    }

    SessionSummary withDiagnostic(boolean parseFailure) {
        return new SessionSummary(sessionId, firstActivity, lastActivity, requests, modelsUsed, diagnostics + 1,
                parseFailures + (parseFailure ? 1 : 0), responses, responseTimeMs);
    }

    SessionSummary withResponseTime(long durationMs) {
        return new SessionSummary(sessionId, firstActivity, lastActivity, requests, modelsUsed, diagnostics,
                parseFailures, responses + 1, responseTimeMs + Math.max(0, durationMs));
    }

    SessionSummary withModel(String model) {
        Set<String> models = new TreeSet<>(modelsUsed);
        models.add(model);
        return new SessionSummary(sessionId, firstActivity, lastActivity, requests, models, diagnostics,
                parseFailures, responses, responseTimeMs);
    }

    /**
     * Move the lifecycle of the signalled request, and let the signal count as activity for the other requests
     * of the session.
     */
    SessionSummary withSignal(UUID requestId, LifecycleSignal signal) {
        Map<UUID, LifecycleState> updated = new LinkedHashMap<>();
        LifecycleSignal other = LifecycleSignal.of(LifecycleSignal.Kind.OTHER, signal.getAt());
        requests.forEach((id, state) -> updated.put(id, id.equals(requestId) ? state
                : RequestLifecycle.transition(state, other)));
        LifecycleState current = updated.getOrDefault(requestId, LifecycleState.notStarted(requestId));
        updated.put(requestId, RequestLifecycle.transition(current, signal));
        return new SessionSummary(sessionId, firstActivity, lastActivity, updated, modelsUsed, diagnostics,
                parseFailures, responses, responseTimeMs);
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public Instant getFirstActivity() {
        return firstActivity;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * Lifecycles of the requests of the session as folded from the events, in order of first appearance.
     * @return requests by id
     */
    public Map<UUID, LifecycleState> getRequests() {
        return requests;
    }

    public Set<String> getModelsUsed() {
        return modelsUsed;
    }

    public int getDiagnostics() {
        return diagnostics;
    }

    public int getParseFailures() {
        return parseFailures;
    }

    /**
     * Number of provider responses the session received.
     */
    public int getResponses() {
        return responses;
    }

    /**
     * Sum of durations between forwarding a request and receiving its response.
     */
    public long getResponseTimeMs() {
        return responseTimeMs;
    }

    @JsonIgnore
    public Optional<Duration> getAverageResponseTime() {
        return responses == 0 ? Optional.empty() : Optional.of(Duration.ofMillis(responseTimeMs / responses));
    }

    public Optional<LifecycleState> request(UUID requestId) {
        return Optional.ofNullable(requests.get(requestId)).map(RequestLifecycle::settle);
    }

    @JsonIgnore
    public int getRequestCount() {
        return requests.size();
    }

    @JsonIgnore
    public int getCompletedCount() {
        return count(LifecycleState.Stage.COMPLETED);
    }

    @JsonIgnore
    public int getFailedCount() {
        return count(LifecycleState.Stage.FAILED);
    }

    private int count(LifecycleState.Stage stage) {
        return (int) requests.values().stream()
                .map(RequestLifecycle::settle)
                .filter(s -> s.getStage() == stage)
                .count();
    }

    /**
     * Session with a request that did not finish yet.
     * @return true if any request is in progress
     */
    @JsonIgnore
    public boolean isActive() {
        return requests.values().stream().map(RequestLifecycle::settle).anyMatch(s -> !s.isTerminal());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SessionSummary that = (SessionSummary) o;
        return diagnostics == that.diagnostics && parseFailures == that.parseFailures
                && responses == that.responses && responseTimeMs == that.responseTimeMs
                && sessionId.equals(that.sessionId) && firstActivity.equals(that.firstActivity)
                && lastActivity.equals(that.lastActivity) && requests.equals(that.requests)
                && modelsUsed.equals(that.modelsUsed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, firstActivity, lastActivity, requests, modelsUsed, diagnostics,
            parseFailures, responses, responseTimeMs);
    }

    @Override
    public String toString() {
        return "SessionSummary[" + sessionId + ", requests=" + requests.size() + ", diagnostics=" + diagnostics
                + "]";
    }
}
