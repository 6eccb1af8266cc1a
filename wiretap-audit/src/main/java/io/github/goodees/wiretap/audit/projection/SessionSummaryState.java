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
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Summaries of all sessions. Immutable, so that readers of a projection keep a consistent snapshot.
 */
public final class SessionSummaryState {
    private static final SessionSummaryState EMPTY = new SessionSummaryState(null, null);

    private final Map<UUID, SessionSummary> sessions;
    private final Map<UUID, UUID> requestSessions;

    @JsonCreator
    SessionSummaryState(@JsonProperty("sessions") Map<UUID, SessionSummary> sessions,
            @JsonProperty("requestSessions") Map<UUID, UUID> requestSessions) {
        this.sessions = sessions == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(sessions));
        this.requestSessions = requestSessions == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(requestSessions));
    }

    public static SessionSummaryState empty() {
        return EMPTY;
    }

    SessionSummaryState with(SessionSummary summary) {
        Map<UUID, SessionSummary> updatedSessions = new TreeMap<>(sessions);
        updatedSessions.put(summary.getSessionId(), summary);
        Map<UUID, UUID> updatedRequests = new TreeMap<>(requestSessions);
        summary.getRequests().keySet().forEach(r -> updatedRequests.put(r, summary.getSessionId()));
        return new SessionSummaryState(updatedSessions, updatedRequests);
    }

    public Map<UUID, SessionSummary> getSessions() {
        return sessions;
    }

    /**
     * Index of requests to the session they belong to.
     * @return session ids by request id
     */
    public Map<UUID, UUID> getRequestSessions() {
        return requestSessions;
    }

    public Optional<SessionSummary> session(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<SessionSummary> activeSessions() {
        return sessions.values().stream().filter(SessionSummary::isActive).collect(Collectors.toList());
    }

    /**
     * Sessions with a request still in progress that saw no activity for the given time, as of now.
     * @param inactiveFor minimal time since the last activity
     * @return stalled sessions
     */
    public List<SessionSummary> inactiveSessions(Duration inactiveFor) {
        return inactiveSessions(inactiveFor, Instant.now());
    }

    public List<SessionSummary> inactiveSessions(Duration inactiveFor, Instant now) {
        Instant cutoff = now.minus(inactiveFor);
        return sessions.values().stream()
                .filter(SessionSummary::isActive)
                .filter(s -> !s.getLastActivity().isAfter(cutoff))
                .collect(Collectors.toList());
    }

    public SessionStats stats() {
        return SessionStats.of(sessions.values());
    }

    /**
     * Observable state of a request, a request that received response reads as completed.
     * @param requestId the request
     * @return settled lifecycle state, empty for unknown request
     */
    public Optional<LifecycleState> requestLifecycle(UUID requestId) {
        return Optional.ofNullable(requestSessions.get(requestId))
                .flatMap(this::session)
                .flatMap(s -> s.request(requestId));
    }

    public long totalRequests() {
        return sessions.values().stream().mapToLong(SessionSummary::getRequestCount).sum();
    }

    public List<SessionSummary> sessionsUsingModel(String model) {
        return sessions.values().stream()
                .filter(s -> s.getModelsUsed().contains(model))
                .collect(Collectors.toList());
    }

    public int sessionCount() {
        return sessions.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SessionSummaryState that = (SessionSummaryState) o;
        return sessions.equals(that.sessions) && requestSessions.equals(that.requestSessions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessions, requestSessions);
    }

    @Override
    public String toString() {
        return "SessionSummaryState[sessions=" + sessions.size() + ", requests=" + requestSessions.size() + "]";
    }
}
