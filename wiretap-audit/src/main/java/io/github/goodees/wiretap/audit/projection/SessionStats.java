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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * System wide totals over all sessions.
 */
@JsonPropertyOrder({ "totalSessions", "activeSessions", "totalRequests", "completedRequests", "failedRequests",
        "distinctModels", "averageResponseTime" })
public final class SessionStats {
    private final int totalSessions;
    private final int activeSessions;
    private final long totalRequests;
    private final long completedRequests;
    private final long failedRequests;
    private final int distinctModels;
    private final Duration averageResponseTime;

    SessionStats(int totalSessions, int activeSessions, long totalRequests, long completedRequests,
            long failedRequests, int distinctModels, Duration averageResponseTime) {
        this.totalSessions = totalSessions;
        this.activeSessions = activeSessions;
        this.totalRequests = totalRequests;
        this.completedRequests = completedRequests;
        this.failedRequests = failedRequests;
        this.distinctModels = distinctModels;
        this.averageResponseTime = averageResponseTime;
    }

    static SessionStats of(Collection<SessionSummary> sessions) {
        int active = 0;
        long requests = 0, completed = 0, failed = 0, responses = 0, responseTimeMs = 0;
        Set<String> models = new HashSet<>();
        for (SessionSummary session : sessions) {
            if (session.isActive()) {
                active++;
            }
            requests += session.getRequestCount();
            completed += session.getCompletedCount();
            failed += session.getFailedCount();
            responses += session.getResponses();
            responseTimeMs += session.getResponseTimeMs();
            models.addAll(session.getModelsUsed());
        }
        // weighted by responses, not an average of session averages
        Duration average = responses == 0 ? null : Duration.ofMillis(responseTimeMs / responses);
        return new SessionStats(sessions.size(), active, requests, completed, failed, models.size(), average);
    }

    @JsonProperty("totalSessions")
    public int getTotalSessions() {
        return totalSessions;
    }

    @JsonProperty("activeSessions")
    public int getActiveSessions() {
        return activeSessions;
    }

    @JsonProperty("totalRequests")
    public long getTotalRequests() {
        return totalRequests;
    }

    @JsonProperty("completedRequests")
    public long getCompletedRequests() {
        return completedRequests;
    }

    @JsonProperty("failedRequests")
    public long getFailedRequests() {
        return failedRequests;
    }

    @JsonProperty("distinctModels")
    public int getDistinctModels() {
        return distinctModels;
    }

    @JsonProperty("averageResponseTime")
    public Optional<Duration> getAverageResponseTime() {
        return Optional.ofNullable(averageResponseTime);
    }

    @Override
    public String toString() {
        return totalSessions + " sessions (" + activeSessions + " active), " + totalRequests + " requests: "
                + completedRequests + " completed, " + failedRequests + " failed";
    }
}
