package io.github.goodees.wiretap.runner;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.goodees.wiretap.core.projection.Checkpoint;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time health of one projection.
 */
@JsonPropertyOrder({ "name", "status", "checkpoint", "events_processed", "last_error", "lag_seconds",
        "consecutive_failures" })
public final class ProjectionHealth {
    private final String name;
    private final ProjectionStatus status;
    private final Checkpoint checkpoint;
    private final long eventsProcessed;
    private final String lastError;
    private final Duration lag;
    private final int consecutiveFailures;

    public ProjectionHealth(String name, ProjectionStatus status, Checkpoint checkpoint, long eventsProcessed,
            String lastError, Duration lag, int consecutiveFailures) {
        this.name = Objects.requireNonNull(name);
        this.status = Objects.requireNonNull(status);
        this.checkpoint = checkpoint;
        this.eventsProcessed = eventsProcessed;
        this.lastError = lastError;
        this.lag = lag;
        this.consecutiveFailures = consecutiveFailures;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("status")
    public ProjectionStatus getStatus() {
        return status;
    }

    @JsonProperty("checkpoint")
    public Optional<Checkpoint> getCheckpoint() {
        return Optional.ofNullable(checkpoint);
    }

    @JsonProperty("events_processed")
    public long getEventsProcessed() {
        return eventsProcessed;
    }

    @JsonProperty("last_error")
    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Time since the last applied event while there are events left to process.
     * @return lag, empty when not known
     */
    @JsonIgnore
    public Optional<Duration> getLag() {
        return Optional.ofNullable(lag);
    }

    @JsonProperty("lag_seconds")
    public Optional<Double> getLagSeconds() {
        return getLag().map(l -> l.toMillis() / 1000.0);
    }

    @JsonProperty("consecutive_failures")
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == ProjectionStatus.FAILED;
    }

    @JsonIgnore
    public boolean isLagging() {
        return status == ProjectionStatus.LAGGING;
    }

    @Override
    public String toString() {
        return "ProjectionHealth[" + name + ": " + status + ", checkpoint=" + checkpoint + ", processed="
                + eventsProcessed + ", failures=" + consecutiveFailures + ", lastError=" + lastError + "]";
    }
}
