package io.github.goodees.wiretap.audit.lifecycle;

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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Audit status of a single request. Instances are immutable, every transition creates a new one; use
 * {@link RequestLifecycle} to move between stages.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public final class LifecycleState {
    public enum Stage {
        NOT_STARTED,
        RECEIVED,
        FORWARDED,
        RESPONSE_RECEIVED,
        COMPLETED,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    private final UUID requestId;
    private final Stage stage;
    private final Instant receivedAt;
    private final Instant forwardedAt;
    private final Instant respondedAt;
    private final Instant finishedAt;
    private final String failureReason;

    @JsonCreator
    LifecycleState(@JsonProperty("requestId") UUID requestId, @JsonProperty("stage") Stage stage,
            @JsonProperty("receivedAt") Instant receivedAt, @JsonProperty("forwardedAt") Instant forwardedAt,
            @JsonProperty("respondedAt") Instant respondedAt, @JsonProperty("finishedAt") Instant finishedAt,
            @JsonProperty("failureReason") String failureReason) {
        this.requestId = Objects.requireNonNull(requestId, "Request id must be specified");
        this.stage = Objects.requireNonNull(stage, "Stage must be specified");
        this.receivedAt = receivedAt;
        this.forwardedAt = forwardedAt;
        this.respondedAt = respondedAt;
        this.finishedAt = finishedAt;
        this.failureReason = failureReason;
    }

    public static LifecycleState notStarted(UUID requestId) {
        return new LifecycleState(requestId, Stage.NOT_STARTED, null, null, null, null, null);
    }

    LifecycleState received(Instant at) {
        return new LifecycleState(requestId, Stage.RECEIVED, at, null, null, null, null);
    }

    LifecycleState forwarded(Instant at) {
        return new LifecycleState(requestId, Stage.FORWARDED, receivedAt, at, null, null, null);
    }

    LifecycleState responseReceived(Instant at) {
        return new LifecycleState(requestId, Stage.RESPONSE_RECEIVED, receivedAt, forwardedAt, at, null, null);
    }

    LifecycleState completed(Instant at) {
        return new LifecycleState(requestId, Stage.COMPLETED, receivedAt, forwardedAt, respondedAt, at, null);
    }

    LifecycleState failed(Instant at, String reason) {
        return new LifecycleState(requestId, Stage.FAILED, receivedAt, forwardedAt, respondedAt, at,
                reason == null ? "unknown" : reason);
    }

    public UUID getRequestId() {
        return requestId;
    }

    public Stage getStage() {
        return stage;
    }

    public Optional<Instant> getReceivedAt() {
        return Optional.ofNullable(receivedAt);
    }

    public Optional<Instant> getForwardedAt() {
        return Optional.ofNullable(forwardedAt);
    }

    public Optional<Instant> getRespondedAt() {
        return Optional.ofNullable(respondedAt);
    }

    /**
     * When the request completed or failed.
     * @return time of reaching terminal stage
     */
    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return stage.isTerminal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        LifecycleState that = (LifecycleState) o;
        return requestId.equals(that.requestId) && stage == that.stage
                && Objects.equals(receivedAt, that.receivedAt) && Objects.equals(forwardedAt, that.forwardedAt)
                && Objects.equals(respondedAt, that.respondedAt) && Objects.equals(finishedAt, that.finishedAt)
                && Objects.equals(failureReason, that.failureReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, stage, receivedAt, forwardedAt, respondedAt, finishedAt, failureReason);
    }

    @Override
    public String toString() {
        return "LifecycleState[" + requestId + " " + stage + (failureReason == null ? "" : ": " + failureReason)
                + "]";
    }
}
