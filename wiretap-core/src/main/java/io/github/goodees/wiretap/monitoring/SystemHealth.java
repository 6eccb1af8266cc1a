package io.github.goodees.wiretap.monitoring;

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
import io.github.goodees.wiretap.runner.ProjectionHealth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated health of all supervised projections.
 *
 * <p>Any failed projection makes the system UNHEALTHY, otherwise any lagging one makes it DEGRADED. Rebuilding
 * projections count as neither.
 */
@JsonPropertyOrder({ "status", "projections", "summary", "checked_at" })
public final class SystemHealth {
    private final SystemStatus status;
    private final List<ProjectionHealth> projections;
    private final HealthSummary summary;
    private final Instant checkedAt;

    private SystemHealth(SystemStatus status, List<ProjectionHealth> projections, HealthSummary summary,
            Instant checkedAt) {
        this.status = status;
        this.projections = projections;
        this.summary = summary;
        this.checkedAt = checkedAt;
    }

    public static SystemHealth of(List<ProjectionHealth> projections, Instant checkedAt) {
        List<ProjectionHealth> copy = Collections.unmodifiableList(new ArrayList<>(projections));
        HealthSummary summary = HealthSummary.of(copy);
        SystemStatus status;
        if (summary.getFailed() > 0) {
            status = SystemStatus.UNHEALTHY;
        } else if (summary.getLagging() > 0) {
            status = SystemStatus.DEGRADED;
        } else {
            status = SystemStatus.HEALTHY;
        }
        return new SystemHealth(status, copy, summary, Objects.requireNonNull(checkedAt));
    }

    @JsonProperty("status")
    public SystemStatus getStatus() {
        return status;
    }

    @JsonProperty("projections")
    public List<ProjectionHealth> getProjections() {
        return projections;
    }

    @JsonProperty("summary")
    public HealthSummary getSummary() {
        return summary;
    }

    @JsonProperty("checked_at")
    public Instant getCheckedAt() {
        return checkedAt;
    }

    @Override
    public String toString() {
        return "SystemHealth[" + status + ", " + summary + ", checked at " + checkedAt + "]";
    }
}
