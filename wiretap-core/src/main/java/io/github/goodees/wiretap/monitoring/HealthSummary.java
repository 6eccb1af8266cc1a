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

import java.util.List;

/**
 * Counts of projections by status.
 */
@JsonPropertyOrder({ "total", "healthy", "lagging", "failed", "rebuilding" })
public final class HealthSummary {
    private final int total;
    private final int healthy;
    private final int lagging;
    private final int failed;
    private final int rebuilding;

    HealthSummary(int total, int healthy, int lagging, int failed, int rebuilding) {
        this.total = total;
        this.healthy = healthy;
        this.lagging = lagging;
        this.failed = failed;
        this.rebuilding = rebuilding;
    }

    static HealthSummary of(List<ProjectionHealth> projections) {
        int healthy = 0, lagging = 0, failed = 0, rebuilding = 0;
        for (ProjectionHealth health : projections) {
            switch (health.getStatus()) {
                case HEALTHY:
                    healthy++;
                    break;
                case LAGGING:
                    lagging++;
                    break;
                case FAILED:
                    failed++;
                    break;
                case REBUILDING:
                    rebuilding++;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown status " + health.getStatus());
            }
        }
        return new HealthSummary(projections.size(), healthy, lagging, failed, rebuilding);
    }

    @JsonProperty("total")
    public int getTotal() {
        return total;
    }

    @JsonProperty("healthy")
    public int getHealthy() {
        return healthy;
    }

    @JsonProperty("lagging")
    public int getLagging() {
        return lagging;
    }

    @JsonProperty("failed")
    public int getFailed() {
        return failed;
    }

    @JsonProperty("rebuilding")
    public int getRebuilding() {
        return rebuilding;
    }

    @Override
    public String toString() {
        return total + " projections: " + healthy + " healthy, " + lagging + " lagging, " + failed + " failed, "
                + rebuilding + " rebuilding";
    }
}
