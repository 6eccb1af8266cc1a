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

import io.github.goodees.wiretap.runner.ProjectionHealth;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives alerts from system health.
 */
public class Alerts {
    private Alerts() {

    }

    /**
     * Check health against thresholds. Failed projection raises critical alert, lag above max lag and consecutive
     * errors at or above the threshold raise warnings.
     * @param health the health
     * @param thresholds the thresholds
     * @return alerts in order of projections
     */
    public static List<Alert> check(SystemHealth health, AlertThresholds thresholds) {
        List<Alert> alerts = new ArrayList<>();
        for (ProjectionHealth projection : health.getProjections()) {
            if (projection.isFailed()) {
                alerts.add(new Alert(AlertSeverity.CRITICAL, projection.getName(), "Projection failed: "
                        + projection.getLastError().orElse("unknown error")));
            }
            Optional<Duration> lag = projection.getLag();
            if (lag.isPresent() && lag.get().compareTo(thresholds.getMaxLag()) > 0) {
                alerts.add(new Alert(AlertSeverity.WARNING, projection.getName(), "Projection lags "
                        + lag.get().getSeconds() + " s behind"));
            }
            if (projection.getConsecutiveFailures() >= thresholds.getMaxConsecutiveErrors()) {
                alerts.add(new Alert(AlertSeverity.WARNING, projection.getName(), "Projection failed "
                        + projection.getConsecutiveFailures() + " times in a row"));
            }
        }
        return alerts;
    }
}
