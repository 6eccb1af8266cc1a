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

import java.util.Objects;

@JsonPropertyOrder({ "severity", "projection", "message" })
public final class Alert {
    private final AlertSeverity severity;
    private final String projection;
    private final String message;

    public Alert(AlertSeverity severity, String projection, String message) {
        this.severity = Objects.requireNonNull(severity);
        this.projection = Objects.requireNonNull(projection);
        this.message = Objects.requireNonNull(message);
    }

    @JsonProperty("severity")
    public AlertSeverity getSeverity() {
        return severity;
    }

    @JsonProperty("projection")
    public String getProjection() {
        return projection;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Alert alert = (Alert) o;
        return severity == alert.severity && projection.equals(alert.projection) && message.equals(alert.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, projection, message);
    }

    @Override
    public String toString() {
        return severity + " " + projection + ": " + message;
    }
}
