package io.github.goodees.wiretap.audit.event;

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
import io.github.goodees.wiretap.audit.lifecycle.LifecycleSignal;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState;
import org.immutables.value.Value;

/**
 * A signal arrived that the request in its current stage could not accept, e.g. a second receive of the same
 * request, or a response to a request that was not forwarded yet.
 */
@Value.Immutable
public interface InvalidTransitionEvent extends AuditEvent {
    LifecycleSignal.Kind getSignal();

    LifecycleState.Stage getStage();

    String getReason();

    @Override
    @JsonIgnore
    default boolean isDiagnostic() {
        return true;
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableInvalidTransitionEvent.Builder {

    }
}
