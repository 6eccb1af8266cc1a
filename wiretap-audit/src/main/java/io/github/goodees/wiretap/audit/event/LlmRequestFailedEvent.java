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

import org.immutables.value.Value;

import java.util.Optional;

/**
 * Request failed, or was cancelled by the client. Either way the request will not complete.
 */
@Value.Immutable
public interface LlmRequestFailedEvent extends AuditEvent {
    String getReason();

    /**
     * The phase of proxying where the failure happened, as reported by the proxy.
     * @return phase, if known
     */
    Optional<String> getPhase();

    @Value.Default
    default boolean isCancelled() {
        return false;
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableLlmRequestFailedEvent.Builder {

    }
}
