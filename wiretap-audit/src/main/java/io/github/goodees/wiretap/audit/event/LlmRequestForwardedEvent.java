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

import java.time.Instant;

/**
 * Proxy forwarded the request to the provider.
 */
@Value.Immutable
public interface LlmRequestForwardedEvent extends AuditEvent {
    String getTargetUrl();

    Instant getStartTime();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableLlmRequestForwardedEvent.Builder {

    }
}
