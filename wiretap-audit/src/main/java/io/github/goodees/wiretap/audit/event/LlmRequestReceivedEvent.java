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

import java.util.Map;

/**
 * Client request reached the proxy. Stored on the session stream.
 */
@Value.Immutable
public interface LlmRequestReceivedEvent extends AuditEvent {
    String getMethod();

    String getUri();

    Map<String, String> getHeaders();

    long getBodySize();

    String getProvider();

    String getModelId();

    String getPrompt();

    /**
     * Request parameters other than model and prompt. Values are JSON texts, e.g. {@code 0.7} or {@code "auto"}.
     * @return parameters by name
     */
    Map<String, String> getParameters();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableLlmRequestReceivedEvent.Builder {

    }
}
