package io.github.goodees.wiretap.audit.parse;

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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Provider, model and prompt extracted from a request body.
 */
public final class ParsedRequest {
    public static final String UNKNOWN_PROVIDER = "unknown";
    public static final String UNKNOWN_MODEL = "unknown-model";

    private final String provider;
    private final String modelId;
    private final String prompt;
    private final Map<String, String> parameters;

    public ParsedRequest(String provider, String modelId, String prompt, Map<String, String> parameters) {
        this.provider = Objects.requireNonNull(provider, "Provider must be specified");
        this.modelId = Objects.requireNonNull(modelId, "Model must be specified");
        this.prompt = Objects.requireNonNull(prompt, "Prompt must be specified");
        this.parameters = parameters == null || parameters.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(parameters));
    }

    /**
     * Request without a body.
     * @return unknown provider and model with empty prompt
     */
    public static ParsedRequest unknown() {
        return new ParsedRequest(UNKNOWN_PROVIDER, UNKNOWN_MODEL, "", null);
    }

    /**
     * Record of a body that could not be parsed.
     * @param error description of the failure
     * @return unknown provider and model, the prompt describes the failure
     */
    public static ParsedRequest fallback(String error) {
        return new ParsedRequest(UNKNOWN_PROVIDER, UNKNOWN_MODEL, "parse failed: " + error, null);
    }

    public String getProvider() {
        return provider;
    }

    public String getModelId() {
        return modelId;
    }

    public String getPrompt() {
        return prompt;
    }

    /**
     * Remaining parameters of the request, values in JSON form.
     * @return parameters sorted by name
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ParsedRequest that = (ParsedRequest) o;
        return provider.equals(that.provider) && modelId.equals(that.modelId) && prompt.equals(that.prompt)
                && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, modelId, prompt, parameters);
    }

    @Override
    public String toString() {
        return "ParsedRequest[" + provider + "/" + modelId + ", parameters=" + parameters.keySet() + "]";
    }
}
