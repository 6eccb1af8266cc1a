package io.github.goodees.wiretap.audit.chain;

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

@Value.Immutable
public interface ResponseGenerated extends AuditEntryType {
    /**
     * Hash of the response as far as the proxy captured it, e.g. status and size when the body is not kept.
     * @return hash of the response
     */
    Hash256 getResponseHash();

    long getResponseSizeBytes();

    long getGenerationDurationMs();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableResponseGenerated.Builder {

    }
}
