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

import java.util.Optional;

@Value.Immutable
public interface SessionEnded extends AuditEntryType {
    long getDurationMs();

    SessionFinalState getFinalState();

    int getSuccessfulRequests();

    int getFailedRequests();

    /**
     * Code of the error that ended the session, for {@link SessionFinalState#FAILED_DURING_PROCESSING}.
     * @return error code
     */
    Optional<String> getErrorCode();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableSessionEnded.Builder {

    }
}
