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

/**
 * Phase of handling a request in which it failed.
 */
public enum FailureStage {
    REQUEST_VALIDATION,
    AUTHENTICATION,
    AUTHORIZATION,
    REQUEST_PROCESSING,
    MODEL_INVOCATION,
    RESPONSE_GENERATION,
    RESPONSE_VALIDATION,
    RESPONSE_DELIVERY
}
