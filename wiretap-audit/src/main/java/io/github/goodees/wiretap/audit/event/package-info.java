/**
 * Events of the audit trail. Every intercepted request produces one {@link LlmRequestReceivedEvent} on its
 * session stream, the rest of its lifecycle is recorded on the request stream. Signals that did not fit the
 * lifecycle are recorded as diagnostics rather than dropped.
 */
@ImmutablesSupport
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

import io.github.goodees.wiretap.immutables.ImmutablesSupport;
