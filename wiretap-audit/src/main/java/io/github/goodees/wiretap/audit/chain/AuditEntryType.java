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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Payload of an audit entry. Sensitive content (prompts, responses, error messages) is only present as hash.
 *
 * <p>Unknown properties fail deserialization, a restored entry has exactly the content that was hashed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ImmutableSessionStarted.class, name = "SessionStarted"),
        @JsonSubTypes.Type(value = ImmutableSessionEnded.class, name = "SessionEnded"),
        @JsonSubTypes.Type(value = ImmutableRequestReceived.class, name = "RequestReceived"),
        @JsonSubTypes.Type(value = ImmutableResponseGenerated.class, name = "ResponseGenerated"),
        @JsonSubTypes.Type(value = ImmutableRequestFailed.class, name = "RequestFailed"),
        @JsonSubTypes.Type(value = ImmutableSystemError.class, name = "SystemError") })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface AuditEntryType {

}
