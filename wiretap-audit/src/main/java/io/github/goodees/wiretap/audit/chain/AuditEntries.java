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

import io.github.goodees.wiretap.audit.event.AuditEvent;
import io.github.goodees.wiretap.audit.event.InvalidTransitionEvent;
import io.github.goodees.wiretap.audit.event.LlmRequestFailedEvent;
import io.github.goodees.wiretap.audit.event.LlmRequestReceivedEvent;
import io.github.goodees.wiretap.audit.event.LlmResponseReceivedEvent;
import io.github.goodees.wiretap.audit.event.RequestParsingFailedEvent;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps audit events to payloads of the audit chain. Forwarding and delivery have no entry of their own.
 */
public final class AuditEntries {
    private AuditEntries() {

    }

    public static Optional<AuditEntryType> toEntry(AuditEvent event) throws AuditException {
        if (event instanceof LlmRequestReceivedEvent) {
            LlmRequestReceivedEvent received = (LlmRequestReceivedEvent) event;
            return Optional.of(RequestReceived.builder()
                    .provider(received.getProvider())
                    .modelId(received.getModelId())
                    .promptHash(Hash256.of(received.getPrompt()))
                    .parametersHash(Hash256.of(CanonicalJson.write(received.getParameters())))
                    .build());
        } else if (event instanceof LlmResponseReceivedEvent) {
            LlmResponseReceivedEvent response = (LlmResponseReceivedEvent) event;
            return Optional.of(ResponseGenerated.builder()
                    .responseHash(Hash256.of(response.getStatus() + "_" + CanonicalJson.write(response.getHeaders())))
                    .responseSizeBytes(response.getBodySize())
                    .generationDurationMs(response.getDurationMs())
                    .build());
        } else if (event instanceof LlmRequestFailedEvent) {
            LlmRequestFailedEvent failed = (LlmRequestFailedEvent) event;
            return Optional.of(RequestFailed.builder()
                    .errorType(errorType(failed))
                    .errorMessageHash(Hash256.of(failed.getReason()))
                    .failureStage(failureStage(failed.getPhase().orElse("")))
                    .build());
        } else if (event instanceof RequestParsingFailedEvent) {
            return Optional.of(RequestFailed.builder()
                    .errorType(ErrorType.VALIDATION_ERROR)
                    .errorMessageHash(Hash256.of(((RequestParsingFailedEvent) event).getError()))
                    .failureStage(FailureStage.REQUEST_VALIDATION)
                    .build());
        } else if (event instanceof InvalidTransitionEvent) {
            return Optional.of(SystemError.builder()
                    .component(SystemComponent.PROXY_SERVICE)
                    .severity(ErrorSeverity.LOW)
                    .detailsHash(Hash256.of(((InvalidTransitionEvent) event).getReason()))
                    .build());
        }
        return Optional.empty();
    }

    static ErrorType errorType(LlmRequestFailedEvent failed) {
        if (failed.getReason().toLowerCase(Locale.ROOT).contains("timeout")) {
            return ErrorType.TIMEOUT_ERROR;
        }
        return failed.isCancelled() ? ErrorType.NETWORK_ERROR : ErrorType.EXTERNAL_SERVICE_ERROR;
    }

    static FailureStage failureStage(String phase) {
        String normalized = phase.toLowerCase(Locale.ROOT);
        if (normalized.contains("forward") || normalized.contains("upstream")) {
            return FailureStage.MODEL_INVOCATION;
        } else if (normalized.contains("response") || normalized.contains("return")) {
            return FailureStage.RESPONSE_DELIVERY;
        } else if (normalized.contains("auth")) {
            return FailureStage.AUTHENTICATION;
        }
        return FailureStage.REQUEST_PROCESSING;
    }
}
