package io.github.goodees.wiretap.audit.command;

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
import io.github.goodees.wiretap.audit.event.LlmRequestReceivedEvent;
import io.github.goodees.wiretap.audit.event.RequestParsingFailedEvent;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleSignal;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState;
import io.github.goodees.wiretap.audit.parse.ParseException;
import io.github.goodees.wiretap.audit.parse.ParsedRequest;
import io.github.goodees.wiretap.audit.parse.RequestParser;
import io.github.goodees.wiretap.core.command.CommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Records a received request on its session stream.
 *
 * <p>The body is parsed once, when the command is created. A body that cannot be parsed is recorded with
 * fallback values, and {@link RequestParsingFailedEvent} is added to the request stream.
 */
public class RecordRequestReceived extends RequestCommand {
    private static final Logger logger = LoggerFactory.getLogger(RecordRequestReceived.class);

    private final ParsedRequest parsed;
    private final String parseError;

    RecordRequestReceived(AuditSignal signal, ParsedRequest parsed, String parseError)
            throws AuditCommandException {
        super(signal, AuditSignal.Kind.REQUEST_RECEIVED);
        this.parsed = parsed;
        this.parseError = parseError;
    }

    public static RecordRequestReceived from(AuditSignal signal, RequestParser parser)
            throws AuditCommandException {
        Optional<byte[]> body = signal.getBody();
        if (!body.isPresent() || body.get().length == 0) {
            return new RecordRequestReceived(signal, ParsedRequest.unknown(), null);
        }
        try {
            return new RecordRequestReceived(signal, parser.parse(body.get(), signal.getUri().orElse(""),
                    signal.getHeaders()), null);
        } catch (ParseException e) {
            logger.warn("Request {} recorded with fallback values: {}", signal.getRequestId(), e.getMessage());
            return new RecordRequestReceived(signal, ParsedRequest.fallback(e.getMessage()), e.getMessage());
        }
    }

    public ParsedRequest getParsed() {
        return parsed;
    }

    public Optional<String> getParseError() {
        return Optional.ofNullable(parseError);
    }

    @Override
    protected LifecycleSignal.Kind lifecycleSignal() {
        return LifecycleSignal.Kind.RECEIVED;
    }

    @Override
    protected void record(LifecycleState state, Emitter<AuditEvent> emitter) throws CommandException {
        emitter.emit(sessionStream(), LlmRequestReceivedEvent.builder()
                .requestId(getRequestId())
                .sessionId(getSessionId())
                .occurredAt(signal.getTimestamp())
                .method(signal.getMethod().orElse(""))
                .uri(signal.getUri().orElse(""))
                .headers(signal.getHeaders())
                .bodySize(signal.getBodySize())
                .provider(parsed.getProvider())
                .modelId(parsed.getModelId())
                .prompt(parsed.getPrompt())
                .parameters(parsed.getParameters())
                .build());
        if (parseError != null) {
            emitter.emit(requestStream(), RequestParsingFailedEvent.builder()
                    .requestId(getRequestId())
                    .sessionId(getSessionId())
                    .occurredAt(signal.getTimestamp())
                    .error(parseError)
                    .uri(signal.getUri().orElse(""))
                    .bodySize(signal.getBodySize())
                    .build());
        }
    }
}
