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
import io.github.goodees.wiretap.audit.parse.RequestParser;
import io.github.goodees.wiretap.core.command.CommandException;
import io.github.goodees.wiretap.core.command.CommandExecutor;
import io.github.goodees.wiretap.core.command.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the proxy: turns every signal into its command and executes it.
 *
 * <p>Malformed bodies, duplicate and out of order signals all end up as some recorded event. Only failures of the
 * store itself and signals that cannot be attributed to a request are reported to the caller.
 */
public class AuditRecorder {
    private static final Logger logger = LoggerFactory.getLogger(AuditRecorder.class);

    private final CommandExecutor<AuditEvent> executor;
    private final RequestParser parser;

    public AuditRecorder(CommandExecutor<AuditEvent> executor, RequestParser parser) {
        this.executor = executor;
        this.parser = parser;
    }

    public CommandResult<AuditEvent> record(AuditSignal signal) throws AuditCommandException, CommandException {
        RequestCommand command = commandFor(signal);
        CommandResult<AuditEvent> result = executor.execute(command);
        logger.debug("{} recorded {} events", command, result.getEvents().size());
        return result;
    }

    /**
     * Record the signal asynchronously.
     * @param signal the signal
     * @return result of the command; completes exceptionally with {@link AuditCommandException} when there is no
     *     command for the signal
     */
    public CompletableFuture<CommandResult<AuditEvent>> submit(AuditSignal signal) {
        try {
            return executor.submit(commandFor(signal));
        } catch (AuditCommandException e) {
            CompletableFuture<CommandResult<AuditEvent>> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }

    public RequestCommand commandFor(AuditSignal signal) throws AuditCommandException {
        switch (signal.getKind()) {
            case REQUEST_RECEIVED:
                return RecordRequestReceived.from(signal, parser);
            case REQUEST_FORWARDED:
                return RecordRequestForwarded.from(signal);
            case RESPONSE_RECEIVED:
                return RecordResponseReceived.from(signal);
            case RESPONSE_RETURNED:
                return RecordResponseReturned.from(signal);
            case ERROR:
            case CANCELLED:
                return RecordRequestFailed.from(signal);
            default:
                throw AuditCommandException.wrongSignal(AuditRecorder.class, signal);
        }
    }
}
