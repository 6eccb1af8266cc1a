package io.github.goodees.wiretap.core.command;

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

import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.store.EventLog;
import io.github.goodees.wiretap.core.store.EventStore;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.StreamWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Executes commands against an event store.
 *
 * <p>Each attempt reads the declared streams, folds them into the command's state, lets the command emit events
 * and appends them with the versions observed while reading as expected versions. A concurrent append to any of
 * the written streams therefore aborts the attempt; whether it is retried is decided by
 * {@link ExecutorConfiguration#retryDelay(Command, Throwable, int)}.
 *
 * @param <E> type of events
 */
public class CommandExecutor<E> {
    static final String METADATA_COMMAND = "command";
    static final String METADATA_ATTEMPT = "attempt";

    private final EventStore<E> store;
    private final EventLog<E> log;
    private final ExecutorConfiguration conf;
    private final Logger logger;

    public CommandExecutor(EventStore<E> store, EventLog<E> log, ExecutorConfiguration conf) {
        this.store = store;
        this.log = log;
        this.conf = conf;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.executorName());
    }

    /**
     * Execute command on calling thread, retrying as configured.
     * @param command the command
     * @param <S> type of command state
     * @return the result of successful attempt
     * @throws CommandException failure of last attempt
     */
    public <S> CommandResult<E> execute(Command<S, E> command) throws CommandException {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return attempt(command, attempts);
            } catch (CommandException e) {
                long delay = conf.retryDelay(command, e, attempts);
                if (delay < 0) {
                    throw e;
                }
                logger.debug("Retrying {} in {} ms after attempt {} failed: {}", command, delay, attempts,
                    e.getMessage());
                if (delay > 0) {
                    sleep(command, delay);
                }
            }
        }
    }

    /**
     * Execute command on the configured executor service. Retries with positive delay are scheduled on scheduler
     * service, so that other commands can proceed in the meantime.
     * @param command the command
     * @param <S> type of command state
     * @return the promise of result, completing exceptionally with the failure of the last attempt
     */
    public <S> CompletableFuture<CommandResult<E>> submit(Command<S, E> command) {
        CompletableFuture<CommandResult<E>> result = new CompletableFuture<>();
        conf.executorService().submit(() -> run(command, result, 1));
        return result;
    }

    private <S> void run(Command<S, E> command, CompletableFuture<CommandResult<E>> result, int attempt) {
        if (result.isDone()) {
            logger.info("Command {} was completed before attempt {}", command, attempt);
            return;
        }
        try {
            result.complete(attempt(command, attempt));
        } catch (CommandException | RuntimeException e) {
            long delay = conf.retryDelay(command, e, attempt);
            if (delay == 0) {
                conf.executorService().submit(() -> run(command, result, attempt + 1));
            } else if (delay > 0) {
                conf.schedulerService().schedule(
                    () -> conf.executorService().submit(() -> run(command, result, attempt + 1)), delay,
                    TimeUnit.MILLISECONDS);
            } else {
                result.completeExceptionally(unwrapCompletionException(e));
            }
        }
    }

    protected <S> CommandResult<E> attempt(Command<S, E> command, int attempt) throws CommandException {
        Set<StreamId> declared = command.streams();
        if (declared.isEmpty()) {
            throw new IllegalArgumentException("Command " + command + " declares no streams");
        }
        Map<StreamId, Long> observed = new TreeMap<>();
        declared.forEach(s -> observed.put(s, EventStore.NO_STREAM));
        S state = fold(command, observed);

        EmittedEvents emitted = new EmittedEvents(declared);
        try {
            command.handle(state, emitted);
        } catch (RuntimeException e) {
            throw CommandException.stateFailed(command, e);
        }
        if (emitted.isEmpty()) {
            logger.debug("{} emitted no events", command);
            return new CommandResult<>(Collections.emptyList(), observed, attempt);
        }

        List<StreamWrite<E>> writes = emitted.toWrites(observed, metadata(command, attempt));
        try {
            Map<StreamId, Long> versions = new TreeMap<>(observed);
            versions.putAll(store.append(writes));
            logger.debug("{} appended {} in attempt {}", command, writes, attempt);
            return new CommandResult<>(writes, versions, attempt);
        } catch (EventStoreException e) {
            if (e.isConflict()) {
                throw CommandException.conflict(command, e);
            }
            throw CommandException.storeFailed(command, e);
        }
    }

    private <S> S fold(Command<S, E> command, Map<StreamId, Long> observed) throws CommandException {
        try (EventLog.StoredEvents<E> events = log.readStreams(command.streams())) {
            return events.reduce(command.initialState(), (state, event) -> {
                observed.put(event.getStreamId(), event.getVersion());
                return command.apply(state, event);
            });
        } catch (EventStoreException e) {
            throw CommandException.storeFailed(command, e);
        } catch (RuntimeException e) {
            if (e.getCause() instanceof EventStoreException) {
                throw CommandException.storeFailed(command, e.getCause());
            }
            throw CommandException.stateFailed(command, e);
        }
    }

    protected Map<String, String> metadata(Command<?, ?> command, int attempt) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(METADATA_COMMAND, command.getClass().getSimpleName());
        metadata.put(METADATA_ATTEMPT, String.valueOf(attempt));
        return metadata;
    }

    private void sleep(Command<?, ?> command, long delay) throws CommandException {
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CommandException.interrupted(command, e);
        }
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    class EmittedEvents implements Command.Emitter<E> {
        private final Set<StreamId> declared;
        // in order of first emission to a stream
        private final Map<StreamId, List<E>> events = new LinkedHashMap<>();

        EmittedEvents(Set<StreamId> declared) {
            this.declared = declared;
        }

        @Override
        public void emit(StreamId streamId, E event) throws CommandException {
            if (!declared.contains(streamId)) {
                throw CommandException.undeclaredStream(streamId, declared);
            }
            events.computeIfAbsent(streamId, s -> new ArrayList<>()).add(event);
        }

        boolean isEmpty() {
            return events.isEmpty();
        }

        List<StreamWrite<E>> toWrites(Map<StreamId, Long> observed, Map<String, String> metadata) {
            List<StreamWrite<E>> writes = new ArrayList<>();
            events.forEach((stream, list) -> writes.add(new StreamWrite<>(stream, observed.get(stream), list,
                    metadata)));
            return writes;
        }
    }
}
