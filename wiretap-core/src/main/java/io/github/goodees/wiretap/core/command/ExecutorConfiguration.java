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

import io.github.goodees.wiretap.core.store.EventStoreException;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Configuration of {@link CommandExecutor}.
 */
public class ExecutorConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final RetryStrategy retryStrategy;

    /**
     * Create configuration for synchronous and asynchronous execution.
     * @param name The name of the executor
     * @param executorService executor service commands run on
     * @param schedulerService scheduler service to delay retries with. Should be different from executorService.
     * @param retryStrategy retry strategy to delegate retryDelay to
     */
    public ExecutorConfiguration(String name, ExecutorService executorService,
            ScheduledExecutorService schedulerService, RetryStrategy retryStrategy) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
    }

    /**
     * Create configuration for synchronous execution only.
     * @param name the name of the executor
     * @param retryStrategy retry strategy to delegate retryDelay to
     */
    public ExecutorConfiguration(String name, RetryStrategy retryStrategy) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = null;
        this.schedulerService = null;
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
    }

    /**
     * Synchronous configuration that retries conflicts.
     * @param name the name of the executor
     * @return configuration with {@link #defaultRetries()}
     */
    public static ExecutorConfiguration synchronous(String name) {
        return new ExecutorConfiguration(name, defaultRetries());
    }

    public String executorName() {
        return name;
    }

    public ExecutorService executorService() {
        if (executorService == null) {
            throw new IllegalStateException("Executor " + name + " is configured for synchronous execution only");
        }
        return executorService;
    }

    public ScheduledExecutorService schedulerService() {
        if (schedulerService == null) {
            throw new IllegalStateException("Executor " + name + " is configured for synchronous execution only");
        }
        return schedulerService;
    }

    /**
     * Decide whether and when the command should be retried in case of failure.
     * @param command command that failed
     * @param t the throwable the command failed with
     * @param completedAttempts number of attempts so far, at least {@code 1}
     * @return negative in order to fail the command, zero to immediately retry it, positive for delay in ms until next attempt
     */
    public long retryDelay(Command<?, ?> command, Throwable t, int completedAttempts) {
        return retryStrategy.retryDelay(command, t, completedAttempts);
    }

    /**
     * Strategy for retrying a command
     */
    @FunctionalInterface
    public interface RetryStrategy {
        long DO_NOT_RETRY = -1;
        long RETRY_NOW = 0;

        long retryDelay(Command<?, ?> command, Throwable t, int completedAttempts);
    }

    final static RetryStrategy NO_RETRIES = (command, t, attempts) -> RetryStrategy.DO_NOT_RETRY;

    /**
     * Retry strategy that doesn't retry any failed command.
     * @return a retry strategy
     */
    public static RetryStrategy noRetries() {
        return NO_RETRIES;
    }

    /**
     * Create retry strategy that allows fix number of attempts before failing the command, with delay of 100 milliseconds.
     * @param attempts number of attempts to allow
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts) {
        return new FixedRepeat(attempts, 100);
    }

    /**
     * Create retry strategy that allows fix number of attempts with defined retry delay.
     * @param attempts number of attempt to allow
     * @param delay delay before retrying the command
     * @param unit unit of delay
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts, long delay, TimeUnit unit) {
        return new FixedRepeat(attempts, unit.toMillis(delay));
    }

    /**
     * Restrict a strategy to optimistic lock failures. Other failures are not retried.
     * @param delegate strategy for conflicts
     * @return a retry strategy
     */
    public static RetryStrategy onConflict(RetryStrategy delegate) {
        return (command, t, attempts) -> isConflict(t) ? delegate.retryDelay(command, t, attempts)
                : RetryStrategy.DO_NOT_RETRY;
    }

    /**
     * Retry conflicts immediately, up to 5 attempts in total.
     * @return a retry strategy
     */
    public static RetryStrategy defaultRetries() {
        return onConflict(new FixedRepeat(5, RetryStrategy.RETRY_NOW));
    }

    static boolean isConflict(Throwable t) {
        if (t instanceof CommandException) {
            return ((CommandException) t).isConflict();
        }
        return t instanceof EventStoreException && ((EventStoreException) t).isConflict();
    }

    static class FixedRepeat implements RetryStrategy {
        final int attempts;
        final long delay;

        FixedRepeat(int attempts, long delay) {
            this.attempts = attempts;
            this.delay = delay;
        }

        @Override
        public long retryDelay(Command<?, ?> command, Throwable t, int completedAttempts) {
            return completedAttempts < attempts ? delay : DO_NOT_RETRY;
        }
    }
}
