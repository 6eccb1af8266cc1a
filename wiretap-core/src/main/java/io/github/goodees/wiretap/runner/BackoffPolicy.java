package io.github.goodees.wiretap.runner;

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
import org.immutables.value.Value;

import java.time.Duration;

/**
 * Exponential backoff between failed projection batches. Delay before retry {@code n} is
 * {@code min(initialDelay * factor^(n-1), maxDelay)}, and the projection fails once the number of consecutive
 * failures exceeds {@code maxRetries}.
 */
@Value.Immutable
@ImmutablesSupport
public interface BackoffPolicy {
    @Value.Default
    default int getMaxRetries() {
        return 5;
    }

    @Value.Default
    default Duration getInitialDelay() {
        return Duration.ofMillis(100);
    }

    @Value.Default
    default Duration getMaxDelay() {
        return Duration.ofSeconds(30);
    }

    @Value.Default
    default double getFactor() {
        return 2.0;
    }

    @Value.Check
    default void check() {
        if (getMaxRetries() < 0) {
            throw new IllegalArgumentException("Max retries must not be negative");
        }
        if (getFactor() < 1.0) {
            throw new IllegalArgumentException("Backoff factor must be at least 1, was " + getFactor());
        }
        if (getInitialDelay().isNegative() || getMaxDelay().compareTo(getInitialDelay()) < 0) {
            throw new IllegalArgumentException("Max delay must be at least initial delay, which must not be negative");
        }
    }

    /**
     * Delay before given retry.
     * @param attempt number of the retry, starting at 1
     * @return delay
     */
    default Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Retry attempts start at 1, was " + attempt);
        }
        double millis = getInitialDelay().toMillis() * Math.pow(getFactor(), attempt - 1);
        long max = getMaxDelay().toMillis();
        return Duration.ofMillis(millis >= max ? max : (long) millis);
    }

    default boolean isExhausted(int consecutiveFailures) {
        return consecutiveFailures > getMaxRetries();
    }

    static BackoffPolicy defaults() {
        return new Builder().build();
    }

    class Builder extends ImmutableBackoffPolicy.Builder {

    }
}
