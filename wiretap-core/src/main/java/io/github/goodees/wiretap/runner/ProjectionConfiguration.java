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

import io.github.goodees.wiretap.core.store.StreamSelector;
import io.github.goodees.wiretap.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.time.Duration;

/**
 * Settings of a {@link ProjectionRunner}.
 */
@Value.Immutable
@ImmutablesSupport
public interface ProjectionConfiguration {
    /**
     * Wait between polls when the projection caught up with the store.
     */
    @Value.Default
    default Duration getPollInterval() {
        return Duration.ofMillis(100);
    }

    @Value.Default
    default int getBatchSize() {
        return 1000;
    }

    @Value.Default
    default BackoffPolicy getBackoff() {
        return BackoffPolicy.defaults();
    }

    /**
     * Whether the runner replays all history before it starts following the store.
     */
    @Value.Default
    default boolean isRebuildOnStartup() {
        return false;
    }

    /**
     * Batch processing taking longer marks the projection as lagging.
     */
    @Value.Default
    default Duration getMaxLagWarning() {
        return Duration.ofSeconds(60);
    }

    /**
     * Number of events between progress reports of a rebuild.
     */
    @Value.Default
    default int getProgressInterval() {
        return 1000;
    }

    @Value.Default
    default StreamSelector getSelector() {
        return StreamSelector.all();
    }

    @Value.Check
    default void check() {
        if (getBatchSize() < 1) {
            throw new IllegalArgumentException("Batch size must be positive, was " + getBatchSize());
        }
        if (getProgressInterval() < 1) {
            throw new IllegalArgumentException("Progress interval must be positive, was " + getProgressInterval());
        }
        if (getPollInterval().isNegative()) {
            throw new IllegalArgumentException("Poll interval must not be negative");
        }
    }

    static ProjectionConfiguration defaults() {
        return new Builder().build();
    }

    class Builder extends ImmutableProjectionConfiguration.Builder {

    }
}
