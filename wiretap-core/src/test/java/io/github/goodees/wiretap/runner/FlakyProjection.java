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

import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.projection.Checkpoint;
import io.github.goodees.wiretap.core.projection.Projection;
import io.github.goodees.wiretap.core.projection.ProjectionException;
import io.github.goodees.wiretap.immutables.events.LedgerEvent;
import io.github.goodees.wiretap.projection.Balances;
import io.github.goodees.wiretap.projection.inmemory.InMemoryProjection;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Balances projection failing a given number of times before applying an event.
 */
class FlakyProjection implements Projection<Balances, LedgerEvent> {
    private final InMemoryProjection<Balances, LedgerEvent> delegate;
    final AtomicInteger failuresLeft = new AtomicInteger();
    final AtomicInteger applied = new AtomicInteger();

    FlakyProjection(String name) {
        this.delegate = new InMemoryProjection<>(name, Balances::empty, Balances::apply);
    }

    FlakyProjection failing(int times) {
        failuresLeft.set(times);
        return this;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public Balances getState() {
        return delegate.getState();
    }

    @Override
    public void applyEvent(StoredEvent<LedgerEvent> event) throws ProjectionException {
        if (failuresLeft.getAndUpdate(f -> f > 0 ? f - 1 : 0) > 0) {
            throw ProjectionException.applyFailed(getName(), event, new IllegalStateException("flaky"));
        }
        delegate.applyEvent(event);
        applied.incrementAndGet();
    }

    @Override
    public Optional<Checkpoint> lastCheckpoint() {
        return delegate.lastCheckpoint();
    }

    @Override
    public void setCheckpoint(Checkpoint checkpoint) throws ProjectionException {
        delegate.setCheckpoint(checkpoint);
    }

    @Override
    public void reset() {
        delegate.reset();
    }
}
