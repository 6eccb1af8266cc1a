package io.github.goodees.wiretap.projection.inmemory;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Projection holding its state in memory.
 *
 * <p>The reducer should return new state instead of modifying the previous one; readers then hold a consistent
 * snapshot for as long as they need it.
 */
public class InMemoryProjection<S, E> implements Projection<S, E> {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryProjection.class);

    private final String name;
    private final Supplier<S> initialState;
    private final BiFunction<S, StoredEvent<E>, S> reducer;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private S state;
    private long lastPosition;
    private Checkpoint checkpoint;

    public InMemoryProjection(String name, Supplier<S> initialState, BiFunction<S, StoredEvent<E>, S> reducer) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.initialState = Objects.requireNonNull(initialState, "Initial state must be specified");
        this.reducer = Objects.requireNonNull(reducer, "Reducer must be specified");
        this.state = initialState.get();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public S getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void applyEvent(StoredEvent<E> event) throws ProjectionException {
        lock.writeLock().lock();
        try {
            if (event.getPosition() <= lastPosition) {
                logger.debug("{} skips {}, already applied up to {}", name, event, lastPosition);
                return;
            }
            state = reducer.apply(state, event);
            lastPosition = event.getPosition();
        } catch (RuntimeException e) {
            throw ProjectionException.applyFailed(name, event, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Checkpoint> lastCheckpoint() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(checkpoint);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setCheckpoint(Checkpoint checkpoint) throws ProjectionException {
        lock.writeLock().lock();
        try {
            if (this.checkpoint != null && checkpoint.isBefore(this.checkpoint)) {
                throw ProjectionException.checkpointRegression(name, this.checkpoint, checkpoint);
            }
            this.checkpoint = checkpoint;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void reset() {
        lock.writeLock().lock();
        try {
            state = initialState.get();
            lastPosition = 0;
            checkpoint = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "InMemoryProjection[" + name + "]";
    }
}
