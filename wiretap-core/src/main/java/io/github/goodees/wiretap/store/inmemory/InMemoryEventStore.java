package io.github.goodees.wiretap.store.inmemory;

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

import io.github.goodees.wiretap.core.EventIds;
import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.core.store.EventLog;
import io.github.goodees.wiretap.core.store.EventStore;
import io.github.goodees.wiretap.core.store.EventStoreException;
import io.github.goodees.wiretap.core.store.StoredEventList;
import io.github.goodees.wiretap.core.store.StreamSelector;
import io.github.goodees.wiretap.core.store.StreamWrite;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping all events in memory. Suitable for tests and single-process deployments where history
 * need not survive restart.
 *
 * <p>Writers lock only the streams they write, in order of stream ids, so writes to unrelated streams proceed
 * in parallel. Global positions are assigned under a short global lock once versions are verified.
 */
public class InMemoryEventStore<E> implements EventStore<E>, EventLog<E> {
    private final ConcurrentMap<StreamId, Stream<E>> storage = new ConcurrentHashMap<>();
    private final List<StoredEvent<E>> globalLog = new ArrayList<>();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    private Stream<E> stream(StreamId streamId) {
        return storage.computeIfAbsent(streamId, (i) -> new Stream<>());
    }

    @Override
    public Map<StreamId, Long> append(Collection<StreamWrite<E>> writes) throws EventStoreException {
        if (writes.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<StreamId, StreamWrite<E>> byStream = new TreeMap<>();
        for (StreamWrite<E> write : writes) {
            if (byStream.put(write.getStreamId(), write) != null) {
                throw EventStoreException.duplicateStream(write.getStreamId());
            }
        }
        List<Stream<E>> locked = new ArrayList<>();
        try {
            for (StreamId streamId : byStream.keySet()) {
                Stream<E> stream = stream(streamId);
                stream.lock.lock();
                locked.add(stream);
            }
            for (StreamWrite<E> write : byStream.values()) {
                long current = stream(write.getStreamId()).version();
                long expected = write.getExpectedVersion();
                if (expected != ANY_VERSION && expected != current) {
                    throw EventStoreException.optimisticLock(write.getStreamId(), current, expected);
                }
            }
            return store(writes);
        } finally {
            for (Stream<E> stream : locked) {
                stream.lock.unlock();
            }
        }
    }

    private Map<StreamId, Long> store(Collection<StreamWrite<E>> writes) {
        Map<StreamId, Long> result = new LinkedHashMap<>();
        synchronized (globalLog) {
            for (StreamWrite<E> write : writes) {
                Stream<E> stream = stream(write.getStreamId());
                long version = stream.version();
                for (E payload : write.getEvents()) {
                    StoredEvent<E> event = new StoredEvent<>(write.getStreamId(), EventIds.next(), ++version,
                            globalLog.size() + 1, clock.instant(), payload, write.getMetadata());
                    globalLog.add(event);
                    stream.add(event);
                }
                result.put(write.getStreamId(), version);
            }
        }
        return result;
    }

    @Override
    public StoredEvents<E> readStreams(Collection<StreamId> streamIds) {
        List<StoredEvent<E>> result = new ArrayList<>();
        // multi-stream writes become visible at once
        synchronized (globalLog) {
            for (StreamId streamId : new HashSet<>(streamIds)) {
                Stream<E> stream = storage.get(streamId);
                if (stream != null) {
                    result.addAll(stream.snapshot());
                }
            }
        }
        result.sort((a, b) -> Long.compare(a.getPosition(), b.getPosition()));
        return new StoredEventList<>(result);
    }

    @Override
    public StoredEvents<E> readAfter(StreamSelector selector, long afterPosition, int limit) {
        List<StoredEvent<E>> candidates;
        synchronized (globalLog) {
            // positions start at 1 and have no gaps, so position p is at index p-1
            int from = (int) Math.min(Math.max(afterPosition, 0), globalLog.size());
            candidates = new ArrayList<>(globalLog.subList(from, globalLog.size()));
        }
        return new StoredEventList<>(candidates.stream()
                .filter(e -> selector.matches(e.getStreamId()))
                .limit(limit)
                .collect(toList()));
    }

    @Override
    public long streamVersion(StreamId streamId) {
        Stream<E> stream = storage.get(streamId);
        return stream == null ? NO_STREAM : stream.version();
    }

    @Override
    public long headPosition() {
        synchronized (globalLog) {
            return globalLog.size();
        }
    }

    /**
     * Streams that have at least one event.
     * @return stream ids
     */
    public Set<StreamId> streams() {
        Set<StreamId> result = new HashSet<>();
        storage.forEach((id, stream) -> {
            if (stream.version() > 0) {
                result.add(id);
            }
        });
        return result;
    }

    static class Stream<E> {
        final ReentrantLock lock = new ReentrantLock();
        private final List<StoredEvent<E>> events = new ArrayList<>();

        synchronized long version() {
            return events.size();
        }

        synchronized void add(StoredEvent<E> event) {
            events.add(event);
        }

        synchronized List<StoredEvent<E>> snapshot() {
            return new ArrayList<>(events);
        }
    }
}
