package io.github.goodees.wiretap.core.store;

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

import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Stored events already materialized in memory.
 */
public class StoredEventList<E> implements EventLog.StoredEvents<E> {
    private final List<StoredEvent<E>> events;
    private boolean stop = false;

    public StoredEventList(List<StoredEvent<E>> events) {
        this.events = events;
    }

    public static <E> StoredEventList<E> empty() {
        return new StoredEventList<>(Collections.emptyList());
    }

    @Override
    public void foreach(Consumer<? super StoredEvent<E>> consumer) {
        for (StoredEvent<E> event : events) {
            if (stop) {
                break;
            }
            consumer.accept(event);
        }
    }

    @Override
    public <R> R reduce(R initial, BiFunction<R, ? super StoredEvent<E>, R> reducer) {
        R result = initial;
        for (StoredEvent<E> event : events) {
            if (stop) {
                break;
            }
            result = reducer.apply(result, event);
        }
        return result;
    }

    @Override
    public void stop() {
        stop = true;
    }

    @Override
    public void close() {
    }
}
