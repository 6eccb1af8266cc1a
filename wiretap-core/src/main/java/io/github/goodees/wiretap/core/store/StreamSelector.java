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

import io.github.goodees.wiretap.core.StreamId;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Selects the streams a reader of the global feed is interested in.
 */
public final class StreamSelector {
    private static final StreamSelector ALL = new StreamSelector(Collections.emptySet(), Collections.emptySet());

    private final Set<String> kinds;
    private final Set<StreamId> streams;

    private StreamSelector(Set<String> kinds, Set<StreamId> streams) {
        this.kinds = kinds;
        this.streams = streams;
    }

    public static StreamSelector all() {
        return ALL;
    }

    public static StreamSelector kinds(String... kinds) {
        if (kinds.length == 0) {
            throw new IllegalArgumentException("At least one stream kind must be selected");
        }
        return new StreamSelector(Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(kinds))),
                Collections.emptySet());
    }

    public static StreamSelector streams(StreamId... streams) {
        if (streams.length == 0) {
            throw new IllegalArgumentException("At least one stream must be selected");
        }
        return new StreamSelector(Collections.emptySet(),
                Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(streams))));
    }

    public boolean isAll() {
        return kinds.isEmpty() && streams.isEmpty();
    }

    public Set<String> getKinds() {
        return kinds;
    }

    public Set<StreamId> getStreams() {
        return streams;
    }

    public boolean matches(StreamId streamId) {
        if (isAll()) {
            return true;
        }
        return kinds.contains(streamId.kind()) || streams.contains(streamId);
    }

    @Override
    public String toString() {
        if (isAll()) {
            return "all streams";
        }
        return kinds.isEmpty() ? "streams " + streams : "kinds " + kinds;
    }
}
