package io.github.goodees.wiretap.core;

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

import java.time.YearMonth;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a stream, a totally ordered append log for one logical subject.
 *
 * <p>The textual form is {@code {kind}:{key}}, e.g. {@code session:0f8fad5b-d9cb-469f-a165-70867728950e} or
 * {@code metrics:2025-01}. The kind names the family of streams and may not contain a colon, the key is any
 * non-empty remainder.
 */
public final class StreamId implements Comparable<StreamId> {
    public static final String SESSION = "session";
    public static final String REQUEST = "request";
    public static final String ANALYSIS = "analysis";
    public static final String EXTRACTION = "extraction";
    public static final String TESTCASE = "testcase";
    public static final String USER_SETTINGS = "user-settings";
    public static final String METRICS = "metrics";

    private static final char SEPARATOR = ':';

    private final String kind;
    private final String key;
    private final String value;

    private StreamId(String kind, String key) {
        this.kind = kind;
        this.key = key;
        this.value = kind + SEPARATOR + key;
    }

    public static StreamId of(String kind, String key) {
        Objects.requireNonNull(kind, "Stream kind must be specified");
        Objects.requireNonNull(key, "Stream key must be specified");
        if (kind.isEmpty() || kind.indexOf(SEPARATOR) >= 0 || !kind.trim().equals(kind)) {
            throw new IllegalArgumentException("Invalid stream kind '" + kind + "'");
        }
        if (key.trim().isEmpty()) {
            throw new IllegalArgumentException("Stream key of kind " + kind + " must not be blank");
        }
        return new StreamId(kind, key);
    }

    public static StreamId of(String kind, UUID id) {
        return of(kind, Objects.requireNonNull(id, "Stream id must be specified").toString());
    }

    public static StreamId session(UUID sessionId) {
        return of(SESSION, sessionId);
    }

    public static StreamId request(UUID requestId) {
        return of(REQUEST, requestId);
    }

    public static StreamId metrics(YearMonth month) {
        return of(METRICS, month.toString());
    }

    /**
     * Parse textual form of stream id.
     * @param value value in form {@code kind:key}
     * @return parsed id
     * @throws IllegalArgumentException when value is not a valid stream id
     */
    public static StreamId parse(String value) {
        Objects.requireNonNull(value, "Stream id must be specified");
        int separator = value.indexOf(SEPARATOR);
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Stream id '" + value + "' is not in form kind:key");
        }
        return of(value.substring(0, separator), value.substring(separator + 1));
    }

    public String kind() {
        return kind;
    }

    public String key() {
        return key;
    }

    public boolean isOfKind(String kind) {
        return this.kind.equals(kind);
    }

    @Override
    public int compareTo(StreamId o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return value.equals(((StreamId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
