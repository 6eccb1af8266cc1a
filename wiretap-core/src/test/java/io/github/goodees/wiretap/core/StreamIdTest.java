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

import org.junit.Test;

import java.time.YearMonth;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class StreamIdTest {

    @Test
    public void stream_id_is_kind_and_key() {
        UUID id = UUID.fromString("0b1c2d3e-4f50-4617-8a9b-0c1d2e3f4a5b");
        StreamId streamId = StreamId.session(id);
        assertEquals("session:0b1c2d3e-4f50-4617-8a9b-0c1d2e3f4a5b", streamId.toString());
        assertEquals(StreamId.SESSION, streamId.kind());
        assertEquals(id.toString(), streamId.key());
        assertTrue(streamId.isOfKind(StreamId.SESSION));
        assertFalse(streamId.isOfKind(StreamId.REQUEST));
    }

    @Test
    public void metrics_stream_is_keyed_by_month() {
        assertEquals("metrics:2024-03", StreamId.metrics(YearMonth.of(2024, 3)).toString());
    }

    @Test
    public void parsed_id_equals_constructed_one() {
        StreamId parsed = StreamId.parse("user-settings:alice");
        assertEquals(StreamId.of(StreamId.USER_SETTINGS, "alice"), parsed);
        assertEquals(parsed.hashCode(), StreamId.of(StreamId.USER_SETTINGS, "alice").hashCode());
    }

    @Test
    public void key_may_contain_separator() {
        StreamId parsed = StreamId.parse("testcase:suite:42");
        assertEquals("testcase", parsed.kind());
        assertEquals("suite:42", parsed.key());
    }

    @Test(expected = IllegalArgumentException.class)
    public void id_without_kind_is_rejected() {
        StreamId.parse(":key");
    }

    @Test(expected = IllegalArgumentException.class)
    public void id_without_key_is_rejected() {
        StreamId.parse("session:");
    }

    @Test(expected = IllegalArgumentException.class)
    public void blank_key_is_rejected() {
        StreamId.of(StreamId.REQUEST, "  ");
    }

    @Test
    public void ids_order_by_text() {
        assertTrue(StreamId.parse("request:a").compareTo(StreamId.parse("session:a")) < 0);
        assertTrue(StreamId.parse("session:b").compareTo(StreamId.parse("session:a")) > 0);
    }
}
