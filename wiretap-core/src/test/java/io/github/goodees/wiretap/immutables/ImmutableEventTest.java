package io.github.goodees.wiretap.immutables;

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
import io.github.goodees.wiretap.core.store.JacksonSerialization;
import io.github.goodees.wiretap.immutables.events.DepositedEvent;
import io.github.goodees.wiretap.immutables.events.LedgerEvent;
import io.github.goodees.wiretap.immutables.events.WithdrawnEvent;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ImmutableEventTest {
    private final JacksonSerialization<LedgerEvent> serialization = JacksonSerialization.of(LedgerEvent.class);

    @Test
    public void events_serialize_with_type_property() throws EventStoreException {
        String json = serialization.serialize(DepositedEvent.of("acc-1", 100));
        assertThat(json, containsString("\"type\":\"Deposited\""));
        assertThat(json, containsString("\"amount\":100"));
        assertEquals("Deposited", serialization.typeOf(DepositedEvent.of("acc-1", 100)));
    }

    @Test
    public void absent_optionals_are_not_written() throws EventStoreException {
        String json = serialization.serialize(WithdrawnEvent.builder().account("acc-1").amount(5).build());
        assertThat(json, not(containsString("note")));
    }

    @Test
    public void events_deserialize_from_json() throws EventStoreException {
        String json = "{\"type\":\"Withdrawn\",\"account\":\"acc-2\",\"amount\":30,\"note\":\"rent\"}";
        LedgerEvent event = serialization.deserialize(1, json, "Withdrawn");
        assertTrue(event instanceof WithdrawnEvent);
        assertEquals("acc-2", event.getAccount());
        assertEquals("rent", ((WithdrawnEvent) event).getNote().get());
    }

    @Test
    public void unknown_properties_are_ignored() throws EventStoreException {
        String json = "{\"type\":\"Deposited\",\"account\":\"acc-3\",\"amount\":1,\"currency\":\"EUR\"}";
        LedgerEvent event = serialization.deserialize(1, json, "Deposited");
        assertEquals(DepositedEvent.of("acc-3", 1), event);
        assertFalse(event instanceof WithdrawnEvent);
    }

    @Test
    public void unknown_type_deserializes_to_null() throws EventStoreException {
        assertNull(serialization.deserialize(1, "{\"type\":\"Transferred\",\"account\":\"a\"}", "Transferred"));
    }

    @Test
    public void corrupt_payload_fails() {
        try {
            serialization.deserialize(1, "{\"type\":\"Deposited\",\"amount\":", "Deposited");
            fail("Corrupt payload should not deserialize");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.SERIALIZATION, e.getFault());
        }
    }
}
