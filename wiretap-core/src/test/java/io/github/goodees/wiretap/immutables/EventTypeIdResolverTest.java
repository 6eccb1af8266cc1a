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

import com.fasterxml.jackson.databind.type.TypeFactory;
import io.github.goodees.wiretap.immutables.events.DepositedEvent;
import io.github.goodees.wiretap.immutables.events.LedgerEvent;
import io.github.goodees.wiretap.immutables.events.WithdrawnEvent;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class EventTypeIdResolverTest {

    private ImmutableEventTypeResolver resolver;
    private TypeFactory tf;

    @Before
    public void setUp() {
        resolver = new ImmutableEventTypeResolver();
        tf = TypeFactory.defaultInstance();
        resolver.init(tf.constructType(LedgerEvent.class));
    }

    @Test
    public void type_id_generated_for_supported_types() {
        DepositedEvent event = DepositedEvent.of("acc-1", 100);
        assertEquals("Deposited", resolver.idFromValueAndType(event, DepositedEvent.class));
        assertEquals("Withdrawn", resolver.idFromValue(WithdrawnEvent.builder().account("acc-1").amount(5).build()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void type_id_generation_fails_on_unsupported_types() {
        resolver.idFromValue(13);
    }

    @Test
    public void class_is_instantiated_for_supported_types() {
        assertTrue(DepositedEvent.class.isAssignableFrom(resolver.typeFromId("Deposited", tf).getRawClass()));
        assertTrue(WithdrawnEvent.class.isAssignableFrom(resolver.typeFromId("Withdrawn", tf).getRawClass()));
    }

    @Test
    public void unknown_type_id_resolves_to_nothing() {
        assertNull(resolver.typeFromId("Transferred", tf));
    }
}
