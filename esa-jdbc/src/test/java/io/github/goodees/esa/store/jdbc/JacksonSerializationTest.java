package io.github.goodees.esa.store.jdbc;

/*-
 * #%L
 * esa
 * %%
 * Copyright (C) 2017 Patrik Duditš
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

import io.github.goodees.esa.core.AggregateEvent;
import io.github.goodees.esa.core.types.Versioned;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

public class JacksonSerializationTest {
    private final JacksonSerialization<AggregateEvent<?>> events = JacksonSerialization.forEvents(JdbcTest.CATALOG);
    private final JacksonSerialization<Versioned<?>> snapshots = JacksonSerialization.forSnapshots(JdbcTest.CATALOG);

    @Test
    public void payload_holds_properties_only() {
        String payload = events.serialize(new CounterIncremented(5, "manual"));
        assertThat(payload, containsString("\"amount\":5"));
        assertThat(payload, containsString("\"reason\":\"manual\""));
        assertThat(payload, not(containsString("CounterIncremented")));
    }

    @Test
    public void stored_version_selects_class() {
        assertThat(events.deserialize("CounterIncremented", 1, "{\"amount\":5}"),
            instanceOf(CounterIncrementedV1.class));
        CounterIncremented current = (CounterIncremented) events.deserialize("CounterIncremented", 2,
            "{\"amount\":5,\"reason\":\"manual\"}");
        assertEquals(5, current.getAmount());
        assertEquals("manual", current.getReason());
    }

    @Test
    public void events_without_properties_are_supported() {
        assertEquals("{}", events.serialize(new CounterReset()));
        assertNotNull(events.deserialize("CounterReset", 1, "{}"));
    }

    @Test
    public void unknown_properties_are_ignored() {
        CounterSnapshot snapshot = (CounterSnapshot) snapshots.deserialize("CounterSnapshot", 1,
            "{\"total\":3,\"lastReason\":\"x\",\"removed\":true}");
        assertEquals(3, snapshot.getTotal());
    }

    @Test
    public void unknown_types_deserialize_to_null() {
        assertNull(events.deserialize("CounterRenamed", 1, "{}"));
        assertNull(events.deserialize("CounterIncremented", 3, "{}"));
    }

    @Test
    public void types_outside_of_base_type_are_not_supported() {
        assertNull(events.deserialize("CounterSnapshot", 1, "{\"total\":3}"));
        assertNull(events.toSerializable(new CounterSnapshot(1, "x")));
        assertNull(snapshots.toSerializable(new JdbcEventStoreTest.Uncataloged()));
        assertNotNull(snapshots.toSerializable(new CounterSnapshot(1, "x")));
        assertNotNull(events.toSerializable(new CounterReset()));
    }

    @Test(expected = IllegalStateException.class)
    public void malformed_payload_fails() {
        events.deserialize("CounterIncremented", 2, "{\"amount\":");
    }
}
