package io.github.goodees.esa.store.inmemory;

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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.goodees.esa.core.store.EventReader;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.example.banking.AccountAmountDepositedV2;
import io.github.goodees.esa.example.banking.AccountId;
import io.github.goodees.esa.example.banking.AccountOpened;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.goodees.esa.example.banking.Banking.event;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class InMemoryEventStoreTest {
    private final List<ILoggingEvent> warnings = new ArrayList<>();
    private final AppenderBase<ILoggingEvent> warningCollector = new AppenderBase<ILoggingEvent>() {
        @Override
        protected void append(ILoggingEvent event) {
            if (event.getLevel() == Level.WARN) {
                warnings.add(event);
            }
        }
    };
    private InMemoryEventStore store;
    private AccountId alice;
    private AccountId bob;

    @Before
    public void setUp() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger logger = ctx.getLogger(InMemoryEventStore.class);
        warningCollector.setContext(ctx);
        warningCollector.start();
        logger.addAppender(warningCollector);
        store = new InMemoryEventStore();
        alice = AccountId.random();
        bob = AccountId.random();
    }

    @After
    public void tearDown() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(InMemoryEventStore.class).detachAppender(warningCollector);
    }

    @Test
    public void events_of_new_aggregate_are_stored() throws EventStoreException {
        store.write(Arrays.asList(event(alice, 2, new AccountAmountDepositedV2(1, "EUR")),
            event(alice, 1, new AccountOpened("Alice"))));
        assertEquals(2, store.storedVersion(alice));
        assertThat(versions(store.read(alice)), contains(1L, 2L));
    }

    @Test
    public void first_version_must_follow_stored_version() throws EventStoreException {
        store.write(Collections.singletonList(event(alice, 1, new AccountOpened("Alice"))));
        try {
            store.write(Collections.singletonList(event(alice, 3, new AccountOpened("Alice"))));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OUT_OF_SYNC, e.getFault());
        }
        try {
            store.write(Collections.singletonList(event(alice, 1, new AccountOpened("Alice"))));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OUT_OF_SYNC, e.getFault());
        }
        assertEquals(1, store.storedVersion(alice));
    }

    @Test
    public void invalid_sequence_stores_nothing() {
        try {
            store.write(Arrays.asList(event(bob, 1, new AccountOpened("Bob")),
                event(alice, 1, new AccountOpened("Alice")), event(alice, 3, new AccountOpened("Alice"))));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.INVALID_SEQUENCE, e.getFault());
        }
        assertEquals(0, store.storedVersion(alice));
        assertEquals(0, store.storedVersion(bob));
    }

    @Test
    public void write_spanning_aggregates_is_all_or_nothing() throws EventStoreException {
        store.write(Collections.singletonList(event(bob, 1, new AccountOpened("Bob"))));
        try {
            store.write(Arrays.asList(event(alice, 1, new AccountOpened("Alice")),
                event(bob, 1, new AccountOpened("Bob"))));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OUT_OF_SYNC, e.getFault());
        }
        assertEquals(0, store.storedVersion(alice));
        assertEquals(1, store.storedVersion(bob));
    }

    @Test
    public void store_without_transactions_warns_and_applies_aggregates_separately() throws EventStoreException {
        InMemoryEventStore degraded = new InMemoryEventStore(false);
        degraded.write(Collections.singletonList(event(bob, 1, new AccountOpened("Bob"))));
        try {
            degraded.write(Arrays.asList(event(alice, 1, new AccountOpened("Alice")),
                event(bob, 1, new AccountOpened("Bob"))));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OUT_OF_SYNC, e.getFault());
        }
        assertEquals(1, degraded.storedVersion(alice));
        assertEquals(1, warnings.size());
        assertThat(warnings.get(0).getFormattedMessage(), containsString("not atomic"));
    }

    @Test
    public void cancelled_write_stores_nothing() {
        try {
            store.write(Collections.singletonList(event(alice, 1, new AccountOpened("Alice"))), () -> true);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CANCELLED, e.getFault());
        }
        assertEquals(0, store.storedVersion(alice));
    }

    @Test
    public void empty_write_is_accepted() throws EventStoreException {
        store.write(Collections.emptyList());
        assertEquals(0, store.storedVersion(alice));
    }

    @Test
    public void read_honours_version_bounds() throws EventStoreException {
        store.write(Arrays.asList(event(alice, 1, new AccountOpened("Alice")),
            event(alice, 2, new AccountAmountDepositedV2(1, "EUR")),
            event(alice, 3, new AccountAmountDepositedV2(2, "EUR")),
            event(alice, 4, new AccountAmountDepositedV2(3, "EUR"))));

        assertThat(versions(store.read(alice, 2, 3)), contains(2L, 3L));
        assertThat(versions(store.read(alice, 3, 0)), contains(3L, 4L));
        assertThat(versions(store.read(alice, 0, 2)), contains(1L, 2L));
    }

    @Test
    public void iteration_can_be_stopped() throws EventStoreException {
        store.write(Arrays.asList(event(alice, 1, new AccountOpened("Alice")),
            event(alice, 2, new AccountAmountDepositedV2(1, "EUR"))));
        List<Long> seen = new ArrayList<>();
        try (EventReader.StoredEvents events = store.read(alice)) {
            events.foreach(e -> {
                seen.add(e.getAggregateVersion());
                events.stop();
            });
        }
        assertThat(seen, contains(1L));
    }

    private static List<Long> versions(EventReader.StoredEvents events) {
        List<Long> versions = new ArrayList<>();
        try (EventReader.StoredEvents e = events) {
            return e.reduce(versions, (list, event) -> {
                list.add(event.getAggregateVersion());
                return list;
            });
        }
    }
}
