package io.github.goodees.esa.core;

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

import io.github.goodees.esa.core.dispatch.DispatchCache;
import io.github.goodees.esa.core.store.AggregateSnapshot;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventWriter;
import io.github.goodees.esa.core.store.SnapshotStore;
import io.github.goodees.esa.example.banking.AccountAggregate;
import io.github.goodees.esa.example.banking.AccountId;
import io.github.goodees.esa.example.banking.AccountSnapshotV2;
import io.github.goodees.esa.example.banking.AccountState;
import io.github.goodees.esa.example.banking.Banking;
import io.github.goodees.esa.store.inmemory.InMemoryEventStore;
import io.github.goodees.esa.store.inmemory.InMemorySnapshotStore;
import org.junit.Before;
import org.junit.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateRepositoryTest {
    private AggregateDefinition<AccountId, AccountState, AccountAggregate> accounts;
    private InMemoryEventStore store;
    private InMemorySnapshotStore snapshots;
    private AccountId id;

    @Before
    public void setUp() {
        accounts = Banking.accounts(new DispatchCache());
        store = new InMemoryEventStore();
        snapshots = new InMemorySnapshotStore();
        id = AccountId.random();
    }

    @Test
    public void saved_aggregate_can_be_loaded() throws AggregatePersistenceException {
        AggregateRepository<AccountId, AccountState, AccountAggregate> repository =
                new AggregateRepository<>(accounts, store, store);
        AccountAggregate account = repository.create(id);
        account.open("Alice");
        account.deposit(25);
        repository.save(account);

        AccountAggregate loaded = repository.load(id).get();
        assertEquals(25, loaded.getBalance());
        assertEquals(1, repository.load(id, 1).get().getVersion());
    }

    @Test
    public void snapshot_is_stored_when_policy_says_so() throws AggregatePersistenceException {
        AggregateRepository<AccountId, AccountState, AccountAggregate> repository =
                new AggregateRepository<>(accounts, store, store, snapshots, SnapshotPolicy.everyNEvents(3));
        AccountAggregate account = repository.create(id);
        account.open("Alice");
        account.deposit(25);
        repository.save(account);
        assertFalse(snapshots.read(id, 0).isPresent());

        account.deposit(5);
        account.deposit(5);
        repository.save(account);

        AggregateSnapshot snapshot = snapshots.read(id, 0).get();
        assertEquals(4, snapshot.getAggregateVersion());
        assertEquals("ACCOUNT", snapshot.getAggregateTypeName());
        assertEquals(Banking.NOW, snapshot.getTimestamp());
        assertThat(snapshot.getPayload(), instanceOf(AccountSnapshotV2.class));
        assertEquals(35, ((AccountSnapshotV2) snapshot.getPayload()).getBalance());
        assertEquals(35, repository.load(id).get().getBalance());
    }

    @Test
    public void failing_snapshot_store_does_not_fail_save() throws AggregatePersistenceException {
        SnapshotStore failing = new SnapshotStore() {
            @Override
            public Optional<AggregateSnapshot> read(AggregateIdentity aggregateId, long maxVersion) {
                return Optional.empty();
            }

            @Override
            public void write(AggregateSnapshot snapshot) {
                throw new IllegalStateException("snapshot storage offline");
            }
        };
        AggregateRepository<AccountId, AccountState, AccountAggregate> repository =
                new AggregateRepository<>(accounts, store, store, failing, SnapshotPolicy.everyNEvents(1));
        AccountAggregate account = repository.create(id);
        account.open("Alice");
        repository.save(account);

        assertEquals(1, store.storedVersion(id));
    }

    @Test
    public void update_retries_after_concurrent_modification() throws AggregatePersistenceException {
        AtomicInteger writes = new AtomicInteger();
        EventWriter interfering = (events, cancellation) -> {
            if (writes.incrementAndGet() == 1) {
                AccountAggregate concurrent = new AggregateReader<>(accounts, store).read(id).get();
                concurrent.deposit(1000);
                try {
                    concurrent.commit(store);
                } catch (AggregatePersistenceException e) {
                    throw new IllegalStateException(e);
                }
            }
            store.write(events, cancellation);
        };
        AggregateRepository<AccountId, AccountState, AccountAggregate> repository =
                new AggregateRepository<>(accounts, store, interfering);
        AccountAggregate opened = repository.create(id);
        opened.open("Alice");
        opened.commit(store);

        AccountAggregate updated = repository.update(id, a -> a.deposit(1), 3);

        assertEquals(2, writes.get());
        assertEquals(1001, updated.getBalance());
        assertEquals(3, store.storedVersion(id));
    }

    @Test
    public void update_gives_up_after_max_attempts() {
        AtomicInteger attempts = new AtomicInteger();
        EventWriter alwaysStale = (events, cancellation) -> {
            attempts.incrementAndGet();
            throw EventStoreException.outOfSync(id, 5, 1, 1);
        };
        AggregateRepository<AccountId, AccountState, AccountAggregate> repository =
                new AggregateRepository<>(accounts, store, alwaysStale);
        try {
            repository.update(id, a -> a.open("Alice"), 3);
            fail("should have failed");
        } catch (AggregatePersistenceException e) {
            assertEquals(EventStoreException.Fault.OUT_OF_SYNC, e.getFault());
        }
        assertEquals(3, attempts.get());
    }

    @Test
    public void update_does_not_retry_other_failures() {
        AtomicInteger attempts = new AtomicInteger();
        EventWriter broken = (events, cancellation) -> {
            attempts.incrementAndGet();
            throw EventStoreException.storeFailed(id.toString(), new IllegalStateException("offline"));
        };
        AggregateRepository<AccountId, AccountState, AccountAggregate> repository =
                new AggregateRepository<>(accounts, store, broken);
        try {
            repository.update(id, a -> a.open("Alice"), 3);
            fail("should have failed");
        } catch (AggregatePersistenceException e) {
            assertEquals(EventStoreException.Fault.TX_ERROR, e.getFault());
        }
        assertEquals(1, attempts.get());
    }

    @Test
    public void snapshot_policy_counts_crossed_intervals() {
        SnapshotPolicy every10 = SnapshotPolicy.everyNEvents(10);
        assertFalse(every10.shouldSnapshot(0, 9));
        assertTrue(every10.shouldSnapshot(9, 10));
        assertTrue(every10.shouldSnapshot(8, 23));
        assertFalse(every10.shouldSnapshot(10, 19));
        assertFalse(SnapshotPolicy.NEVER.shouldSnapshot(0, 100));
    }
}
