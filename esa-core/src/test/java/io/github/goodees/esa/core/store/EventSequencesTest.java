package io.github.goodees.esa.core.store;

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

import io.github.goodees.esa.core.UncommittedEvent;
import io.github.goodees.esa.example.banking.AccountAmountDepositedV2;
import io.github.goodees.esa.example.banking.AccountId;
import io.github.goodees.esa.example.banking.AccountOpened;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.goodees.esa.example.banking.Banking.event;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventSequencesTest {
    private final AccountId first = AccountId.random();
    private final AccountId second = AccountId.random();

    @Test
    public void events_are_grouped_and_sorted() throws EventStoreException {
        List<AggregateBatch> batches = EventSequences.groupByAggregate(Arrays.asList(
            event(first, 4, new AccountAmountDepositedV2(1, "EUR")),
            event(second, 1, new AccountOpened("B")),
            event(first, 3, new AccountAmountDepositedV2(2, "EUR"))));

        assertEquals(2, batches.size());
        assertEquals(first, batches.get(0).getAggregateId());
        assertEquals(3, batches.get(0).getStartVersion());
        assertEquals(4, batches.get(0).getEndVersion());
        assertEquals(2, batches.get(0).getExpectedVersion());
        assertEquals(second, batches.get(1).getAggregateId());
    }

    @Test
    public void gap_is_invalid() {
        assertInvalid(event(first, 1, new AccountOpened("A")), event(first, 3, new AccountOpened("A")));
    }

    @Test
    public void repeated_version_is_invalid() {
        assertInvalid(event(first, 2, new AccountOpened("A")), event(first, 2, new AccountOpened("A")));
    }

    @Test
    public void version_zero_is_invalid() {
        assertInvalid(event(first, 0, new AccountOpened("A")), event(first, 1, new AccountOpened("A")));
    }

    @Test
    public void empty_write_has_no_batches() throws EventStoreException {
        assertTrue(EventSequences.groupByAggregate(Collections.emptyList()).isEmpty());
    }

    private void assertInvalid(UncommittedEvent... events) {
        try {
            EventSequences.groupByAggregate(Arrays.asList(events));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.INVALID_SEQUENCE, e.getFault());
        }
    }
}
