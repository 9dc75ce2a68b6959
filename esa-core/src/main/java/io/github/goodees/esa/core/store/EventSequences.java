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

import io.github.goodees.esa.core.AggregateIdentity;
import io.github.goodees.esa.core.UncommittedEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation of written event sequences, shared by store implementations.
 */
public final class EventSequences {
    private EventSequences() {
    }

    /**
     * Group events by aggregate, order them by version and check that every group is a gapless sequence starting
     * at version 1 or higher.
     * @param events events of a write
     * @return batches in order of first appearance of their aggregate
     * @throws EventStoreException with fault {@code INVALID_SEQUENCE} when any group is invalid
     */
    public static List<AggregateBatch> groupByAggregate(List<UncommittedEvent> events) throws EventStoreException {
        Map<AggregateIdentity, List<UncommittedEvent>> grouped = new LinkedHashMap<>();
        for (UncommittedEvent event : events) {
            grouped.computeIfAbsent(event.getAggregateId(), id -> new ArrayList<>()).add(event);
        }
        List<AggregateBatch> batches = new ArrayList<>(grouped.size());
        for (Map.Entry<AggregateIdentity, List<UncommittedEvent>> entry : grouped.entrySet()) {
            List<UncommittedEvent> sequence = entry.getValue();
            sequence.sort(Comparator.comparingLong(UncommittedEvent::getAggregateVersion));
            checkSequence(entry.getKey(), sequence);
            batches.add(new AggregateBatch(entry.getKey(), sequence));
        }
        return batches;
    }

    private static void checkSequence(AggregateIdentity aggregateId, List<UncommittedEvent> sequence)
            throws EventStoreException {
        long first = sequence.get(0).getAggregateVersion();
        if (first < 1) {
            throw EventStoreException.invalidSequence(aggregateId, 1, first);
        }
        long expected = first;
        for (UncommittedEvent event : sequence) {
            if (event.getAggregateVersion() != expected) {
                throw EventStoreException.invalidSequence(aggregateId, expected, event.getAggregateVersion());
            }
            expected++;
        }
    }
}
