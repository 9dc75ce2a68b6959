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

import io.github.goodees.esa.core.AggregateIdentity;
import io.github.goodees.esa.core.CommittedEvent;
import io.github.goodees.esa.core.UncommittedEvent;
import io.github.goodees.esa.core.store.AggregateBatch;
import io.github.goodees.esa.core.store.Cancellation;
import io.github.goodees.esa.core.store.EventReader;
import io.github.goodees.esa.core.store.EventSequences;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping events in memory.
 *
 * <p>In transactional mode (the default) a write either appends all of its events or none. Non transactional mode
 * behaves like a store without transaction support: sequences of all aggregates are validated first, then every
 * aggregate is checked and appended on its own, so a write spanning aggregates may be applied partially.
 */
public class InMemoryEventStore implements EventWriter, EventReader {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<AggregateIdentity, List<CommittedEvent>> storage = new HashMap<>();
    private final boolean transactional;

    public InMemoryEventStore() {
        this(true);
    }

    public InMemoryEventStore(boolean transactional) {
        this.transactional = transactional;
    }

    private long lastVersionOf(AggregateIdentity aggregateId) {
        List<CommittedEvent> log = storage.getOrDefault(aggregateId, Collections.emptyList());
        return log.isEmpty() ? 0 : log.get(log.size() - 1).getAggregateVersion();
    }

    @Override
    public void write(List<UncommittedEvent> events, Cancellation cancellation) throws EventStoreException {
        List<AggregateBatch> batches = EventSequences.groupByAggregate(events);
        if (batches.isEmpty()) {
            return;
        }
        synchronized (storage) {
            if (cancellation.isCancellationRequested()) {
                throw EventStoreException.cancelled();
            }
            if (transactional) {
                for (AggregateBatch batch : batches) {
                    checkVersion(batch);
                }
                batches.forEach(this::append);
            } else {
                if (batches.size() > 1) {
                    logger.warn("Store does not support transactions, write of {} aggregates is not atomic",
                        batches.size());
                }
                for (AggregateBatch batch : batches) {
                    checkVersion(batch);
                    append(batch);
                }
            }
        }
    }

    private void checkVersion(AggregateBatch batch) throws EventStoreException {
        long lastVersion = lastVersionOf(batch.getAggregateId());
        if (lastVersion != batch.getExpectedVersion()) {
            logger.debug("Rejecting versions {}-{} of {}, stored version is {}", batch.getStartVersion(),
                batch.getEndVersion(), batch.getAggregateId(), lastVersion);
            throw EventStoreException.outOfSync(batch.getAggregateId(), lastVersion, batch.getStartVersion(),
                batch.getEndVersion());
        }
    }

    private void append(AggregateBatch batch) {
        List<CommittedEvent> log = storage.computeIfAbsent(batch.getAggregateId(), id -> new ArrayList<>());
        for (UncommittedEvent event : batch.getEvents()) {
            log.add(CommittedEvent.of(event));
        }
    }

    @Override
    public StoredEvents read(AggregateIdentity aggregateId, long versionStart, long versionEnd,
            Cancellation cancellation) {
        return new StoredEvents() {
            final List<CommittedEvent> filteredEvents;
            boolean stop = false;

            {
                synchronized (storage) {
                    filteredEvents = storage.getOrDefault(aggregateId, Collections.emptyList()).stream()
                            .filter(e -> e.getAggregateVersion() >= versionStart)
                            .filter(e -> versionEnd == 0 || e.getAggregateVersion() <= versionEnd)
                            .collect(toList());
                }
            }

            @Override
            public void foreach(Consumer<? super CommittedEvent> consumer) {
                for (CommittedEvent event : filteredEvents) {
                    if (stop || cancellation.isCancellationRequested()) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super CommittedEvent, R> reducer) {
                R result = initial;
                for (CommittedEvent event : filteredEvents) {
                    if (stop || cancellation.isCancellationRequested()) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }

    /**
     * Highest stored version of an aggregate.
     * @param aggregateId identity of the aggregate
     * @return stored version, 0 if the aggregate has no events
     */
    public long storedVersion(AggregateIdentity aggregateId) {
        synchronized (storage) {
            return lastVersionOf(aggregateId);
        }
    }
}
