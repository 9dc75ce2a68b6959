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

import io.github.goodees.esa.core.store.AggregateSnapshot;
import io.github.goodees.esa.core.store.EventReader;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventWriter;
import io.github.goodees.esa.core.store.SnapshotStore;
import io.github.goodees.esa.core.store.SnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Loads and saves aggregates of one type.
 *
 * @param <I> identity type
 * @param <S> state type
 * @param <A> aggregate type
 */
public class AggregateRepository<I extends AggregateIdentity, S extends AggregateState<S>,
        A extends AggregateRoot<I, S>> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateRepository.class);

    private final AggregateDefinition<I, S, A> definition;
    private final AggregateReader<I, S, A> reader;
    private final EventWriter writer;
    private final SnapshotWriter snapshotWriter;
    private final SnapshotPolicy snapshotPolicy;

    public AggregateRepository(AggregateDefinition<I, S, A> definition, EventReader eventReader,
            EventWriter eventWriter) {
        this.definition = Objects.requireNonNull(definition);
        this.reader = new AggregateReader<>(definition, eventReader);
        this.writer = Objects.requireNonNull(eventWriter);
        this.snapshotWriter = null;
        this.snapshotPolicy = SnapshotPolicy.NEVER;
    }

    public AggregateRepository(AggregateDefinition<I, S, A> definition, EventReader eventReader,
            EventWriter eventWriter, SnapshotStore snapshotStore, SnapshotPolicy snapshotPolicy) {
        this.definition = Objects.requireNonNull(definition);
        this.reader = new SnapshotAggregateReader<>(definition, eventReader, snapshotStore);
        this.writer = Objects.requireNonNull(eventWriter);
        this.snapshotWriter = snapshotStore;
        this.snapshotPolicy = Objects.requireNonNull(snapshotPolicy);
    }

    public AggregateReader<I, S, A> getReader() {
        return reader;
    }

    public A create(I identity) {
        return definition.create(identity);
    }

    public Optional<A> load(I identity) {
        return reader.read(identity);
    }

    public Optional<A> load(I identity, long version) {
        return reader.read(identity, version);
    }

    public A loadOrCreate(I identity) {
        return reader.read(identity).orElseGet(() -> definition.create(identity));
    }

    /**
     * Commit pending events of the aggregate and snapshot it when the policy says so.
     * @param aggregate aggregate to save
     * @throws AggregatePersistenceException when commit failed
     */
    public void save(A aggregate) throws AggregatePersistenceException {
        long previousVersion = aggregate.getCommittedVersion();
        aggregate.commit(writer);
        long currentVersion = aggregate.getCommittedVersion();
        if (snapshotWriter != null && snapshotPolicy.shouldSnapshot(previousVersion, currentVersion)) {
            snapshot(aggregate);
        }
    }

    /**
     * Load (or create) aggregate, perform action and save it, repeating the whole cycle when the store holds newer
     * events than the loaded aggregate.
     * @param identity identity of the aggregate
     * @param action action emitting events
     * @param maxAttempts maximum number of attempts
     * @return the saved aggregate
     * @throws AggregatePersistenceException when save failed for other reason than concurrent modification, or
     *         when all attempts failed
     */
    public A update(I identity, Consumer<? super A> action, int maxAttempts) throws AggregatePersistenceException {
        for (int attempt = 1;; attempt++) {
            A aggregate = loadOrCreate(identity);
            action.accept(aggregate);
            try {
                save(aggregate);
                return aggregate;
            } catch (AggregatePersistenceException e) {
                if (e.getFault() != EventStoreException.Fault.OUT_OF_SYNC || attempt >= maxAttempts) {
                    throw e;
                }
                logger.debug("{} {} was modified concurrently, retrying (attempt {})", definition.getTypeName(),
                    identity, attempt);
            }
        }
    }

    private void snapshot(A aggregate) {
        try {
            AggregateSnapshot snapshot = aggregate.readState(state -> {
                if (!(state instanceof SnapshotCapable) || aggregate.hasPendingChanges()) {
                    return null;
                }
                return new AggregateSnapshot(((SnapshotCapable<?>) state).createSnapshot(), aggregate.getIdentity(),
                    definition.getTypeName(), aggregate.getVersion(), definition.getClock().instant());
            });
            if (snapshot != null) {
                snapshotWriter.write(snapshot);
            }
        } catch (RuntimeException e) {
            logger.error("Failed to snapshot {} {}", definition.getTypeName(), aggregate.getIdentity(), e);
        }
    }
}
