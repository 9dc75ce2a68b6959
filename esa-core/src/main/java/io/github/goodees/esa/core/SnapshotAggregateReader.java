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
import io.github.goodees.esa.core.store.Cancellation;
import io.github.goodees.esa.core.store.EventReader;
import io.github.goodees.esa.core.store.SnapshotReader;
import io.github.goodees.esa.core.types.Upgrades;
import io.github.goodees.esa.core.types.Versioned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate reader starting from most recent snapshot at or below requested version, replaying only the events
 * after it. States that are not {@link SnapshotCapable} are always fully replayed.
 */
public class SnapshotAggregateReader<I extends AggregateIdentity, S extends AggregateState<S>,
        A extends AggregateRoot<I, S>> extends AggregateReader<I, S, A> {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotAggregateReader.class);

    private final SnapshotReader snapshotReader;

    public SnapshotAggregateReader(AggregateDefinition<I, S, A> definition, EventReader eventReader,
            SnapshotReader snapshotReader) {
        super(definition, eventReader);
        this.snapshotReader = Objects.requireNonNull(snapshotReader);
    }

    @Override
    public Optional<A> read(I identity, long versionEnd, Cancellation cancellation) {
        S state = definition.createState();
        if (!(state instanceof SnapshotCapable)) {
            return super.read(identity, versionEnd, cancellation);
        }
        Optional<AggregateSnapshot> snapshot = snapshotReader.read(identity, versionEnd);
        if (!snapshot.isPresent()) {
            return super.read(identity, versionEnd, cancellation);
        }
        long snapshotVersion = snapshot.get().getAggregateVersion();
        logger.debug("Restoring {} from snapshot at version {}", identity, snapshotVersion);
        consume((SnapshotCapable<?>) state, Upgrades.upgradeAny(snapshot.get().getPayload()));
        long version = replay(identity, state, snapshotVersion, versionEnd, cancellation);
        return Optional.of(definition.create(identity, version, state));
    }

    private void consume(SnapshotCapable<?> state, Versioned<?> payload) {
        try {
            restore(state, payload);
        } catch (RuntimeException e) {
            throw new AggregateStateCreationException(definition.getTypeName(), e);
        }
    }

    // payload of another family fails with ClassCastException in consumeSnapshot
    @SuppressWarnings("unchecked")
    private static <P extends Versioned<P>> void restore(SnapshotCapable<P> state, Versioned<?> payload) {
        state.consumeSnapshot((P) payload);
    }
}
