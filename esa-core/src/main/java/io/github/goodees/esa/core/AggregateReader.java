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

import io.github.goodees.esa.core.dispatch.EventDispatcher;
import io.github.goodees.esa.core.store.Cancellation;
import io.github.goodees.esa.core.store.EventReader;
import io.github.goodees.esa.core.types.Upgrades;

import java.util.Objects;
import java.util.Optional;

/**
 * Reconstructs aggregates by replaying their events.
 *
 * <p>Every stored event is upgraded to most recent version of its type and applied to fresh state. The aggregate
 * is created at version of the last stored event. Events the state has no handler for, and events the store could
 * not read, are skipped, their version still counts.
 *
 * @param <I> identity type
 * @param <S> state type
 * @param <A> aggregate type
 */
public class AggregateReader<I extends AggregateIdentity, S extends AggregateState<S>,
        A extends AggregateRoot<I, S>> {
    protected final AggregateDefinition<I, S, A> definition;
    protected final EventReader eventReader;

    public AggregateReader(AggregateDefinition<I, S, A> definition, EventReader eventReader) {
        this.definition = Objects.requireNonNull(definition);
        this.eventReader = Objects.requireNonNull(eventReader);
    }

    public AggregateDefinition<I, S, A> getDefinition() {
        return definition;
    }

    public Optional<A> read(I identity) {
        return read(identity, 0, Cancellation.NONE);
    }

    public Optional<A> read(I identity, long versionEnd) {
        return read(identity, versionEnd, Cancellation.NONE);
    }

    /**
     * Reconstruct aggregate at a version.
     * @param identity identity of the aggregate
     * @param versionEnd last version to apply, 0 for all events
     * @param cancellation cancellation signal, checked between events
     * @return the aggregate, or empty when it has no events
     * @throws EventUpgradeException when an event could not be upgraded or applied
     * @throws java.util.concurrent.CancellationException when cancelled
     */
    public Optional<A> read(I identity, long versionEnd, Cancellation cancellation) {
        S state = definition.createState();
        long version = replay(identity, state, 0, versionEnd, cancellation);
        if (version == 0) {
            return Optional.empty();
        }
        return Optional.of(definition.create(identity, version, state));
    }

    /**
     * Apply stored events following a version.
     * @return version of last applied event, or {@code afterVersion} when there were none
     */
    protected long replay(I identity, S state, long afterVersion, long versionEnd, Cancellation cancellation) {
        EventDispatcher<S> dispatcher = definition.dispatcherFor(state);
        long version;
        try (EventReader.StoredEvents events = eventReader.read(identity, afterVersion + 1, versionEnd,
            cancellation)) {
            version = events.reduce(afterVersion, (last, committed) -> {
                if (committed.isReadable()) {
                    apply(dispatcher, state, committed);
                }
                return committed.getAggregateVersion();
            });
        }
        cancellation.throwIfCancellationRequested();
        return version;
    }

    @SuppressWarnings("unchecked")
    private void apply(EventDispatcher<S> dispatcher, S state, CommittedEvent committed) {
        try {
            AggregateEvent<S> event = (AggregateEvent<S>) committed.getEvent();
            dispatcher.apply(state, Upgrades.upgradeRecursive(event));
        } catch (RuntimeException e) {
            throw new EventUpgradeException(committed.getMetadata().getEventTypeName(), e);
        }
    }
}
