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
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class of event sourced aggregates.
 *
 * <p>Aggregate changes its state only by emitting events. Every emitted event is applied to the state, assigned next
 * version of the aggregate and buffered until {@link #commit(EventWriter)}. Idempotency id of every buffered event
 * is remembered, so that an event submitted twice is detected before it is applied twice.
 *
 * <p>All mutations happen under a single reentrant lock per aggregate. Subclasses that need to check state before
 * emitting do so within {@link #locked(Supplier)}, which makes the check and the emit atomic.
 *
 * @param <I> identity type
 * @param <S> state type
 */
public abstract class AggregateRoot<I extends AggregateIdentity, S extends AggregateState<S>> {
    static final UUID EVENT_ID_NAMESPACE = UUID.fromString("8a563c72-5604-4ca2-9d5f-bb6eb7f960c7");

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final I identity;
    private final String typeName;
    private final S state;
    private final EventDispatcher<S> dispatcher;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private long version;
    private List<UncommittedEvent> pendingEvents = new ArrayList<>();
    private Set<IdempotencyId> pendingIdempotencyIds = new LinkedHashSet<>();

    protected AggregateRoot(AggregateContext<I, S> context) {
        this.identity = Objects.requireNonNull(context.getIdentity(), "Identity cannot be null");
        this.typeName = context.getTypeName();
        this.state = Objects.requireNonNull(context.getState(), "State cannot be null");
        this.dispatcher = context.getDispatcher();
        this.clock = context.getClock();
        this.version = context.getVersion();
    }

    public I getIdentity() {
        return identity;
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * Version of the aggregate, including pending events.
     * @return number of events applied to the state
     */
    public long getVersion() {
        lock.lock();
        try {
            return version;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Version of the aggregate as last known to be stored.
     * @return version excluding pending events
     */
    public long getCommittedVersion() {
        lock.lock();
        try {
            return version - pendingEvents.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isNew() {
        return getCommittedVersion() == 0;
    }

    public boolean hasPendingChanges() {
        lock.lock();
        try {
            return !pendingEvents.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public List<UncommittedEvent> getPendingEvents() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(pendingEvents));
        } finally {
            lock.unlock();
        }
    }

    /**
     * State of the aggregate. Only read it within {@link #locked(Supplier)} when other threads may emit.
     * @return the state
     */
    protected final S state() {
        return state;
    }

    protected final <R> R locked(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    <R> R readState(Function<? super S, R> reader) {
        lock.lock();
        try {
            return reader.apply(state);
        } finally {
            lock.unlock();
        }
    }

    protected final EmitResult emit(AggregateEvent<S> event) {
        return emit(event, null, true);
    }

    protected final EmitResult emit(AggregateEvent<S> event, EventMetadata metadata) {
        return emit(event, metadata, true);
    }

    /**
     * Apply event to the state and buffer it.
     *
     * @param event event to emit
     * @param metadata caller supplied ids, may be null
     * @param failOnDuplicate whether a pending event with same idempotency id raises exception, or is silently
     *        ignored
     * @return {@link EmitResult#DUPLICATE} if ignored as duplicate, {@link EmitResult#APPLIED} otherwise
     * @throws DuplicateAggregateEventException when duplicate is detected and failOnDuplicate is set
     */
    protected final EmitResult emit(AggregateEvent<S> event, EventMetadata metadata, boolean failOnDuplicate) {
        Objects.requireNonNull(event, "Event cannot be null");
        lock.lock();
        try {
            IdempotencyId requested = metadata == null ? null : metadata.getIdempotencyId().orElse(null);
            if (requested != null && pendingIdempotencyIds.contains(requested)) {
                if (failOnDuplicate) {
                    throw new DuplicateAggregateEventException(typeName, identity, requested);
                }
                logger.debug("{} {} ignores duplicate event {}", typeName, identity, requested);
                return EmitResult.DUPLICATE;
            }
            long nextVersion = version + 1;
            AggregateEventMetadata eventMetadata = AggregateEventMetadata.builder()
                    .idempotencyId(requested != null ? requested : IdempotencyId.random())
                    .correlationId(metadata != null && metadata.getCorrelationId().isPresent()
                            ? metadata.getCorrelationId().get()
                            : CorrelationId.random())
                    .eventId(eventId(identity, nextVersion))
                    .eventTypeName(event.typeName())
                    .eventTypeVersion(event.typeVersion())
                    .aggregateId(identity)
                    .aggregateTypeName(typeName)
                    .aggregateVersion(nextVersion)
                    .timestamp(clock.instant())
                    .build();
            dispatcher.apply(state, event);
            pendingIdempotencyIds.add(eventMetadata.getIdempotencyId());
            pendingEvents.add(new UncommittedEvent(event, eventMetadata));
            version = nextVersion;
            return EmitResult.APPLIED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Id of the event an aggregate emits at a version. Same identity and version always give same id.
     * @param identity identity of the aggregate
     * @param version version the event brings the aggregate to
     * @return name based event id
     */
    public static EventId eventId(AggregateIdentity identity, long version) {
        return EventId.of(Uuids.nameBased(EVENT_ID_NAMESPACE, identity + "-V" + version));
    }

    public final void commit(EventWriter writer) throws AggregatePersistenceException {
        commit(writer, Cancellation.NONE);
    }

    /**
     * Write pending events. Events emitted while the write is in progress stay pending. When the write fails,
     * the events are put back in front of those emitted in the meantime.
     *
     * @param writer store to write into
     * @param cancellation cancellation signal passed to the store
     * @throws AggregatePersistenceException when the store rejected the events
     */
    public final void commit(EventWriter writer, Cancellation cancellation) throws AggregatePersistenceException {
        List<UncommittedEvent> batch = drainPending();
        if (batch.isEmpty()) {
            return;
        }
        try {
            writer.write(batch, cancellation);
        } catch (EventStoreException | RuntimeException e) {
            restorePending(batch);
            logger.warn("Commit of {} {} with {} events failed: {}", typeName, identity, batch.size(),
                e.getMessage());
            throw new AggregatePersistenceException(typeName, identity, e);
        }
    }

    /**
     * Commit reporting outcome as a result rather than exception.
     * @param writer store to write into
     * @return result of the commit
     */
    public final CommitResult tryCommit(EventWriter writer) {
        try {
            commit(writer, Cancellation.NONE);
            return CommitResult.OK;
        } catch (AggregatePersistenceException e) {
            return CommitResult.of(e.getFault());
        }
    }

    List<UncommittedEvent> drainPending() {
        lock.lock();
        try {
            List<UncommittedEvent> batch = pendingEvents;
            pendingEvents = new ArrayList<>();
            pendingIdempotencyIds = new LinkedHashSet<>();
            return batch;
        } finally {
            lock.unlock();
        }
    }

    void restorePending(List<UncommittedEvent> batch) {
        lock.lock();
        try {
            List<UncommittedEvent> restored = new ArrayList<>(batch.size() + pendingEvents.size());
            restored.addAll(batch);
            restored.addAll(pendingEvents);
            Set<IdempotencyId> restoredIds = new LinkedHashSet<>();
            for (UncommittedEvent event : restored) {
                restoredIds.add(event.getMetadata().getIdempotencyId());
            }
            pendingEvents = restored;
            pendingIdempotencyIds = restoredIds;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return typeName + "{" + identity + " v" + getVersion() + "}";
    }
}
