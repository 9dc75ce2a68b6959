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

import io.github.goodees.esa.core.store.Cancellation;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unit of work over several aggregates. Pending events of all tracked aggregates are written as one batch, so with
 * a transactional store they are stored all or none.
 *
 * <p>Session operations are mutually exclusive.
 */
public class Session {
    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final EventWriter writer;
    private final Map<AggregateIdentity, AggregateRoot<?, ?>> tracked = new LinkedHashMap<>();

    public Session(EventWriter writer) {
        this.writer = Objects.requireNonNull(writer);
    }

    /**
     * Load aggregate and track it. If the aggregate is already tracked, its pending events are discarded and it is
     * replaced by freshly loaded instance.
     * @param reader reader of the aggregate type
     * @param identity identity of the aggregate
     * @return the loaded aggregate, empty if it has no events
     */
    public <I extends AggregateIdentity, S extends AggregateState<S>, A extends AggregateRoot<I, S>> Optional<A> load(
            AggregateReader<I, S, A> reader, I identity) {
        lock.lock();
        try {
            AggregateRoot<?, ?> previous = tracked.remove(identity);
            if (previous != null) {
                List<UncommittedEvent> discarded = previous.drainPending();
                logger.debug("Reloading {}, discarding {} pending events", identity, discarded.size());
            }
            Optional<A> aggregate = reader.read(identity);
            aggregate.ifPresent(a -> tracked.put(identity, a));
            return aggregate;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Track an aggregate, typically a new one.
     * @param aggregate aggregate to track
     * @return the aggregate
     * @throws IllegalStateException when another instance with same identity is tracked
     */
    public <A extends AggregateRoot<?, ?>> A track(A aggregate) {
        lock.lock();
        try {
            AggregateRoot<?, ?> existing = tracked.putIfAbsent(aggregate.getIdentity(), aggregate);
            if (existing != null && existing != aggregate) {
                throw new IllegalStateException("Session already tracks other instance of " + aggregate.getIdentity());
            }
            return aggregate;
        } finally {
            lock.unlock();
        }
    }

    public List<AggregateRoot<?, ?>> getTrackedAggregates() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(tracked.values()));
        } finally {
            lock.unlock();
        }
    }

    public void commit() throws SessionPersistenceException {
        commit(Cancellation.NONE);
    }

    /**
     * Write pending events of all tracked aggregates in a single batch. On failure every aggregate gets its events
     * back.
     * @param cancellation cancellation signal passed to the store
     * @throws SessionPersistenceException when the store rejected the batch
     */
    public void commit(Cancellation cancellation) throws SessionPersistenceException {
        lock.lock();
        try {
            Map<AggregateRoot<?, ?>, List<UncommittedEvent>> drained = new LinkedHashMap<>();
            List<UncommittedEvent> batch = new ArrayList<>();
            for (AggregateRoot<?, ?> aggregate : tracked.values()) {
                List<UncommittedEvent> pending = aggregate.drainPending();
                if (!pending.isEmpty()) {
                    drained.put(aggregate, pending);
                    batch.addAll(pending);
                }
            }
            if (batch.isEmpty()) {
                return;
            }
            try {
                writer.write(batch, cancellation);
            } catch (EventStoreException | RuntimeException e) {
                drained.forEach(AggregateRoot::restorePending);
                logger.warn("Commit of {} events of {} aggregates failed: {}", batch.size(), drained.size(),
                    e.getMessage());
                throw new SessionPersistenceException(drained.size(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop tracking all aggregates. Their pending events stay with them.
     */
    public void clear() {
        lock.lock();
        try {
            tracked.clear();
        } finally {
            lock.unlock();
        }
    }
}
