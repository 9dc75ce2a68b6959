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
import io.github.goodees.esa.core.dispatch.EventDispatcher;
import io.github.goodees.esa.core.types.TypeDefinitions;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * How to construct an aggregate type: its state, its instances, its dispatcher and its clock.
 *
 * @param <I> identity type
 * @param <S> state type
 * @param <A> aggregate type
 */
public final class AggregateDefinition<I extends AggregateIdentity, S extends AggregateState<S>,
        A extends AggregateRoot<I, S>> {
    private final String typeName;
    private final Supplier<S> stateFactory;
    private final AggregateFactory<I, S, A> aggregateFactory;
    private final DispatchCache dispatchCache;
    private final Clock clock;

    public AggregateDefinition(Class<A> aggregateType, Supplier<S> stateFactory,
            AggregateFactory<I, S, A> aggregateFactory, DispatchCache dispatchCache) {
        this(aggregateType, stateFactory, aggregateFactory, dispatchCache, Clock.systemUTC());
    }

    public AggregateDefinition(Class<A> aggregateType, Supplier<S> stateFactory,
            AggregateFactory<I, S, A> aggregateFactory, DispatchCache dispatchCache, Clock clock) {
        this.typeName = TypeDefinitions.nameOf(aggregateType);
        this.stateFactory = Objects.requireNonNull(stateFactory);
        this.aggregateFactory = Objects.requireNonNull(aggregateFactory);
        this.dispatchCache = Objects.requireNonNull(dispatchCache);
        this.clock = Objects.requireNonNull(clock);
    }

    public String getTypeName() {
        return typeName;
    }

    public Clock getClock() {
        return clock;
    }

    public S createState() {
        S state;
        try {
            state = stateFactory.get();
        } catch (RuntimeException e) {
            throw new AggregateStateCreationException(typeName, e);
        }
        if (state == null) {
            throw new AggregateStateCreationException(typeName,
                new NullPointerException("State factory returned null"));
        }
        return state;
    }

    public EventDispatcher<S> dispatcherFor(S state) {
        return dispatchCache.dispatcherFor(state);
    }

    /**
     * New aggregate with fresh state at version 0.
     * @param identity identity of the aggregate
     * @return new aggregate
     */
    public A create(I identity) {
        return create(identity, 0, createState());
    }

    public A create(I identity, long version, S state) {
        AggregateContext<I, S> context = new AggregateContext<>(identity, typeName, version, state,
            dispatchCache.dispatcherFor(state), clock);
        try {
            return aggregateFactory.create(context);
        } catch (RuntimeException e) {
            throw new AggregateCreationException(typeName, e);
        }
    }
}
