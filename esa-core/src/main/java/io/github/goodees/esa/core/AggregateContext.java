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

import java.time.Clock;

/**
 * Everything an {@link AggregateRoot} is constructed with. Created by {@link AggregateDefinition}.
 *
 * @param <I> identity type
 * @param <S> state type
 */
public final class AggregateContext<I extends AggregateIdentity, S extends AggregateState<S>> {
    private final I identity;
    private final String typeName;
    private final long version;
    private final S state;
    private final EventDispatcher<S> dispatcher;
    private final Clock clock;

    AggregateContext(I identity, String typeName, long version, S state, EventDispatcher<S> dispatcher,
            Clock clock) {
        this.identity = identity;
        this.typeName = typeName;
        this.version = version;
        this.state = state;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public I getIdentity() {
        return identity;
    }

    public String getTypeName() {
        return typeName;
    }

    public long getVersion() {
        return version;
    }

    public S getState() {
        return state;
    }

    public EventDispatcher<S> getDispatcher() {
        return dispatcher;
    }

    public Clock getClock() {
        return clock;
    }
}
