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

import io.github.goodees.esa.core.dispatch.EventHandlers;

/**
 * Reduced view of an aggregate, built by applying events in order.
 *
 * <p>State does not know its identity nor its version, these are held by {@link AggregateRoot}. State is only
 * mutated by the handlers it declares, and these are invoked under the lock of its aggregate.
 *
 * @param <S> the implementing type
 */
public interface AggregateState<S extends AggregateState<S>> {

    /**
     * Register handler for every event type this state reacts to. Called once per state class, result is cached by
     * {@link io.github.goodees.esa.core.dispatch.DispatchCache}, therefore registrations must not depend on instance
     * data.
     * @param handlers registry to declare handlers into
     */
    void declareHandlers(EventHandlers<S> handlers);
}
