package io.github.goodees.esa.core.dispatch;

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

import io.github.goodees.esa.core.AggregateEvent;
import io.github.goodees.esa.core.AggregateState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Registry of event handlers a state declares. Typesafe and reflection free, every handler is bound to exactly one
 * event class.
 *
 * <pre>
 * public void declareHandlers(EventHandlers&lt;AccountState&gt; handlers) {
 *     handlers.on(AccountOpened.class, AccountState::opened)
 *             .on(AccountAmountDeposited.class, AccountState::deposited);
 * }
 * </pre>
 *
 * @param <S> state type
 */
public final class EventHandlers<S extends AggregateState<S>> {
    private final Class<?> stateType;
    private final Map<Class<?>, BiConsumer<S, AggregateEvent<S>>> handlers = new LinkedHashMap<>();

    EventHandlers(Class<?> stateType) {
        this.stateType = stateType;
    }

    /**
     * Register handler for an event class. Only instances of exactly this class are routed to the handler.
     * @param eventType event class
     * @param handler handler receiving the state and the event
     * @param <E> event type
     * @return this
     * @throws IllegalStateException when the event class already has a handler
     */
    public <E extends AggregateEvent<S>> EventHandlers<S> on(Class<E> eventType,
            BiConsumer<? super S, ? super E> handler) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        if (handlers.containsKey(eventType)) {
            throw new IllegalStateException("State " + stateType.getName() + " declares more than one handler for "
                    + eventType.getName());
        }
        handlers.put(eventType, (state, event) -> handler.accept(state, eventType.cast(event)));
        return this;
    }

    EventDispatcher<S> build() {
        return new EventDispatcher<>(stateType, handlers);
    }
}
