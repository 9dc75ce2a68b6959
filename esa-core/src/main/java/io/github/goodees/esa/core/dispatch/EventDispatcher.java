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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Immutable routing table from event class to the handler a state declared for it.
 *
 * <p>Events without a handler are ignored. This lets old events that no longer affect state stay in the log, and
 * lets a state observe only part of the events of its aggregate.
 *
 * @param <S> state type
 */
public final class EventDispatcher<S extends AggregateState<S>> {
    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final Class<?> stateType;
    private final Map<Class<?>, BiConsumer<S, AggregateEvent<S>>> handlers;

    EventDispatcher(Class<?> stateType, Map<Class<?>, BiConsumer<S, AggregateEvent<S>>> handlers) {
        this.stateType = stateType;
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    /**
     * Invoke the handler for runtime class of the event.
     * @param state state to mutate
     * @param event event to apply
     * @return true if a handler was invoked, false if the event was ignored
     */
    public boolean apply(S state, AggregateEvent<S> event) {
        BiConsumer<S, AggregateEvent<S>> handler = handlers.get(event.getClass());
        if (handler == null) {
            logger.trace("State {} has no handler for {}", stateType.getSimpleName(), event.getClass().getName());
            return false;
        }
        handler.accept(state, event);
        return true;
    }

    public boolean canHandle(Class<?> eventType) {
        return handlers.containsKey(eventType);
    }

    public Set<Class<?>> handledTypes() {
        return handlers.keySet();
    }

    public Class<?> getStateType() {
        return stateType;
    }
}
