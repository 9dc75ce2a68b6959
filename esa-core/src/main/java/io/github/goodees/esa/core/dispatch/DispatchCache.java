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

import io.github.goodees.esa.core.AggregateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Builds an {@link EventDispatcher} once per state class and shares it afterwards. An application creates one cache
 * and passes it to all aggregate definitions.
 */
public final class DispatchCache {
    private static final Logger logger = LoggerFactory.getLogger(DispatchCache.class);

    private final ConcurrentMap<Class<?>, EventDispatcher<?>> dispatchers = new ConcurrentHashMap<>();

    /**
     * Dispatcher for class of the state. On first call for a class, handlers are declared by the given instance.
     * @param state state instance
     * @param <S> state type
     * @return shared dispatcher
     */
    @SuppressWarnings("unchecked")
    public <S extends AggregateState<S>> EventDispatcher<S> dispatcherFor(S state) {
        return (EventDispatcher<S>) dispatchers.computeIfAbsent(state.getClass(), type -> build(type, state));
    }

    private static <S extends AggregateState<S>> EventDispatcher<S> build(Class<?> stateType, S state) {
        EventHandlers<S> handlers = new EventHandlers<>(stateType);
        state.declareHandlers(handlers);
        EventDispatcher<S> dispatcher = handlers.build();
        logger.debug("Built dispatcher of {} for {} event types", stateType.getName(),
            dispatcher.handledTypes().size());
        return dispatcher;
    }

    public int size() {
        return dispatchers.size();
    }
}
