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
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventDispatcherTest {
    static final AtomicInteger declarations = new AtomicInteger();

    static class Incremented implements AggregateEvent<Counter> {
    }

    static class Decremented implements AggregateEvent<Counter> {
    }

    static class Renamed implements AggregateEvent<Counter> {
    }

    static class IncrementedTwice extends Incremented {
    }

    static class Counter implements AggregateState<Counter> {
        int value;

        @Override
        public void declareHandlers(EventHandlers<Counter> handlers) {
            declarations.incrementAndGet();
            handlers.on(Incremented.class, (c, e) -> c.value++)
                    .on(Decremented.class, (c, e) -> c.value--);
        }
    }

    static class Confused implements AggregateState<Confused> {
        @Override
        public void declareHandlers(EventHandlers<Confused> handlers) {
            handlers.on(Handled.class, (c, e) -> { })
                    .on(Handled.class, (c, e) -> { });
        }

        static class Handled implements AggregateEvent<Confused> {
        }
    }

    private DispatchCache cache;

    @Before
    public void setUp() {
        cache = new DispatchCache();
        declarations.set(0);
    }

    @Test
    public void handler_is_invoked_exactly_once() {
        Counter counter = new Counter();
        EventDispatcher<Counter> dispatcher = cache.dispatcherFor(counter);

        assertTrue(dispatcher.apply(counter, new Incremented()));
        assertTrue(dispatcher.apply(counter, new Incremented()));
        assertTrue(dispatcher.apply(counter, new Decremented()));

        assertEquals(1, counter.value);
    }

    @Test
    public void event_without_handler_is_ignored() {
        Counter counter = new Counter();
        EventDispatcher<Counter> dispatcher = cache.dispatcherFor(counter);

        assertFalse(dispatcher.apply(counter, new Renamed()));
        assertEquals(0, counter.value);
        assertFalse(dispatcher.canHandle(Renamed.class));
    }

    @Test
    public void events_are_routed_by_exact_class() {
        Counter counter = new Counter();
        EventDispatcher<Counter> dispatcher = cache.dispatcherFor(counter);

        assertFalse(dispatcher.apply(counter, new IncrementedTwice()));
        assertEquals(0, counter.value);
    }

    @Test
    public void dispatcher_is_built_once_per_state_class() {
        EventDispatcher<Counter> first = cache.dispatcherFor(new Counter());
        EventDispatcher<Counter> second = cache.dispatcherFor(new Counter());

        assertSame(first, second);
        assertEquals(1, declarations.get());
        assertEquals(1, cache.size());
        assertTrue(first.canHandle(Incremented.class));
        assertEquals(2, first.handledTypes().size());
    }

    @Test
    public void second_handler_for_same_event_is_rejected() {
        try {
            cache.dispatcherFor(new Confused());
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertEquals(0, cache.size());
        }
    }
}
