package io.github.goodees.esa.core.store;

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

import io.github.goodees.esa.core.AggregateIdentity;
import io.github.goodees.esa.core.CommittedEvent;

import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Reads persisted logs.
 */
public interface EventReader {
    /**
     * Read events of an aggregate in ascending version order.
     * @param aggregateId identity of the aggregate
     * @param versionStart lowest version to read, 0 for no lower bound
     * @param versionEnd highest version to read, 0 for no upper bound
     * @param cancellation signal checked while iterating
     * @return accessor for the events in order they appeared in history
     */
    StoredEvents read(AggregateIdentity aggregateId, long versionStart, long versionEnd, Cancellation cancellation);

    default StoredEvents read(AggregateIdentity aggregateId, long versionStart, long versionEnd) {
        return read(aggregateId, versionStart, versionEnd, Cancellation.NONE);
    }

    default StoredEvents read(AggregateIdentity aggregateId) {
        return read(aggregateId, 0, 0, Cancellation.NONE);
    }

    /**
     * Accessor that enables single iteration over found events.
     * The events need not be materialized at once, it could for example wrap a JDBC ResultSet. Only one of methods
     * foreach and reduce may be called on single instance, and only once. Iteration ends early when cancellation is
     * requested.
     */
    interface StoredEvents extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super CommittedEvent> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super CommittedEvent, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
