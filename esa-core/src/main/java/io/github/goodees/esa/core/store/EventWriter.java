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

import io.github.goodees.esa.core.UncommittedEvent;

import java.util.List;

/**
 * Append-only write side of an event store.
 */
public interface EventWriter {
    /**
     * Append events of one or more aggregates.
     *
     * <p>Events are grouped by aggregate and sorted by version. Every group must form a gapless ascending sequence
     * of versions not lower than 1, otherwise the write fails with {@link EventStoreException.Fault#INVALID_SEQUENCE}.
     * First version of every group must directly follow the highest stored version of that aggregate, otherwise the
     * write fails with {@link EventStoreException.Fault#OUT_OF_SYNC}. All groups are validated before anything is
     * appended.
     *
     * @param events events to append, in any order
     * @param cancellation signal checked before appending
     * @throws EventStoreException when nothing was appended
     */
    void write(List<UncommittedEvent> events, Cancellation cancellation) throws EventStoreException;

    default void write(List<UncommittedEvent> events) throws EventStoreException {
        write(events, Cancellation.NONE);
    }
}
