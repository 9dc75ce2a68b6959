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
import io.github.goodees.esa.core.UncommittedEvent;

import java.util.Collections;
import java.util.List;

/**
 * Validated, version-ordered events of a single aggregate within a write.
 */
public final class AggregateBatch {
    private final AggregateIdentity aggregateId;
    private final List<UncommittedEvent> events;

    AggregateBatch(AggregateIdentity aggregateId, List<UncommittedEvent> events) {
        this.aggregateId = aggregateId;
        this.events = Collections.unmodifiableList(events);
    }

    public AggregateIdentity getAggregateId() {
        return aggregateId;
    }

    public List<UncommittedEvent> getEvents() {
        return events;
    }

    public long getStartVersion() {
        return events.get(0).getAggregateVersion();
    }

    public long getEndVersion() {
        return events.get(events.size() - 1).getAggregateVersion();
    }

    /**
     * Version the store must hold for this batch to be appended.
     * @return stored version expected by the batch
     */
    public long getExpectedVersion() {
        return getStartVersion() - 1;
    }
}
