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

import io.github.goodees.esa.core.store.EventStoreException;

/**
 * Commit of an aggregate failed. Pending events of the aggregate were restored and can be committed again.
 */
public class AggregatePersistenceException extends Exception {
    private final String aggregateTypeName;
    private final AggregateIdentity identity;

    public AggregatePersistenceException(String aggregateTypeName, AggregateIdentity identity, Throwable cause) {
        super("Failed to persist aggregate " + aggregateTypeName + " " + identity + ". " + cause.getMessage(), cause);
        this.aggregateTypeName = aggregateTypeName;
        this.identity = identity;
    }

    public String getAggregateTypeName() {
        return aggregateTypeName;
    }

    public AggregateIdentity getIdentity() {
        return identity;
    }

    /**
     * Fault reported by the store, {@link EventStoreException.Fault#TX_ERROR} when store failed unexpectedly.
     * @return the fault
     */
    public EventStoreException.Fault getFault() {
        return getCause() instanceof EventStoreException
                ? ((EventStoreException) getCause()).getFault()
                : EventStoreException.Fault.TX_ERROR;
    }
}
