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
 * Commit of a session failed. Pending events of all tracked aggregates were restored.
 */
public class SessionPersistenceException extends Exception {
    public SessionPersistenceException(int aggregateCount, Throwable cause) {
        super("Failed to persist session of " + aggregateCount + " aggregates. " + cause.getMessage(), cause);
    }

    public EventStoreException.Fault getFault() {
        return getCause() instanceof EventStoreException
                ? ((EventStoreException) getCause()).getFault()
                : EventStoreException.Fault.TX_ERROR;
    }
}
