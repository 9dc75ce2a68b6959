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

/**
 * Exception generated when storing of events fails. No event of the failed write was stored.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /** Store already holds events the write did not account for. */
        OUT_OF_SYNC,
        /** Events of an aggregate do not form a gapless sequence starting at 1 or more. */
        INVALID_SEQUENCE,
        TX_ERROR,
        PROGRAMMATIC_ERROR,
        CANCELLED
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException outOfSync(AggregateIdentity aggregateId, long knownVersion, long startVersion,
            long endVersion) {
        return new EventStoreException(Fault.OUT_OF_SYNC, "Aggregate " + aggregateId + " storing versions "
                + startVersion + " to " + endVersion + " attempted while last known version is " + knownVersion, null);
    }

    public static EventStoreException outOfSync(AggregateIdentity aggregateId, long startVersion, long endVersion,
            Throwable cause) {
        return new EventStoreException(Fault.OUT_OF_SYNC, "Aggregate " + aggregateId + " versions " + startVersion
                + " to " + endVersion + " were stored concurrently", cause);
    }

    public static EventStoreException invalidSequence(AggregateIdentity aggregateId, long expectedVersion,
            long actualVersion) {
        return new EventStoreException(Fault.INVALID_SEQUENCE, "Event for aggregate " + aggregateId
                + " does not follow sequence. Expected: " + expectedVersion + " actual: " + actualVersion, null);
    }

    public static EventStoreException storeFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException cancelled() {
        return new EventStoreException(Fault.CANCELLED, "Write was cancelled before storing any event", null);
    }

    public static EventStoreException serializationFailed(Object event, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Cannot serialize event " + event + ". "
                + cause.getMessage(), cause);
    }

    public static EventStoreException unsupported(Object event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event, null);
    }
}
