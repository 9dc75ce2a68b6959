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
import io.github.goodees.esa.core.types.Versioned;

import java.time.Instant;
import java.util.Objects;

/**
 * Captured state of an aggregate at a version.
 */
public final class AggregateSnapshot {
    private final Versioned<?> payload;
    private final AggregateIdentity aggregateId;
    private final String aggregateTypeName;
    private final long aggregateVersion;
    private final Instant timestamp;

    public AggregateSnapshot(Versioned<?> payload, AggregateIdentity aggregateId, String aggregateTypeName,
            long aggregateVersion, Instant timestamp) {
        this.payload = Objects.requireNonNull(payload, "Payload cannot be null");
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        this.aggregateTypeName = aggregateTypeName;
        this.aggregateVersion = aggregateVersion;
        this.timestamp = timestamp;
    }

    public Versioned<?> getPayload() {
        return payload;
    }

    public AggregateIdentity getAggregateId() {
        return aggregateId;
    }

    public String getAggregateTypeName() {
        return aggregateTypeName;
    }

    /**
     * Version the aggregate was in when this snapshot was generated.
     * @return aggregate version
     */
    public long getAggregateVersion() {
        return aggregateVersion;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
