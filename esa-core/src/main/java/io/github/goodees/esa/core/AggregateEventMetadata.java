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

import org.immutables.value.Value;

import java.time.Instant;

/**
 * Complete metadata of an event, assigned at the time it is emitted.
 */
@Value.Immutable
@ValueStyle
public abstract class AggregateEventMetadata {
    public abstract IdempotencyId getIdempotencyId();

    public abstract CorrelationId getCorrelationId();

    /**
     * Deterministic id derived from aggregate identity and version.
     * @return event id
     */
    public abstract EventId getEventId();

    public abstract String getEventTypeName();

    public abstract int getEventTypeVersion();

    public abstract AggregateIdentity getAggregateId();

    public abstract String getAggregateTypeName();

    /**
     * Version of the aggregate after applying the event, starting at 1.
     * @return aggregate version
     */
    public abstract long getAggregateVersion();

    public abstract Instant getTimestamp();

    public static ImmutableAggregateEventMetadata.Builder builder() {
        return ImmutableAggregateEventMetadata.builder();
    }
}
