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

/**
 * Event with the same idempotency id is already pending in the aggregate.
 */
public class DuplicateAggregateEventException extends IllegalStateException {
    private final AggregateIdentity identity;
    private final IdempotencyId idempotencyId;

    public DuplicateAggregateEventException(String aggregateTypeName, AggregateIdentity identity,
            IdempotencyId idempotencyId) {
        super("Aggregate " + aggregateTypeName + " " + identity + " already has pending event with idempotency id "
                + idempotencyId);
        this.identity = identity;
        this.idempotencyId = idempotencyId;
    }

    public AggregateIdentity getIdentity() {
        return identity;
    }

    public IdempotencyId getIdempotencyId() {
        return idempotencyId;
    }
}
