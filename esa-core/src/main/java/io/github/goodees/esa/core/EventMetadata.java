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

import java.util.Optional;

/**
 * Caller supplied metadata of an emitted event. Missing ids are generated by the aggregate.
 */
@Value.Immutable
@ValueStyle
public abstract class EventMetadata {
    public abstract Optional<IdempotencyId> getIdempotencyId();

    public abstract Optional<CorrelationId> getCorrelationId();

    public static ImmutableEventMetadata.Builder builder() {
        return ImmutableEventMetadata.builder();
    }

    public static EventMetadata idempotent(IdempotencyId idempotencyId) {
        return builder().idempotencyId(idempotencyId).build();
    }
}
