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

import io.github.goodees.esa.core.types.Versioned;

/**
 * Immutable fact that happened to an aggregate whose state is of type {@code S}.
 *
 * <p>Events are plain values. Their persistent name and version are declared with
 * {@link io.github.goodees.esa.core.types.VersionedType}, and the handling logic lives in the state, registered in
 * {@link AggregateState#declareHandlers(io.github.goodees.esa.core.dispatch.EventHandlers)}.
 *
 * @param <S> state the event applies to
 */
public interface AggregateEvent<S extends AggregateState<S>> extends Versioned<AggregateEvent<S>> {
}
