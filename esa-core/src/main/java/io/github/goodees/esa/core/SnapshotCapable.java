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
 * State that can be captured into a snapshot payload, and restored from one.
 *
 * @param <P> snapshot payload family
 */
public interface SnapshotCapable<P extends Versioned<P>> {
    /**
     * Capture current state.
     * @return snapshot payload
     */
    P createSnapshot();

    /**
     * Restore state from a snapshot. Called on fresh state, before any events are applied.
     * @param snapshot most recent version of the payload
     */
    void consumeSnapshot(P snapshot);
}
