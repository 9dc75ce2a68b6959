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
 * Outcome of {@link AggregateRoot#tryCommit(io.github.goodees.esa.core.store.EventWriter)}. Except for {@link #OK},
 * the pending events remain buffered in the aggregate.
 */
public enum CommitResult {
    OK,
    /** Store holds newer events of the aggregate. Reload and retry. */
    OUT_OF_SYNC,
    /** Pending events did not form a valid sequence. */
    INVALID_SEQUENCE,
    /** Store failed for other reason. */
    FAILED;

    static CommitResult of(EventStoreException.Fault fault) {
        switch (fault) {
            case OUT_OF_SYNC:
                return OUT_OF_SYNC;
            case INVALID_SEQUENCE:
                return INVALID_SEQUENCE;
            default:
                return FAILED;
        }
    }
}
