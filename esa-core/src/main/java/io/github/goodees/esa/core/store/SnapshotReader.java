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

import java.util.Optional;

public interface SnapshotReader {
    /**
     * Find most recent snapshot at or below a version.
     * @param aggregateId identity of the aggregate
     * @param maxVersion highest acceptable snapshot version, 0 for the latest snapshot
     * @return snapshot if one is available
     */
    Optional<AggregateSnapshot> read(AggregateIdentity aggregateId, long maxVersion);
}
