package io.github.goodees.esa.store.inmemory;

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
import io.github.goodees.esa.core.store.AggregateSnapshot;
import io.github.goodees.esa.core.store.SnapshotStore;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Snapshot store keeping all snapshots in memory, indexed by aggregate version.
 */
public class InMemorySnapshotStore implements SnapshotStore {
    private final ConcurrentMap<AggregateIdentity, NavigableMap<Long, AggregateSnapshot>> snapshots =
            new ConcurrentHashMap<>();

    @Override
    public Optional<AggregateSnapshot> read(AggregateIdentity aggregateId, long maxVersion) {
        NavigableMap<Long, AggregateSnapshot> versions = snapshots.get(aggregateId);
        if (versions == null) {
            return Optional.empty();
        }
        Map.Entry<Long, AggregateSnapshot> entry = maxVersion == 0 ? versions.lastEntry()
                : versions.floorEntry(maxVersion);
        return Optional.ofNullable(entry).map(Map.Entry::getValue);
    }

    @Override
    public void write(AggregateSnapshot snapshot) {
        snapshots.computeIfAbsent(snapshot.getAggregateId(), id -> new ConcurrentSkipListMap<>())
                .put(snapshot.getAggregateVersion(), snapshot);
    }
}
