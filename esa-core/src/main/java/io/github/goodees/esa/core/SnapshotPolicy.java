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
 * Decides whether an aggregate should be snapshotted after it was saved.
 */
@FunctionalInterface
public interface SnapshotPolicy {
    SnapshotPolicy NEVER = (previousVersion, currentVersion) -> false;

    /**
     * @param previousVersion stored version before the save
     * @param currentVersion stored version after the save
     * @return true to store a snapshot
     */
    boolean shouldSnapshot(long previousVersion, long currentVersion);

    /**
     * Snapshot whenever a save crosses a multiple of {@code n}.
     * @param n number of events between snapshots
     * @return the policy
     */
    static SnapshotPolicy everyNEvents(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Snapshot interval must be positive, was " + n);
        }
        return (previousVersion, currentVersion) -> currentVersion / n > previousVersion / n;
    }
}
