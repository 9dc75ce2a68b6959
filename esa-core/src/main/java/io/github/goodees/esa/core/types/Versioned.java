package io.github.goodees.esa.core.types;

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

import java.util.Optional;

/**
 * A persistent value whose schema evolves. Its name and version come from {@link TypeDefinitions}.
 *
 * @param <V> the family of values an upgrade stays within
 * @see Upgrades#upgradeRecursive(Versioned)
 */
public interface Versioned<V extends Versioned<V>> {

    /**
     * Successor of this value in next version of its type. Successor must keep the type name and have strictly
     * higher version.
     * @return successor, or empty when this is the most recent version
     */
    default Optional<? extends V> upgrade() {
        return Optional.empty();
    }

    default String typeName() {
        return TypeDefinitions.resolve(getClass()).getName();
    }

    default int typeVersion() {
        return TypeDefinitions.resolve(getClass()).getVersion();
    }
}
