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
 * Walks upgrade chains of versioned values.
 */
public final class Upgrades {
    private Upgrades() {
    }

    /**
     * Upgrade value to most recent version of its type.
     * @param value value to upgrade
     * @param <V> value family
     * @return the value itself if it has no successor, otherwise the last successor in the chain
     * @throws TypeUpgradeConflictException when a successor changes the type name
     * @throws TypeVersionUpgradeConflictException when a successor does not increase the version
     */
    public static <V extends Versioned<V>> V upgradeRecursive(V value) {
        V current = value;
        while (true) {
            Optional<? extends V> successor = current.upgrade();
            if (!successor.isPresent()) {
                return current;
            }
            V next = successor.get();
            checkSuccessor(current, next);
            current = next;
        }
    }

    /**
     * Upgrade value whose family is not known statically, like a snapshot payload read from a store.
     * @param value value to upgrade
     * @return most recent version of the value
     */
    public static Versioned<?> upgradeAny(Versioned<?> value) {
        Versioned<?> current = value;
        while (true) {
            Optional<? extends Versioned<?>> successor = current.upgrade();
            if (!successor.isPresent()) {
                return current;
            }
            Versioned<?> next = successor.get();
            checkSuccessor(current, next);
            current = next;
        }
    }

    private static void checkSuccessor(Versioned<?> current, Versioned<?> next) {
        TypeDefinition from = TypeDefinitions.resolve(current.getClass());
        TypeDefinition to = TypeDefinitions.resolve(next.getClass());
        if (!from.getName().equals(to.getName())) {
            throw new TypeUpgradeConflictException(from, to);
        }
        if (to.getVersion() <= from.getVersion()) {
            throw new TypeVersionUpgradeConflictException(from, to);
        }
    }
}
