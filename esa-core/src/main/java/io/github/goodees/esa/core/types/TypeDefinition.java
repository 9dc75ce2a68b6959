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

import java.util.Objects;

/**
 * Resolved name and version of a class.
 */
public final class TypeDefinition {
    private final String name;
    private final int version;
    private final Class<?> type;

    public TypeDefinition(String name, int version, Class<?> type) {
        this.name = Objects.requireNonNull(name, "Type name cannot be null");
        this.version = version;
        this.type = Objects.requireNonNull(type, "Type cannot be null");
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    public Class<?> getType() {
        return type;
    }

    public boolean isVersioned() {
        return version > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypeDefinition)) {
            return false;
        }
        TypeDefinition that = (TypeDefinition) o;
        return version == that.version && name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, type);
    }

    @Override
    public String toString() {
        return name + " v" + version + " (" + type.getName() + ")";
    }
}
