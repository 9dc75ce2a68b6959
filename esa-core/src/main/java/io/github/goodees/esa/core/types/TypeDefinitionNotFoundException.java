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

public class TypeDefinitionNotFoundException extends IllegalArgumentException {
    private final String typeName;
    private final int typeVersion;
    private final Class<?> type;

    public TypeDefinitionNotFoundException(String typeName, int typeVersion) {
        super("No type is registered for " + typeName + " v" + typeVersion);
        this.typeName = typeName;
        this.typeVersion = typeVersion;
        this.type = null;
    }

    public TypeDefinitionNotFoundException(Class<?> type) {
        super("Type " + type.getName() + " is not registered in type catalog");
        this.typeName = type.getName();
        this.typeVersion = 0;
        this.type = type;
    }

    /**
     * @return class that was looked up, or null when the lookup was by name and version
     */
    public Class<?> getType() {
        return type;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getTypeVersion() {
        return typeVersion;
    }
}
