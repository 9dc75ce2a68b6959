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

/**
 * Upgrade produced a value of different type name.
 */
public class TypeUpgradeConflictException extends IllegalStateException {
    private final TypeDefinition from;
    private final TypeDefinition to;

    public TypeUpgradeConflictException(TypeDefinition from, TypeDefinition to) {
        super("Upgrade of " + from + " produced " + to + " of a different type name");
        this.from = from;
        this.to = to;
    }

    public TypeDefinition getFrom() {
        return from;
    }

    public TypeDefinition getTo() {
        return to;
    }
}
