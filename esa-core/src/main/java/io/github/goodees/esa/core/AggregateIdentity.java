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

import io.github.goodees.esa.core.types.TypeDefinitions;

import java.util.UUID;

/**
 * Typed identity of an aggregate.
 *
 * <p>The string form is {@code <type>-<uuid without dashes>}, where type is snake case type name of the identity
 * class without suffix {@code _id}. {@code AccountId} with value {@code 0b2d...} is therefore printed as
 * {@code account-0b2d...}. Stores use the string form as the key of the aggregate.
 */
public abstract class AggregateIdentity extends UuidValue {
    private static final ClassValue<String> PREFIXES = new ClassValue<String>() {
        @Override
        protected String computeValue(Class<?> type) {
            String snake = toSnakeCase(TypeDefinitions.nameOf(type));
            return snake.endsWith("_id") ? snake.substring(0, snake.length() - 3) : snake;
        }
    };

    protected AggregateIdentity(UUID value) {
        super(value);
    }

    static String toSnakeCase(String name) {
        StringBuilder result = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && !Character.isUpperCase(name.charAt(i - 1)) && name.charAt(i - 1) != '_') {
                    result.append('_');
                }
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return PREFIXES.get(getClass()) + "-" + getValue().toString().replace("-", "");
    }
}
