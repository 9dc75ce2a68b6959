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
 * Resolution of persistent names and versions from class declarations.
 *
 * <p>A class annotated with {@link VersionedType} resolves to its declared name and version, one annotated with
 * {@link NamedType} to its name with version 0. Any other class resolves to its simple name, stripped of suffix
 * {@code Event}, at version 0. Results are cached per class.
 */
public final class TypeDefinitions {
    private static final String EVENT_SUFFIX = "Event";

    private static final ClassValue<TypeDefinition> RESOLVED = new ClassValue<TypeDefinition>() {
        @Override
        protected TypeDefinition computeValue(Class<?> type) {
            return compute(type);
        }
    };

    private TypeDefinitions() {
    }

    public static TypeDefinition resolve(Class<?> type) {
        return RESOLVED.get(type);
    }

    public static String nameOf(Class<?> type) {
        return resolve(type).getName();
    }

    /**
     * Default type name. Strips suffix Event.
     * @param simpleClassName the name of the class
     * @return simple name. AccountOpenedEvent becomes AccountOpened.
     */
    public static String defaultTypeName(String simpleClassName) {
        if (simpleClassName.endsWith(EVENT_SUFFIX) && simpleClassName.length() > EVENT_SUFFIX.length()) {
            return simpleClassName.substring(0, simpleClassName.length() - EVENT_SUFFIX.length());
        }
        return simpleClassName;
    }

    private static TypeDefinition compute(Class<?> type) {
        VersionedType versioned = type.getAnnotation(VersionedType.class);
        if (versioned != null) {
            if (versioned.version() < 1) {
                throw new TypeDefinitionConflictException("Type " + type.getName() + " declares version "
                        + versioned.version() + ", versions start with 1");
            }
            return new TypeDefinition(requireName(type, versioned.name()), versioned.version(), type);
        }
        NamedType named = type.getAnnotation(NamedType.class);
        if (named != null) {
            return new TypeDefinition(requireName(type, named.value()), 0, type);
        }
        return new TypeDefinition(defaultTypeName(type.getSimpleName()), 0, type);
    }

    private static String requireName(Class<?> type, String name) {
        if (name.trim().isEmpty()) {
            throw new TypeDefinitionConflictException("Type " + type.getName() + " declares blank type name");
        }
        return name;
    }
}
