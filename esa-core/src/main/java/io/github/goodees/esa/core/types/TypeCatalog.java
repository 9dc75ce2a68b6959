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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

import static java.util.stream.Collectors.joining;

/**
 * Immutable registry mapping persistent (name, version) pairs to classes and back.
 *
 * <p>The catalog is built once, validated at build time, and then shared by everything that needs to resolve
 * persisted types, typically event and snapshot stores. For every type name the catalog holds either a single
 * unversioned class, or any number of classes with distinct positive versions.
 */
public final class TypeCatalog {
    private static final Logger logger = LoggerFactory.getLogger(TypeCatalog.class);

    private final Map<Class<?>, TypeDefinition> byType;
    private final Map<String, Map<Integer, TypeDefinition>> byName;

    private TypeCatalog(Collection<Class<?>> types) {
        Map<Class<?>, TypeDefinition> definitions = new LinkedHashMap<>();
        Map<String, List<TypeDefinition>> grouped = new LinkedHashMap<>();
        for (Class<?> type : new LinkedHashSet<>(types)) {
            TypeDefinition definition = TypeDefinitions.resolve(type);
            definitions.put(type, definition);
            grouped.computeIfAbsent(definition.getName(), n -> new ArrayList<>()).add(definition);
        }
        Map<String, Map<Integer, TypeDefinition>> names = new HashMap<>();
        grouped.forEach((name, group) -> names.put(name, validate(name, group)));
        this.byType = Collections.unmodifiableMap(definitions);
        this.byName = Collections.unmodifiableMap(names);
    }

    public static TypeCatalog of(Class<?>... types) {
        return of(Arrays.asList(types));
    }

    public static TypeCatalog of(Collection<Class<?>> types) {
        TypeCatalog catalog = new TypeCatalog(types);
        logger.debug("Built type catalog of {} types under {} names", catalog.byType.size(), catalog.byName.size());
        return catalog;
    }

    /**
     * Build catalog of all types contributed by {@link VersionedTypeProvider} services visible to class loader.
     * @param classLoader class loader to look up providers with
     * @return validated catalog
     */
    public static TypeCatalog discover(ClassLoader classLoader) {
        List<Class<?>> types = new ArrayList<>();
        for (VersionedTypeProvider provider : ServiceLoader.load(VersionedTypeProvider.class, classLoader)) {
            logger.debug("Registering types of {}", provider.getClass().getName());
            types.addAll(provider.types());
        }
        return of(types);
    }

    private static Map<Integer, TypeDefinition> validate(String name, List<TypeDefinition> group) {
        if (group.size() > 1 && group.stream().anyMatch(d -> !d.isVersioned())) {
            throw new TypeDefinitionConflictException("Multiple definitions of type name " + name
                    + " with some of them missing version numbers: " + describe(group));
        }
        Map<Integer, TypeDefinition> versions = new HashMap<>();
        for (TypeDefinition definition : group) {
            if (versions.putIfAbsent(definition.getVersion(), definition) != null) {
                throw new TypeDefinitionConflictException("Multiple definitions of type name " + name
                        + " with similar version numbers: " + describe(group));
            }
        }
        return Collections.unmodifiableMap(versions);
    }

    private static String describe(List<TypeDefinition> group) {
        return group.stream().map(TypeDefinition::toString).collect(joining(", ", "{", "}"));
    }

    /**
     * Name and version of a registered class.
     * @param type registered class
     * @return its definition
     * @throws TypeDefinitionNotFoundException when the class is not part of the catalog
     */
    public TypeDefinition resolveNameAndVersion(Class<?> type) {
        TypeDefinition definition = byType.get(Objects.requireNonNull(type));
        if (definition == null) {
            throw new TypeDefinitionNotFoundException(type);
        }
        return definition;
    }

    public Class<?> resolveType(String name, int version) {
        Map<Integer, TypeDefinition> versions = byName.get(name);
        TypeDefinition definition = versions == null ? null : versions.get(version);
        if (definition == null) {
            throw new TypeDefinitionNotFoundException(name, version);
        }
        return definition.getType();
    }

    public boolean contains(Class<?> type) {
        return byType.containsKey(type);
    }

    public Set<Class<?>> types() {
        return byType.keySet();
    }
}
