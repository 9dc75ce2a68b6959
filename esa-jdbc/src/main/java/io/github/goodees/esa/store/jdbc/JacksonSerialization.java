package io.github.goodees.esa.store.jdbc;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.esa.core.AggregateEvent;
import io.github.goodees.esa.core.types.TypeCatalog;
import io.github.goodees.esa.core.types.TypeDefinitionNotFoundException;
import io.github.goodees.esa.core.types.Versioned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * JSON serialization of versioned values. Classes are looked up in {@link TypeCatalog} by stored type name and
 * version, so only cataloged types are supported.
 *
 * @param <T> base type of serialized values
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private static final Logger logger = LoggerFactory.getLogger(JacksonSerialization.class);

    private final TypeCatalog catalog;
    private final ObjectMapper mapper;
    private final Class<?> baseType;

    public JacksonSerialization(TypeCatalog catalog, ObjectMapper mapper, Class<?> baseType) {
        this.catalog = Objects.requireNonNull(catalog);
        this.mapper = Objects.requireNonNull(mapper);
        this.baseType = Objects.requireNonNull(baseType);
    }

    public static JacksonSerialization<AggregateEvent<?>> forEvents(TypeCatalog catalog) {
        return new JacksonSerialization<>(catalog, defaultObjectMapper(), AggregateEvent.class);
    }

    public static JacksonSerialization<Versioned<?>> forSnapshots(TypeCatalog catalog) {
        return new JacksonSerialization<>(catalog, defaultObjectMapper(), Versioned.class);
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new Jdk8Module());
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object.getClass().getName(), e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public T deserialize(String typeName, int typeVersion, String payload) {
        Class<?> type;
        try {
            type = catalog.resolveType(typeName, typeVersion);
        } catch (TypeDefinitionNotFoundException e) {
            logger.debug("Type {} v{} is not cataloged", typeName, typeVersion);
            return null;
        }
        if (!baseType.isAssignableFrom(type)) {
            return null;
        }
        try {
            return (T) mapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot deserialize " + typeName + " v" + typeVersion, e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public T toSerializable(Object o) {
        return o != null && baseType.isInstance(o) && catalog.contains(o.getClass()) ? (T) o : null;
    }
}
