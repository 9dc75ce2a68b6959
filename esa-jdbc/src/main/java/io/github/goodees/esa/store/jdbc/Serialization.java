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

/**
 * Common interface for serialization and deserialization into String payload. Both event and snapshot stores use
 * it to convert versioned values.
 * <p>The type name and version of a value are stored next to its payload by the store, and are provided to
 * {@link #deserialize(String, int, String)}. A serialization must be able to read payloads of every version of a type
 * that still exists in the code base, upgrading them is the job of the type itself.</p>
 */
public interface Serialization<T> {
    /**
     * Serialize the object into a String payload.
     * @param object object to serialize
     * @return String serialization of the object
     */
    String serialize(T object);

    /**
     * Deserialize a payload given its type.
     *
     * @param typeName the name of the type as stored in the store
     * @param typeVersion the version of the type as stored in the store
     * @param payload payload to deserialize
     * @return deserialized object or null if the type is not known to this serialization
     */
    T deserialize(String typeName, int typeVersion, String payload);

    /**
     * Return object of correct type, if its class is supported.
     *
     * @param o object to cast
     * @return casted object, or <code>null</code> if instance is of unsupported type.
     */
    T toSerializable(Object o);
}
