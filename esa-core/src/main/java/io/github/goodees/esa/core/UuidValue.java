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

import java.util.Objects;
import java.util.UUID;

/**
 * Base of typed UUID values. Two values are equal when they are of same class and hold same UUID.
 */
public abstract class UuidValue {
    private final UUID value;

    protected UuidValue(UUID value) {
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }

    public UUID getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        return value.equals(((UuidValue) o).value);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
