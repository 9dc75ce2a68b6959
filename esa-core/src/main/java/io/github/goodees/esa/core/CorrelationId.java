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

import java.util.UUID;

/**
 * Groups events caused by one logical operation.
 */
public final class CorrelationId extends UuidValue {
    private CorrelationId(UUID value) {
        super(value);
    }

    public static CorrelationId of(UUID value) {
        return new CorrelationId(value);
    }

    public static CorrelationId parse(String value) {
        return new CorrelationId(UUID.fromString(value));
    }

    public static CorrelationId random() {
        return new CorrelationId(Uuids.comb());
    }
}
