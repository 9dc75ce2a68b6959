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
 * Caller supplied key for detecting repeated submissions of the same event.
 */
public final class IdempotencyId extends UuidValue {
    private IdempotencyId(UUID value) {
        super(value);
    }

    public static IdempotencyId of(UUID value) {
        return new IdempotencyId(value);
    }

    public static IdempotencyId parse(String value) {
        return new IdempotencyId(UUID.fromString(value));
    }

    public static IdempotencyId random() {
        return new IdempotencyId(Uuids.random());
    }
}
