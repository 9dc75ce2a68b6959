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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.goodees.esa.core.AggregateEvent;
import io.github.goodees.esa.core.types.VersionedType;

import java.util.Optional;

@VersionedType(name = "CounterIncremented", version = 1)
public final class CounterIncrementedV1 implements AggregateEvent<CounterState> {
    private final int amount;

    @JsonCreator
    public CounterIncrementedV1(@JsonProperty("amount") int amount) {
        this.amount = amount;
    }

    public int getAmount() {
        return amount;
    }

    @Override
    public Optional<CounterIncremented> upgrade() {
        return Optional.of(new CounterIncremented(amount, "unspecified"));
    }
}
