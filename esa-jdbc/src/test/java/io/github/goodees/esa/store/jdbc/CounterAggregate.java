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

import io.github.goodees.esa.core.AggregateContext;
import io.github.goodees.esa.core.AggregateRoot;
import io.github.goodees.esa.core.types.NamedType;

@NamedType("COUNTER")
public class CounterAggregate extends AggregateRoot<CounterId, CounterState> {

    public CounterAggregate(AggregateContext<CounterId, CounterState> context) {
        super(context);
    }

    public void increment(int amount, String reason) {
        emit(new CounterIncremented(amount, reason));
    }

    public void reset() {
        emit(new CounterReset());
    }

    public long getTotal() {
        return locked(() -> state().getTotal());
    }

    public String getLastReason() {
        return locked(() -> state().getLastReason());
    }
}
