package io.github.goodees.esa.example.banking;

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

import io.github.goodees.esa.core.AggregateEvent;
import io.github.goodees.esa.core.types.VersionedType;

@VersionedType(name = "AccountOpened", version = 1)
public final class AccountOpened implements AggregateEvent<AccountState> {
    private final String owner;

    public AccountOpened(String owner) {
        this.owner = owner;
    }

    public String getOwner() {
        return owner;
    }
}
