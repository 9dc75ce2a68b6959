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

import io.github.goodees.esa.core.types.VersionedTypeProvider;

import java.util.Arrays;
import java.util.Collection;

public class BankingTypes implements VersionedTypeProvider {
    @Override
    public Collection<Class<?>> types() {
        return Arrays.asList(AccountOpened.class, AccountAmountDepositedV1.class, AccountAmountDepositedV2.class,
            AccountAmountWithdrawn.class, AccountFrozen.class, AccountUnfrozen.class, AccountClosed.class,
            AccountAudited.class, AccountSnapshotV1.class, AccountSnapshotV2.class);
    }
}
