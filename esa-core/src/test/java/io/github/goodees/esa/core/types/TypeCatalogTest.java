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

import io.github.goodees.esa.example.banking.AccountAmountDepositedV1;
import io.github.goodees.esa.example.banking.AccountAmountDepositedV2;
import io.github.goodees.esa.example.banking.AccountOpened;
import io.github.goodees.esa.example.banking.AccountSnapshotV2;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TypeCatalogTest {

    @VersionedType(name = "Clash", version = 1)
    static class ClashA {
    }

    @VersionedType(name = "Clash", version = 1)
    static class ClashB {
    }

    @VersionedType(name = "Mixed", version = 2)
    static class MixedVersioned {
    }

    @NamedType("Mixed")
    static class MixedUnversioned {
    }

    static class ParcelShippedEvent {
    }

    @NamedType("Parcel")
    static class Parcel {
    }

    @Test
    public void resolves_declared_name_and_version() {
        TypeCatalog catalog = TypeCatalog.of(AccountAmountDepositedV1.class, AccountAmountDepositedV2.class);

        TypeDefinition v1 = catalog.resolveNameAndVersion(AccountAmountDepositedV1.class);
        assertEquals("AccountAmountDeposited", v1.getName());
        assertEquals(1, v1.getVersion());
        assertSame(AccountAmountDepositedV2.class, catalog.resolveType("AccountAmountDeposited", 2));
    }

    @Test
    public void unannotated_type_has_default_name_at_version_zero() {
        TypeCatalog catalog = TypeCatalog.of(ParcelShippedEvent.class, Parcel.class);

        assertSame(ParcelShippedEvent.class, catalog.resolveType("ParcelShipped", 0));
        assertSame(Parcel.class, catalog.resolveType("Parcel", 0));
        assertFalse(catalog.resolveNameAndVersion(Parcel.class).isVersioned());
    }

    @Test
    public void same_name_and_version_conflicts() {
        try {
            TypeCatalog.of(ClashA.class, ClashB.class);
            fail("should have failed");
        } catch (TypeDefinitionConflictException e) {
            assertThat(e.getMessage(), containsString("similar version numbers"));
        }
    }

    @Test
    public void unversioned_type_sharing_name_with_versioned_conflicts() {
        try {
            TypeCatalog.of(MixedVersioned.class, MixedUnversioned.class);
            fail("should have failed");
        } catch (TypeDefinitionConflictException e) {
            assertThat(e.getMessage(), containsString("missing version numbers"));
        }
    }

    @Test
    public void registering_same_class_twice_is_harmless() {
        TypeCatalog catalog = TypeCatalog.of(AccountOpened.class, AccountOpened.class);
        assertEquals(1, catalog.types().size());
    }

    @Test(expected = TypeDefinitionNotFoundException.class)
    public void unknown_name_is_not_found() {
        TypeCatalog.of(AccountOpened.class).resolveType("AccountOpened", 2);
    }

    @Test
    public void unregistered_class_is_not_found() {
        try {
            TypeCatalog.of(AccountOpened.class).resolveNameAndVersion(AccountSnapshotV2.class);
            fail("should have failed");
        } catch (TypeDefinitionNotFoundException e) {
            assertEquals(AccountSnapshotV2.class, e.getType());
        }
    }

    @Test
    public void providers_are_discovered_through_service_loader() {
        TypeCatalog catalog = TypeCatalog.discover(getClass().getClassLoader());

        assertTrue(catalog.contains(AccountOpened.class));
        assertTrue(catalog.contains(AccountAmountDepositedV1.class));
        assertTrue(catalog.contains(AccountSnapshotV2.class));
        assertSame(AccountAmountDepositedV2.class, catalog.resolveType("AccountAmountDeposited", 2));
    }

    @Test
    public void default_type_name_strips_event_suffix() {
        assertEquals("ThingHappened", TypeDefinitions.defaultTypeName("ThingHappenedEvent"));
        assertEquals("Event", TypeDefinitions.defaultTypeName("Event"));
        assertEquals("Order", TypeDefinitions.defaultTypeName("Order"));
    }
}
