package org.calista.arasaka.blueprint.kits;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class IndustryKitCatalogTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void loadsBundledKits() {
        IndustryKitCatalog catalog = IndustryKitCatalog.fromClasspath(IndustryKitCatalog.DEFAULT_RESOURCE, om);

        assertEquals(List.of("plumber", "electrician", "cleaning", "real-estate", "property-management"), catalog.ids());

        IndustryKit plumber = catalog.find("plumber").orElseThrow();
        assertEquals("Plumber", plumber.name);
        assertEquals(9, plumber.entities.size());
        assertEquals("job", plumber.entities.get(1).id);
        assertEquals("Jobs", plumber.entities.get(1).pluralName);
        assertEquals(4, plumber.suggestedIntegrations.size());
        assertTrue(plumber.recommendedFeatures().isEmpty());

        IndustryKit pm = catalog.find("property-management").orElseThrow();
        assertEquals(List.of("tenant_management", "lease_tracking", "rent_collection", "property_tracking"),
                pm.featureBundle.core);
        assertEquals(4, pm.recommendedFeatures().size());
    }

    @Test
    void loadedKitListsCannotBeModified() {
        IndustryKitCatalog catalog = IndustryKitCatalog.fromClasspath(IndustryKitCatalog.DEFAULT_RESOURCE, om);
        IndustryKit plumber = catalog.find("plumber").orElseThrow();
        IndustryKit pm = catalog.find("property-management").orElseThrow();

        assertThrows(UnsupportedOperationException.class,
                () -> plumber.entities.add(new IndustryKit.KitEntity("x", "X", "Xs")));
        assertThrows(UnsupportedOperationException.class, () -> plumber.workflows.clear());
        assertThrows(UnsupportedOperationException.class, () -> plumber.suggestedIntegrations.remove(0));
        assertThrows(UnsupportedOperationException.class, () -> pm.featureBundle.core.add("x"));
        assertThrows(UnsupportedOperationException.class, () -> pm.recommendedFeatures().add("x"));
        assertEquals(9, catalog.find("plumber").orElseThrow().entities.size());
    }

    @Test
    void validateDropsNullListElements() {
        IndustryKit kit = new IndustryKit();
        kit.id = "bakery";
        kit.workflows.add(null);
        kit.workflows.add("order-received");

        kit.validate();

        assertEquals(List.of("order-received"), kit.workflows);
    }

    @Test
    void unknownIdsAreEmpty() {
        IndustryKitCatalog catalog = IndustryKitCatalog.empty();

        assertTrue(catalog.find("plumber").isEmpty());
        assertTrue(catalog.find(null).isEmpty());
        assertEquals(0, catalog.size());
    }

    @Test
    void missingResourceFails() {
        assertThrows(IllegalStateException.class,
                () -> IndustryKitCatalog.fromClasspath("kits/does-not-exist.json", om));
    }

    @Test
    void firstKitWithAnIdWins() {
        IndustryKit first = new IndustryKit();
        first.id = "plumber";
        first.name = "First";
        IndustryKit second = new IndustryKit();
        second.id = "plumber";
        second.name = "Second";

        IndustryKitCatalog catalog = new IndustryKitCatalog(List.of(first, second));

        assertEquals(1, catalog.size());
        assertEquals("First", catalog.find("plumber").orElseThrow().name);
    }

    @Test
    void validationFillsDefaults() {
        IndustryKit kit = new IndustryKit();
        kit.id = "bakery";
        kit.entities = null;
        kit.workflows = null;
        kit.suggestedIntegrations = List.of(new IndustryKit.SuggestedIntegration("stripe", "Stripe", "Payments"));

        kit.validate();

        assertEquals("bakery", kit.name);
        assertTrue(kit.entities.isEmpty());
        assertTrue(kit.workflows.isEmpty());
        assertTrue(kit.entityNames().isEmpty());
    }

    @Test
    void pluralNameDefaultsToNamePlusS() {
        IndustryKit kit = new IndustryKit();
        kit.id = "bakery";
        kit.entities.add(new IndustryKit.KitEntity("order", "Order", null));

        kit.validate();

        assertEquals("Orders", kit.entities.get(0).pluralName);
        assertEquals(List.of("Order"), kit.entityNames());
    }

    @Test
    void kitWithoutIdIsRejected() {
        assertThrows(IllegalStateException.class, () -> new IndustryKit().validate());
    }
}
