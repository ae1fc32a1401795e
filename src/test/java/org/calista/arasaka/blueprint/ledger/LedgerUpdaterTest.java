package org.calista.arasaka.blueprint.ledger;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.calista.arasaka.blueprint.kits.IndustryKit;
import org.calista.arasaka.blueprint.kits.IndustryKitCatalog;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LedgerUpdaterTest {

    private static IndustryKitCatalog catalog;

    private final LedgerUpdater updater = new LedgerUpdater();

    @BeforeAll
    static void loadKits() {
        catalog = IndustryKitCatalog.fromClasspath(IndustryKitCatalog.DEFAULT_RESOURCE, new ObjectMapper());
    }

    private static IndustryKit kit(String id) {
        return catalog.find(id).orElseThrow();
    }

    @Test
    @DisplayName("plumbing business with technicians: inferred industry, bare-number scale")
    void plumbingScenario() {
        CertaintyLedger ledger = updater.update(CertaintyLedger.empty(),
                "I need an app for my plumbing business with 5 technicians", null);

        assertEquals("plumber", ledger.industry().value());
        assertEquals(0.7, ledger.industry().confidence(), 1e-9);
        assertEquals(SlotSource.INFERRED, ledger.industry().source());

        assertEquals(5, ledger.scale().value());
        assertEquals(0.5, ledger.scale().confidence(), 1e-9);

        assertFalse(ledger.teamSize().isPresent());
        assertEquals(List.of(SlotId.PRIMARY_ENTITIES), ledger.gaps);
        assertEquals(0.275, ledger.overallReadiness, 1e-9);
        assertFalse(ledger.isReadyToBuild());
    }

    @Test
    void slotsWithoutNewEvidenceAreKept() {
        CertaintyLedger first = updater.update(CertaintyLedger.empty(), "we do plumbing", null);
        CertaintyLedger second = updater.update(first, "we also need invoices", null);

        assertEquals("plumber", second.industry().value());
        assertEquals(first.industry(), second.industry());
    }

    @Test
    void kitIsAuthoritative() {
        CertaintyLedger ledger = updater.update(CertaintyLedger.empty(), "we do plumbing", kit("plumber"));

        assertEquals("plumber", ledger.industry().value());
        assertEquals(0.95, ledger.industry().confidence(), 1e-9);
        assertEquals(SlotSource.EXPLICIT, ledger.industry().source());

        assertEquals(9, ledger.primaryEntities().value().size());
        assertEquals("Homeowner", ledger.primaryEntities().value().get(0));
        assertEquals(0.855, ledger.primaryEntities().confidence(), 1e-9);
        assertEquals(List.of("Derived from Plumber kit"), ledger.primaryEntities().evidence());

        assertEquals(List.of("job-status", "invoice-generation", "schedule-reminders", "quote-approval"),
                ledger.workflows().value());
        assertEquals(0.8075, ledger.workflows().confidence(), 1e-9);

        assertEquals(List.of("stripe", "quickbooks", "google_calendar", "thumbtack"), ledger.integrations().value());
        assertEquals(0.5, ledger.integrations().confidence(), 1e-9);
        assertEquals(SlotSource.ASSUMED, ledger.integrations().source());

        assertTrue(ledger.suggestions.isEmpty());
        assertTrue(ledger.gaps.isEmpty());
        assertTrue(ledger.isReadyToBuild());
    }

    @Test
    void detectedIntegrationsWinOverKitDefaults() {
        CertaintyLedger ledger = updater.update(CertaintyLedger.empty(),
                "we take stripe payments and send sms", kit("plumber"));

        assertEquals(List.of("stripe", "twilio"), ledger.integrations().value());
        assertEquals(0.85, ledger.integrations().confidence(), 1e-9);
        assertEquals(SlotSource.EXPLICIT, ledger.integrations().source());
        assertEquals(List.of(
                "QuickBooks: Accounting and invoicing",
                "Google Calendar: Schedule sync",
                "Thumbtack: Lead generation"), ledger.suggestions);
    }

    @Test
    void suggestionsIncludeRecommendedFeaturesAndAreCapped() {
        IndustryKit pm = kit("property-management");

        CertaintyLedger ledger = updater.update(CertaintyLedger.empty(), "we manage apartments", pm);
        assertEquals(pm.featureBundle.recommended, ledger.suggestions);

        LedgerUpdater capped = new LedgerUpdater(LedgerUpdater.Config.builder().maxSuggestions(1).build());
        CertaintyLedger one = capped.update(CertaintyLedger.empty(), "we manage apartments", pm);
        assertEquals(List.of("maintenance_requests"), one.suggestions);
    }

    @Test
    void subVerticalFollowsIndustry() {
        CertaintyLedger ledger = updater.update(CertaintyLedger.empty(), "I run a home cleaning business", null);

        assertEquals("cleaning", ledger.industry().value());
        assertEquals(0.8, ledger.industry().confidence(), 1e-9);
        assertEquals(SlotSource.EXPLICIT, ledger.industry().source());
        assertEquals("residential", ledger.subVertical().value());
        assertEquals(List.of(SlotId.PRIMARY_ENTITIES), ledger.gaps);
    }

    @Test
    void teamSizeAndUnitScale() {
        CertaintyLedger ledger = updater.update(CertaintyLedger.empty(), "I run a small team of 5 employees", null);

        assertEquals(TeamSize.SMALL, ledger.teamSize().value());
        assertEquals(0.85, ledger.teamSize().confidence(), 1e-9);
        assertEquals("5 employees", ledger.scale().value());
        assertEquals(0.9, ledger.scale().confidence(), 1e-9);
        assertEquals(SlotSource.EXPLICIT, ledger.scale().source());

        CertaintyLedger solo = updater.update(CertaintyLedger.empty(), "it is just me", null);
        assertEquals(TeamSize.SOLO, solo.teamSize().value());
        assertEquals(SlotSource.EXPLICIT, solo.teamSize().source());
    }

    @Test
    void customerFacingSignals() {
        CertaintyLedger facing = updater.update(CertaintyLedger.empty(), "clients book appointments online", null);
        CertaintyLedger internal = updater.update(CertaintyLedger.empty(), "this is an internal tool", null);

        assertEquals(Boolean.TRUE, facing.customerFacing().value());
        assertEquals(Boolean.FALSE, internal.customerFacing().value());
        assertTrue(internal.customerFacing().isPresent());
    }

    @Test
    void nullUtteranceChangesNothing() {
        CertaintyLedger ledger = updater.update(CertaintyLedger.empty(), null, null);

        assertEquals(CertaintyLedger.empty().gaps, ledger.gaps);
        assertEquals(0.0, ledger.overallReadiness, 1e-9);
    }

    @Test
    void requiresLedger() {
        assertThrows(NullPointerException.class, () -> updater.update(null, "hi", null));
    }
}
