package org.calista.arasaka.blueprint.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CertaintyLedgerTest {

    private static final List<String> EVIDENCE = List.of("test");

    @Test
    @DisplayName("empty ledger lacks both critical slots and has no readiness")
    void emptyLedger() {
        CertaintyLedger ledger = CertaintyLedger.empty();

        assertEquals(List.of(SlotId.INDUSTRY, SlotId.PRIMARY_ENTITIES), ledger.gaps);
        assertEquals(List.of("industry", "primaryEntities"), ledger.gapNames());
        assertEquals(0.0, ledger.overallReadiness, 1e-9);
        assertFalse(ledger.isReadyToBuild());
        assertTrue(ledger.suggestions.isEmpty());
        assertEquals(List.of(), ledger.primaryEntities().value());
        assertEquals(SlotSource.DEFAULT, ledger.industry().source());
    }

    @Test
    void confidenceIsClamped() {
        CertaintyLedger high = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "plumber", 1.5, SlotSource.EXPLICIT, EVIDENCE);
        CertaintyLedger low = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "plumber", -0.2, SlotSource.EXPLICIT, EVIDENCE);
        CertaintyLedger nan = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "plumber", Double.NaN, SlotSource.EXPLICIT, EVIDENCE);

        assertEquals(1.0, high.industry().confidence(), 1e-9);
        assertEquals(0.0, low.industry().confidence(), 1e-9);
        assertEquals(0.0, nan.industry().confidence(), 1e-9);
    }

    @Test
    void updatesDoNotTouchThePreviousLedger() {
        CertaintyLedger before = CertaintyLedger.empty();
        CertaintyLedger after = before.withSlot(SlotId.INDUSTRY, "plumber", 0.9, SlotSource.EXPLICIT, EVIDENCE);

        assertNull(before.industry().value());
        assertEquals("plumber", after.industry().value());
        assertEquals(List.of("test"), after.industry().evidence());
        assertEquals(List.of(SlotId.PRIMARY_ENTITIES), after.gaps);
    }

    @Test
    void rejectsValuesOfTheWrongType() {
        CertaintyLedger ledger = CertaintyLedger.empty();

        assertThrows(IllegalArgumentException.class,
                () -> ledger.withSlot(SlotId.INDUSTRY, List.of("plumber"), 0.9, SlotSource.EXPLICIT, EVIDENCE));
        assertThrows(IllegalArgumentException.class,
                () -> ledger.withSlot(SlotId.PRIMARY_ENTITIES, List.of(1, 2), 0.9, SlotSource.EXPLICIT, EVIDENCE));
        assertThrows(IllegalArgumentException.class,
                () -> ledger.withSlot(SlotId.TEAM_SIZE, "small", 0.9, SlotSource.EXPLICIT, EVIDENCE));
    }

    @Test
    void scaleAcceptsLabelsAndNumbers() {
        CertaintyLedger labelled = CertaintyLedger.empty()
                .withSlot(SlotId.SCALE, "12 properties", 0.9, SlotSource.EXPLICIT, EVIDENCE);
        CertaintyLedger bare = CertaintyLedger.empty()
                .withSlot(SlotId.SCALE, 5, 0.5, SlotSource.INFERRED, EVIDENCE);

        assertEquals("12 properties", labelled.scale().value());
        assertEquals(5, bare.scale().value());
    }

    @Test
    @DisplayName("readiness grows as a refinement slot gains confidence")
    void readinessIsMonotonic() {
        CertaintyLedger base = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "plumber", 0.7, SlotSource.INFERRED, EVIDENCE);

        double r0 = base.overallReadiness;
        double r1 = base.withSlot(SlotId.SCALE, 5, 0.2, SlotSource.INFERRED, EVIDENCE).overallReadiness;
        double r2 = base.withSlot(SlotId.SCALE, 5, 0.8, SlotSource.INFERRED, EVIDENCE).overallReadiness;

        assertEquals(0.245, r0, 1e-9);
        assertTrue(r1 > r0);
        assertTrue(r2 > r1);
    }

    @Test
    void emptyEntityListBlocksBuild() {
        CertaintyLedger ledger = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "plumber", 0.95, SlotSource.EXPLICIT, EVIDENCE)
                .withSlot(SlotId.PRIMARY_ENTITIES, List.of(), 1.0, SlotSource.EXPLICIT, EVIDENCE)
                .withSlot(SlotId.SCALE, "5 employees", 1.0, SlotSource.EXPLICIT, EVIDENCE)
                .withSlot(SlotId.TEAM_SIZE, TeamSize.SMALL, 1.0, SlotSource.EXPLICIT, EVIDENCE)
                .withSlot(SlotId.INTEGRATIONS, List.of("stripe"), 1.0, SlotSource.EXPLICIT, EVIDENCE)
                .withSlot(SlotId.COMPLEXITY, Complexity.SIMPLE, 1.0, SlotSource.EXPLICIT, EVIDENCE);

        assertTrue(ledger.gaps.contains(SlotId.PRIMARY_ENTITIES));
        assertFalse(ledger.isReadyToBuild());
    }

    @Test
    void readyWhenAllGatesPass() {
        CertaintyLedger ledger = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "plumber", 0.9, SlotSource.EXPLICIT, EVIDENCE)
                .withSlot(SlotId.PRIMARY_ENTITIES, List.of("Job"), 0.9, SlotSource.EXPLICIT, EVIDENCE);

        assertEquals(0.63, ledger.overallReadiness, 1e-9);
        assertTrue(ledger.gaps.isEmpty());
        assertTrue(ledger.isReadyToBuild());
        assertFalse(ledger.isReadyToBuild(0.95, 0.6));
        assertFalse(ledger.isReadyToBuild(0.7, 0.7));
    }

    @Test
    void industryWithSubVerticalsAddsAGap() {
        CertaintyLedger ledger = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "cleaning", 0.7, SlotSource.INFERRED, EVIDENCE);

        assertEquals(List.of(SlotId.PRIMARY_ENTITIES, SlotId.SUB_VERTICAL), ledger.gaps);

        CertaintyLedger answered = ledger.withSlot(SlotId.SUB_VERTICAL, "residential", 0.8, SlotSource.INFERRED, EVIDENCE);
        assertEquals(List.of(SlotId.PRIMARY_ENTITIES), answered.gaps);
    }

    @Test
    void lowConfidenceCriticalSlotIsStillAGap() {
        CertaintyLedger ledger = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "plumber", 0.4, SlotSource.INFERRED, EVIDENCE);

        assertEquals(List.of(SlotId.INDUSTRY, SlotId.PRIMARY_ENTITIES), ledger.gaps);
    }

    @Test
    void presenceRules() {
        assertTrue(new SlotValue<>(Boolean.FALSE, 0.85, SlotSource.INFERRED, null).isPresent());
        assertFalse(new SlotValue<>(0, 0.5, SlotSource.INFERRED, null).isPresent());
        assertFalse(new SlotValue<>("", 0.5, SlotSource.INFERRED, null).isPresent());
        assertFalse(new SlotValue<>(List.of(), 0.5, SlotSource.INFERRED, null).isPresent());
        assertTrue(new SlotValue<>(List.of("Job"), 0.5, SlotSource.INFERRED, null).isPresent());
    }

    @Test
    void slotKeysRoundTrip() {
        for (SlotId id : SlotId.values()) {
            assertEquals(id, SlotId.fromKey(id.key()));
        }
        assertThrows(IllegalArgumentException.class, () -> SlotId.fromKey("budget"));
    }
}
