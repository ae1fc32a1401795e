package org.calista.arasaka.blueprint.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SlotDecisionsTest {

    private static SlotValue<String> slot(double confidence, SlotSource source) {
        return new SlotValue<>("x", confidence, source, List.of());
    }

    @Test
    void decisionThresholds() {
        assertEquals(SlotDecision.ASSUME, SlotDecisions.decide(slot(0.95, SlotSource.EXPLICIT), SlotId.INDUSTRY));
        assertEquals(SlotDecision.ASSUME, SlotDecisions.decide(slot(0.8, SlotSource.INFERRED), SlotId.INDUSTRY));
        assertEquals(SlotDecision.CONFIRM, SlotDecisions.decide(slot(0.6, SlotSource.INFERRED), SlotId.INDUSTRY));
        assertEquals(SlotDecision.ASK, SlotDecisions.decide(slot(0.4, SlotSource.INFERRED), SlotId.INDUSTRY));
        assertEquals(SlotDecision.ASK, SlotDecisions.decide(slot(0.1, SlotSource.INFERRED), SlotId.SUB_VERTICAL));

        assertEquals(SlotDecision.ASSUME, SlotDecisions.decide(slot(0.4, SlotSource.INFERRED), SlotId.SCALE));
        assertEquals(SlotDecision.SKIP, SlotDecisions.decide(slot(0.1, SlotSource.INFERRED), SlotId.SCALE));
    }

    @Test
    void summaryOfEmptyLedgerAsksForIndustryAndSubVertical() {
        SlotDecisions.Summary summary = SlotDecisions.summarize(CertaintyLedger.empty());

        assertEquals(List.of(SlotId.INDUSTRY, SlotId.SUB_VERTICAL), summary.toAsk);
        assertTrue(summary.assumed.isEmpty());
        assertTrue(summary.toConfirm.isEmpty());
        assertEquals(SlotId.values().length - 2, summary.skipped.size());
        assertFalse(summary.canProceed);
    }

    @Test
    void summaryCanProceedOnceNothingIsAsked() {
        CertaintyLedger ledger = CertaintyLedger.empty()
                .withSlot(SlotId.INDUSTRY, "plumber", 0.7, SlotSource.INFERRED, List.of())
                .withSlot(SlotId.SUB_VERTICAL, "residential", 0.8, SlotSource.INFERRED, List.of());

        SlotDecisions.Summary summary = SlotDecisions.summarize(ledger);

        assertEquals(List.of(SlotId.INDUSTRY), summary.toConfirm);
        assertEquals(List.of(SlotId.SUB_VERTICAL), summary.assumed);
        assertTrue(summary.canProceed);
    }

    @Test
    void subVerticalOptions() {
        assertTrue(SlotDecisions.hasSubVerticals("cleaning"));
        assertFalse(SlotDecisions.hasSubVerticals("plumber"));
        assertFalse(SlotDecisions.hasSubVerticals(null));

        List<SlotDecisions.Option> options = SlotDecisions.subVerticalOptions("cleaning");
        assertEquals(3, options.size());
        assertEquals("residential", options.get(0).value());
        assertEquals("Home cleaning", options.get(0).label());
        assertTrue(SlotDecisions.subVerticalOptions("plumber").isEmpty());
    }

    @Test
    void formatsDiagnosticLine() {
        SlotValue<String> industry = new SlotValue<>("plumber", 0.7, SlotSource.INFERRED, List.of());
        assertEquals("industry: confirm (\"plumber\", 70% confidence, inferred)",
                SlotDecisions.format(SlotId.INDUSTRY, industry, SlotDecision.CONFIRM));

        SlotValue<TeamSize> team = new SlotValue<>(TeamSize.SMALL, 0.85, SlotSource.INFERRED, List.of());
        assertEquals("teamSize: assume (\"small\", 85% confidence, inferred)",
                SlotDecisions.format(SlotId.TEAM_SIZE, team, SlotDecision.ASSUME));

        assertEquals("scale: skip (null, 0% confidence, default)",
                SlotDecisions.format(SlotId.SCALE, SlotValue.empty(), SlotDecision.SKIP));
    }
}
