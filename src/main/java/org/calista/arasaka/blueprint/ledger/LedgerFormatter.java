package org.calista.arasaka.blueprint.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a ledger as a short bullet list, e.g. for a prompt context or a debug dump.
 */
public final class LedgerFormatter {

    private LedgerFormatter() {}

    public static String asContext(CertaintyLedger ledger) {
        Objects.requireNonNull(ledger, "ledger");
        List<String> lines = new ArrayList<>();

        lines.add(line("Industry", ledger.industry()));
        if (ledger.subVertical().isPresent()) lines.add(line("Sub-vertical", ledger.subVertical()));
        lines.add(line("Primary Entities", ledger.primaryEntities()));
        if (ledger.teamSize().isPresent()) lines.add(line("Team Size", ledger.teamSize()));
        if (ledger.scale().isPresent()) lines.add(line("Scale", ledger.scale()));
        if (ledger.customerFacing().value() != null) lines.add(line("Customer Facing", ledger.customerFacing()));
        if (ledger.integrations().isPresent()) lines.add(line("Integrations", ledger.integrations()));

        return String.join("\n", lines);
    }

    /** {@code false} renders as Unknown, like any other falsy value. */
    static String line(String name, SlotValue<?> slot) {
        if (!slot.isPresent() || Boolean.FALSE.equals(slot.value())) return "- " + name + ": Unknown";
        long pct = Math.round(slot.confidence() * 100);
        return "- " + name + ": " + SlotDecisions.toJson(slot.value()) + " (" + pct + "% confidence, " + slot.source().label() + ")";
    }
}
