package org.calista.arasaka.blueprint.revision.pattern.impl;

import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.ChangeTarget;
import org.calista.arasaka.blueprint.revision.RevisionChange;
import org.calista.arasaka.blueprint.revision.RevisionIntent;
import org.calista.arasaka.blueprint.revision.pattern.RevisionPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.calista.arasaka.blueprint.revision.pattern.RevisionPattern.ci;

/**
 * "add invoicing": expands a feature keyword into the entities, pages and workflows it needs.
 */
public final class AddFeaturePattern implements RevisionPattern {

    static final String FEATURES = "(invoicing|calendar|scheduling|messaging|payments?|dashboard|reports?|inventory)";

    private static final List<Pattern> PATTERNS = List.of(
            ci("add\\s+(a\\s+)?" + FEATURES),
            ci("include\\s+(a\\s+)?" + FEATURES),
            ci("i\\s+(want|need)\\s+(to\\s+)?(add\\s+)?" + FEATURES),
            ci("enable\\s+" + FEATURES)
    );

    private static final List<String> KEYWORDS = List.of(
            "add", "include", "enable", "invoicing", "calendar", "scheduling", "messaging",
            "payments", "dashboard", "reports", "inventory");

    // plural forms first so "payments" is not reported as "payment"
    private static final List<String> TARGETS = List.of(
            "invoicing", "calendar", "scheduling", "messaging", "payments", "payment",
            "dashboard", "reports", "report", "inventory");

    record Bundle(List<String> entities, List<String> pages, List<String> workflows) {}

    static final Map<String, Bundle> BUNDLES = Map.of(
            "invoicing", new Bundle(List.of("invoice"), List.of("invoices", "invoice-form", "invoice-detail"),
                    List.of("create-invoice", "send-invoice")),
            "calendar", new Bundle(List.of("event"), List.of("calendar"), List.of()),
            "scheduling", new Bundle(List.of("appointment"), List.of("appointments", "booking-form"),
                    List.of("book-appointment", "send-reminder")),
            "messaging", new Bundle(List.of("message"), List.of("messages"), List.of("send-message")),
            "payments", new Bundle(List.of("payment"), List.of("payments"), List.of("record-payment")),
            "payment", new Bundle(List.of("payment"), List.of("payments"), List.of("record-payment")),
            "dashboard", new Bundle(List.of(), List.of("dashboard"), List.of()),
            "reports", new Bundle(List.of(), List.of("reports"), List.of()),
            "report", new Bundle(List.of(), List.of("reports"), List.of()),
            "inventory", new Bundle(List.of("material", "product"), List.of("inventory"), List.of("update-stock"))
    );

    @Override
    public RevisionIntent intent() {
        return RevisionIntent.ADD_FEATURE;
    }

    @Override
    public List<Pattern> patterns() {
        return PATTERNS;
    }

    @Override
    public List<String> keywords() {
        return KEYWORDS;
    }

    @Override
    public String extractTarget(String text, Matcher match) {
        return RevisionPattern.firstContained(text, TARGETS);
    }

    @Override
    public List<RevisionChange> generateChanges(String target, AppContext context, ParsedInput parsed) {
        Bundle b = BUNDLES.get(target.toLowerCase(Locale.ROOT));
        if (b == null) return List.of();

        List<RevisionChange> out = new ArrayList<>();
        for (String id : b.entities()) {
            out.add(RevisionChange.add(ChangeTarget.ENTITY, id, Map.of("id", id),
                    "Add " + id + " entity for " + target));
        }
        for (String id : b.pages()) {
            out.add(RevisionChange.add(ChangeTarget.PAGE, id, Map.of("id", id),
                    "Add " + id + " page for " + target));
        }
        for (String id : b.workflows()) {
            out.add(RevisionChange.add(ChangeTarget.WORKFLOW, id, Map.of("id", id),
                    "Add " + id + " workflow for " + target));
        }
        return out;
    }
}
