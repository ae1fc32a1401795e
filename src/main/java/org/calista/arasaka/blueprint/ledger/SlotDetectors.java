package org.calista.arasaka.blueprint.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight keyword detectors feeding {@link LedgerUpdater}. All inputs are lowercased utterances.
 * Rule tables are evaluated top to bottom; the order is part of the behavior.
 */
final class SlotDetectors {

    private SlotDetectors() {}

    record Detection<T>(T value, double confidence, SlotSource source) {}

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static boolean any(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    // -------------------- Industry --------------------

    private record IndustryRule(String id, List<Pattern> patterns, double weight) {
        static IndustryRule of(String id, double weight, String... regexes) {
            List<Pattern> ps = new ArrayList<>(regexes.length);
            for (String r : regexes) ps.add(ci(r));
            return new IndustryRule(id, List.copyOf(ps), weight);
        }
    }

    private static final List<IndustryRule> INDUSTRIES = List.of(
            IndustryRule.of("property-management", 2,
                    "property\\s*management", "landlord", "\\btenant", "\\blease", "rent\\s*collection",
                    "rental\\s*property", "apartment\\s*manager"),
            IndustryRule.of("real-estate", 1.5, "real\\s*estate", "realtor", "\\blisting", "\\bbroker", "home\\s*sale"),
            IndustryRule.of("gym", 2, "\\bgym\\b", "fitness\\s*studio", "\\bmembership", "fitness\\s*class", "workout\\s*class"),
            IndustryRule.of("fitness-coach", 2, "personal\\s*trainer", "fitness\\s*coach", "1-on-1\\s*training", "workout\\s*coach"),
            IndustryRule.of("plumber", 1, "plumber", "plumbing", "\\bpipe", "\\bleak", "\\bdrain", "water\\s*heater"),
            IndustryRule.of("electrician", 1, "electrician", "electrical", "\\bwiring", "\\bcircuit", "\\bpanel"),
            IndustryRule.of("restaurant", 1, "restaurant", "\\bcafe\\b", "\\bdining", "\\bmenu\\b", "takeout", "reservation"),
            IndustryRule.of("salon", 1, "salon", "beauty", "\\bhair\\b", "\\bspa\\b", "\\bnail", "barber", "stylist"),
            IndustryRule.of("cleaning", 1, "cleaning", "\\bcleaner", "\\bmaid", "housekeeping", "home\\s*cleaning"),
            IndustryRule.of("commercial-cleaning", 2, "commercial\\s*cleaning", "janitorial", "office\\s*cleaning", "facility\\s*cleaning"),
            IndustryRule.of("medical", 1, "medical", "clinic", "doctor", "patient", "health", "dental", "therapy"),
            IndustryRule.of("tutor", 1, "tutor", "tutoring", "\\blesson", "student", "teaching", "education"),
            IndustryRule.of("ecommerce", 1, "\\bshop\\b", "ecommerce", "\\bstore\\b", "online\\s*store", "sell\\s*products"),
            IndustryRule.of("mechanic", 1, "mechanic", "auto\\s*repair", "car\\s*repair", "\\bvehicle", "automotive"),
            IndustryRule.of("contractor", 1, "contractor", "construction", "renovation", "\\bbuilder", "remodel"),
            IndustryRule.of("bakery", 1, "bakery", "\\bbaker", "pastry", "\\bbread", "\\bcake"),
            IndustryRule.of("photographer", 1, "photographer", "photo", "\\bshoot", "photography"),
            IndustryRule.of("landscaping", 1, "landscaping", "\\blawn", "\\bgarden", "\\byard", "lawn\\s*care"),
            IndustryRule.of("hvac", 1, "\\bhvac\\b", "heating", "cooling", "air\\s*conditioning", "furnace"),
            IndustryRule.of("roofing", 1, "roofing", "\\broof\\b", "shingle", "gutter"),
            IndustryRule.of("handyman", 1, "handyman", "home\\s*repair", "odd\\s*jobs"),
            IndustryRule.of("home-health", 1.5, "home\\s*health", "caregiver", "senior\\s*care", "elderly\\s*care", "home\\s*aide")
    );

    /**
     * Sum of rule weight per matching pattern; strictly higher score wins, so ties keep table order.
     * Confidence is {@code min(0.95, 0.6 + score * 0.1)}; a score of 2 or more counts as explicit.
     */
    static Detection<String> industry(String text) {
        String bestId = null;
        double bestScore = 0.0;

        for (IndustryRule r : INDUSTRIES) {
            double score = 0.0;
            for (Pattern p : r.patterns) {
                if (p.matcher(text).find()) score += r.weight;
            }
            if (score > 0.0 && score > bestScore) {
                bestId = r.id;
                bestScore = score;
            }
        }

        if (bestId == null) return null;
        double confidence = Math.min(0.95, 0.6 + bestScore * 0.1);
        return new Detection<>(bestId, confidence, bestScore >= 2 ? SlotSource.EXPLICIT : SlotSource.INFERRED);
    }

    // -------------------- Sub-vertical --------------------

    private record SubVerticalRule(String industry, String subVertical, List<Pattern> patterns) {
        static SubVerticalRule of(String industry, String subVertical, String... regexes) {
            List<Pattern> ps = new ArrayList<>(regexes.length);
            for (String r : regexes) ps.add(ci(r));
            return new SubVerticalRule(industry, subVertical, List.copyOf(ps));
        }
    }

    private static final List<SubVerticalRule> SUB_VERTICALS = List.of(
            SubVerticalRule.of("real-estate", "rentals", "rental", "\\brent", "lease", "tenant"),
            SubVerticalRule.of("real-estate", "sales", "\\bsale", "\\bbuy", "\\bsell", "listing", "commission"),
            SubVerticalRule.of("real-estate", "commercial", "commercial", "office\\s*space", "retail\\s*space"),
            SubVerticalRule.of("fitness-coach", "personal-training", "personal", "1-on-1", "individual"),
            SubVerticalRule.of("fitness-coach", "group-training", "group", "class", "bootcamp"),
            SubVerticalRule.of("fitness-coach", "online", "online", "virtual", "remote"),
            SubVerticalRule.of("cleaning", "residential", "home", "house", "residential", "apartment"),
            SubVerticalRule.of("cleaning", "commercial", "commercial", "office", "business"),
            SubVerticalRule.of("cleaning", "specialized", "deep\\s*clean", "move-out", "post-construction")
    );

    static final double SUB_VERTICAL_CONFIDENCE = 0.8;

    static Detection<String> subVertical(String text, String industry) {
        if (industry == null) return null;
        for (SubVerticalRule r : SUB_VERTICALS) {
            if (r.industry.equals(industry) && any(r.patterns, text)) {
                return new Detection<>(r.subVertical, SUB_VERTICAL_CONFIDENCE, SlotSource.INFERRED);
            }
        }
        return null;
    }

    // -------------------- Team size --------------------

    private record TeamRule(Pattern pattern, TeamSize size, double confidence, SlotSource source) {}

    private static final List<TeamRule> TEAM_RULES = List.of(
            new TeamRule(ci("\\b(solo|myself|just me|one person|freelance|independent)\\b"), TeamSize.SOLO, 0.9, SlotSource.EXPLICIT),
            new TeamRule(ci("\\b(small team|2-5|few people|couple of|partner)\\b"), TeamSize.SMALL, 0.85, SlotSource.INFERRED),
            new TeamRule(ci("\\b(team|staff|employees|crew|workers)\\b"), TeamSize.SMALL, 0.6, SlotSource.INFERRED),
            new TeamRule(ci("\\b(6-20|medium|growing team|department)\\b"), TeamSize.MEDIUM, 0.8, SlotSource.INFERRED),
            new TeamRule(ci("\\b(large|enterprise|20\\+|company-wide|organization)\\b"), TeamSize.LARGE, 0.8, SlotSource.INFERRED)
    );

    static Detection<TeamSize> teamSize(String text) {
        for (TeamRule r : TEAM_RULES) {
            if (r.pattern.matcher(text).find()) return new Detection<>(r.size, r.confidence, r.source);
        }
        return null;
    }

    // -------------------- Scale --------------------

    private record ScaleRule(Pattern pattern, String unit) {}

    // unit words only; "technicians" and the like fall through to the bare number
    private static final List<ScaleRule> SCALE_RULES = List.of(
            new ScaleRule(ci("(\\d+)\\s*(?:units?|properties|apartments)"), "properties"),
            new ScaleRule(ci("(\\d+)\\s*(?:members?|clients?|customers?)"), "clients"),
            new ScaleRule(ci("(\\d+)\\s*(?:employees?|staff|workers)"), "employees"),
            new ScaleRule(ci("(\\d+)\\s*(?:locations?|offices?|branches)"), "locations")
    );

    private static final Pattern BARE_NUMBER = Pattern.compile("\\b(\\d+)\\b");

    private static final int MAX_DIGITS = 9;

    /**
     * Unit-qualified counts ("12 properties") at 0.9, else the first bare number at 0.5.
     * Numbers longer than nine digits are skipped and the search goes on with the next one.
     */
    static Detection<Object> scale(String text) {
        for (ScaleRule r : SCALE_RULES) {
            String n = firstFitting(r.pattern.matcher(text));
            if (n != null) return new Detection<>(Integer.parseInt(n) + " " + r.unit, 0.9, SlotSource.EXPLICIT);
        }

        String n = firstFitting(BARE_NUMBER.matcher(text));
        return n == null ? null : new Detection<>(Integer.parseInt(n), 0.5, SlotSource.INFERRED);
    }

    private static String firstFitting(Matcher m) {
        while (m.find()) {
            if (m.group(1).length() <= MAX_DIGITS) return m.group(1);
        }
        return null;
    }

    // -------------------- Customer facing --------------------

    private static final Pattern CUSTOMER_FACING = ci("\\b(customer portal|client portal|booking|appointments?|reservations?|customer-facing)\\b");
    private static final Pattern INTERNAL = ci("\\b(internal|back-?office|operations|admin only|staff only)\\b");
    private static final Pattern MIXED = ci("\\b(both|hybrid|full|end-to-end)\\b");

    static Detection<Boolean> customerFacing(String text) {
        if (CUSTOMER_FACING.matcher(text).find()) return new Detection<>(Boolean.TRUE, 0.85, SlotSource.INFERRED);
        if (INTERNAL.matcher(text).find()) return new Detection<>(Boolean.FALSE, 0.85, SlotSource.INFERRED);
        if (MIXED.matcher(text).find()) return new Detection<>(Boolean.TRUE, 0.7, SlotSource.INFERRED);
        return null;
    }

    // -------------------- Integrations --------------------

    private static final List<Map.Entry<String, List<String>>> INTEGRATION_KEYWORDS = List.of(
            Map.entry("stripe", List.of("stripe", "payment", "credit card", "charge")),
            Map.entry("twilio", List.of("twilio", "sms", "text message")),
            Map.entry("email", List.of("email", "notification")),
            Map.entry("google-calendar", List.of("calendar", "scheduling", "google calendar")),
            Map.entry("zapier", List.of("zapier", "automation", "integrate"))
    );

    static final double INTEGRATION_CONFIDENCE = 0.85;

    /**
     * Integration ids whose keywords occur as substrings, in table order.
     */
    static List<String> integrations(String text) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : INTEGRATION_KEYWORDS) {
            for (String kw : e.getValue()) {
                if (text.contains(kw)) {
                    out.add(e.getKey());
                    break;
                }
            }
        }
        return out;
    }
}
