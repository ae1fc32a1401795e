package org.calista.arasaka.blueprint.revision.pattern.impl;

import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.ChangeTarget;
import org.calista.arasaka.blueprint.revision.RevisionChange;
import org.calista.arasaka.blueprint.revision.RevisionIntent;
import org.calista.arasaka.blueprint.revision.pattern.RevisionPattern;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.calista.arasaka.blueprint.revision.pattern.RevisionPattern.ci;

/**
 * "add a phone field to client": adds a string field to an existing entity.
 * Only the "add FIELD field to ENTITY" shape produces a change.
 */
public final class ModifyEntityPattern implements RevisionPattern {

    private static final Pattern ADD_FIELD = ci("add\\s+(a\\s+)?(\\w+)\\s+field\\s+to\\s+(\\w+)");

    private static final List<Pattern> PATTERNS = List.of(
            ADD_FIELD,
            ci("(\\w+)\\s+should\\s+have\\s+(a\\s+)?(\\w+)\\s+(field)?"),
            ci("add\\s+(\\w+)\\s+to\\s+the\\s+(\\w+)\\s+(form|entity|model|table)")
    );

    private static final List<String> KEYWORDS = List.of("add field", "should have", "add to");

    @Override
    public RevisionIntent intent() {
        return RevisionIntent.MODIFY_ENTITY;
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
        return match == null ? null : match.group();
    }

    @Override
    public List<RevisionChange> generateChanges(String target, AppContext context, ParsedInput parsed) {
        Matcher m = ADD_FIELD.matcher(target);
        if (!m.find()) return List.of();

        String field = m.group(2);
        String entityName = m.group(3);

        for (AppContext.Entity e : context.entities) {
            if (e.id().equalsIgnoreCase(entityName) || e.name().equalsIgnoreCase(entityName)) {
                return List.of(RevisionChange.add(ChangeTarget.FIELD, e.id() + "." + field,
                        Map.of("id", field, "name", field, "type", "string"),
                        "Add " + field + " field to " + e.name()));
            }
        }
        return List.of();
    }
}
