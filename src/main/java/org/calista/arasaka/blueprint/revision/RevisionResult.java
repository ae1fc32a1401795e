package org.calista.arasaka.blueprint.revision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one revision request. {@code confirmationMessage} is set only when confirmation is required.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RevisionResult {

    public final RevisionIntent intent;
    public final double confidence;
    public final List<RevisionChange> changes;
    public final List<String> affectedComponents;
    public final boolean requiresConfirmation;
    public final String confirmationMessage;
    public final boolean rollbackPossible;

    public RevisionResult(RevisionIntent intent,
                          double confidence,
                          List<RevisionChange> changes,
                          boolean requiresConfirmation,
                          String confirmationMessage) {
        this.intent = Objects.requireNonNull(intent, "intent");
        this.confidence = confidence;
        this.changes = List.copyOf(changes);
        this.requiresConfirmation = requiresConfirmation;
        this.confirmationMessage = confirmationMessage;
        this.rollbackPossible = true;

        List<String> ids = new ArrayList<>(this.changes.size());
        for (RevisionChange c : this.changes) ids.add(c.targetId());
        this.affectedComponents = List.copyOf(ids);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public String toString() {
        return "RevisionResult{intent=" + intent.label() + ", conf=" + confidence + ", changes=" + changes.size()
                + ", confirm=" + requiresConfirmation + "}";
    }
}
