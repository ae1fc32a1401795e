package org.calista.arasaka.blueprint.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Next step of a discovery conversation, decided by {@link LedgerFlow}.
 *
 * @param type    what to do
 * @param gap     slot to ask about; set only for {@link Type#CLARIFY}
 * @param message text for the user; null for {@link Type#CLARIFY}
 */
public record FlowAction(Type type, SlotId gap, String message) {

    public enum Type {
        READY_TO_BUILD,
        CLARIFY,
        /** Question budget spent; build with what is known. */
        FORCE_BUILD;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public FlowAction {
        Objects.requireNonNull(type, "type");
        if (type == Type.CLARIFY) Objects.requireNonNull(gap, "gap");
    }

    public static FlowAction ready(String message) {
        return new FlowAction(Type.READY_TO_BUILD, null, message);
    }

    public static FlowAction clarify(SlotId gap) {
        return new FlowAction(Type.CLARIFY, gap, null);
    }

    public static FlowAction forceBuild(String message) {
        return new FlowAction(Type.FORCE_BUILD, null, message);
    }

    public boolean isBuild() {
        return type != Type.CLARIFY;
    }
}
