package org.calista.arasaka.blueprint.intent;

import java.util.Objects;

/**
 * Qualifier word with an optional target (the surface text of the following token).
 */
public record Modifier(String text, Type type, String target) {

    public enum Type {
        QUANTITY, FREQUENCY, PRIORITY, STATUS, TIME, STYLE, SIZE
    }

    public Modifier {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
    }

    public boolean hasTarget() {
        return target != null;
    }
}
