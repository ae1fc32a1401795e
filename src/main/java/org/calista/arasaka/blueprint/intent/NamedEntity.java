package org.calista.arasaka.blueprint.intent;

import java.util.Objects;

/**
 * Typed span of the original utterance. {@code end} is exclusive.
 */
public record NamedEntity(String text, Type type, int start, int end, double confidence) {

    public enum Type {
        PERSON, ORGANIZATION, LOCATION, DATE, TIME, MONEY, QUANTITY, CUSTOM
    }

    public NamedEntity {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("bad span [" + start + "," + end + ")");
        }
    }
}
