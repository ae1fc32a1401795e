package org.calista.arasaka.blueprint.intent;

import java.util.Objects;

public record IntentMatch(IntentType type, double confidence) {

    public IntentMatch {
        Objects.requireNonNull(type, "type");
    }
}
