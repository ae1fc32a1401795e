package org.calista.arasaka.blueprint.tokenizer;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse part-of-speech tags assigned by the lexical analyzer.
 */
public enum PartOfSpeech {
    NOUN("noun"),
    VERB("verb"),
    ADJECTIVE("adjective"),
    ADVERB("adverb"),
    PREPOSITION("preposition"),
    CONJUNCTION("conjunction"),
    DETERMINER("determiner"),
    PRONOUN("pronoun"),
    NUMBER("number"),
    PUNCTUATION("punctuation"),
    UNKNOWN("unknown");

    private final String label;

    PartOfSpeech(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
