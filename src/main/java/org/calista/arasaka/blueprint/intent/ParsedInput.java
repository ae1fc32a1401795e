package org.calista.arasaka.blueprint.intent;

import org.calista.arasaka.blueprint.tokenizer.Token;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structured reading of one utterance. Immutable; all collections are read-only.
 */
public final class ParsedInput {

    public final String original;
    public final String normalized;
    public final IntentType intent;
    public final double confidence;
    public final List<Token> tokens;
    /** Lemmas of verb tokens that are known action verbs. */
    public final List<String> actions;
    public final List<String> nouns;
    public final List<String> adjectives;
    public final List<String> phrases;
    public final Set<SemanticIntent> intents;
    public final List<NamedEntity> namedEntities;
    public final List<Modifier> modifiers;

    public ParsedInput(String original,
                       String normalized,
                       IntentMatch intent,
                       List<Token> tokens,
                       List<String> actions,
                       List<String> nouns,
                       List<String> adjectives,
                       List<String> phrases,
                       Set<SemanticIntent> intents,
                       List<NamedEntity> namedEntities,
                       List<Modifier> modifiers) {
        this.original = Objects.requireNonNull(original, "original");
        this.normalized = Objects.requireNonNull(normalized, "normalized");
        Objects.requireNonNull(intent, "intent");
        this.intent = intent.type();
        this.confidence = intent.confidence();
        this.tokens = List.copyOf(tokens);
        this.actions = List.copyOf(actions);
        this.nouns = List.copyOf(nouns);
        this.adjectives = List.copyOf(adjectives);
        this.phrases = List.copyOf(phrases);
        this.intents = intents.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(intents));
        this.namedEntities = List.copyOf(namedEntities);
        this.modifiers = List.copyOf(modifiers);
    }

    public boolean has(SemanticIntent s) {
        return intents.contains(s);
    }

    @Override
    public String toString() {
        return "ParsedInput{intent=" + intent.label() + ", conf=" + confidence
                + ", tokens=" + tokens.size() + ", intents=" + intents + "}";
    }
}
