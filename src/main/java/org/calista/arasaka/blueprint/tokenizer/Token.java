package org.calista.arasaka.blueprint.tokenizer;

import java.util.Objects;

/**
 * One word of an utterance.
 *
 * @param text          surface text as split from the normalized utterance (punctuation kept)
 * @param lemma         base form used for lexicon lookups
 * @param partOfSpeech  coarse tag
 * @param positionIndex zero-based position in the utterance
 * @param importance    salience in [0,1]
 */
public record Token(String text, String lemma, PartOfSpeech partOfSpeech, int positionIndex, double importance) {

    public Token {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(lemma, "lemma");
        Objects.requireNonNull(partOfSpeech, "partOfSpeech");
    }

    public boolean is(PartOfSpeech pos) {
        return partOfSpeech == pos;
    }
}
