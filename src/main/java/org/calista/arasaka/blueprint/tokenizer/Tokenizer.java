package org.calista.arasaka.blueprint.tokenizer;

import java.util.List;

public interface Tokenizer {

    /**
     * Canonical form of an utterance. Must be idempotent.
     */
    String normalize(String text);

    /**
     * Splits an already normalized utterance into tagged tokens.
     */
    List<Token> tokenize(String normalizedText);
}
