package org.calista.arasaka.blueprint.intent;

import org.calista.arasaka.blueprint.tokenizer.Token;

import java.util.List;

public interface IntentDetector {

    /**
     * @param normalizedText output of {@code Tokenizer.normalize}
     * @param tokens         tokens of the same text
     */
    IntentMatch detect(String normalizedText, List<Token> tokens);
}
