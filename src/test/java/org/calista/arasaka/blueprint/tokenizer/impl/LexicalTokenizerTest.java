package org.calista.arasaka.blueprint.tokenizer.impl;

import org.calista.arasaka.blueprint.tokenizer.PartOfSpeech;
import org.calista.arasaka.blueprint.tokenizer.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexicalTokenizerTest {

    private final LexicalTokenizer tokenizer = new LexicalTokenizer();

    @Test
    @DisplayName("normalize lowercases, collapses whitespace and trims")
    void normalizeCollapsesWhitespace() {
        assertEquals("hello, world!!", tokenizer.normalize("  Hello,   WORLD!! "));
    }

    @Test
    @DisplayName("normalize straightens curly quotes and drops unsafe symbols")
    void normalizeQuotesAndSymbols() {
        assertEquals("\"book\" it's", tokenizer.normalize("“Book” it’s"));
        assertEquals("email me home now", tokenizer.normalize("Email me @ home #now"));
        assertEquals("$200 per job", tokenizer.normalize("$200 per job"));
    }

    @Test
    void normalizeIsIdempotent() {
        String once = tokenizer.normalize("  Track  my JOBS & invoices @ 5pm!! ");
        assertEquals(once, tokenizer.normalize(once));
    }

    @Test
    void normalizeHandlesNullAndEmpty() {
        assertEquals("", tokenizer.normalize(null));
        assertEquals("", tokenizer.normalize(""));
        assertTrue(tokenizer.tokenize("   ").isEmpty());
    }

    @Test
    @DisplayName("lemmatizer strips suffixes in rule order")
    void lemmatizeSuffixes() {
        assertEquals("company", LexicalTokenizer.lemmatize("companies"));
        assertEquals("job", LexicalTokenizer.lemmatize("jobs"));
        assertEquals("class", LexicalTokenizer.lemmatize("class"));
        assertEquals("invoice", LexicalTokenizer.lemmatize("invoicing"));
        assertEquals("paint", LexicalTokenizer.lemmatize("painting"));
        assertEquals("build", LexicalTokenizer.lemmatize("built"));
        assertEquals("send", LexicalTokenizer.lemmatize("Sent"));
    }

    @Test
    void tokenizeTagsPartsOfSpeech() {
        List<Token> tokens = tokenizer.tokenize("i want to track my jobs");

        assertEquals(6, tokens.size());
        assertEquals(PartOfSpeech.PRONOUN, tokens.get(0).partOfSpeech());
        assertEquals(PartOfSpeech.PREPOSITION, tokens.get(2).partOfSpeech());

        Token track = tokens.get(3);
        assertEquals("track", track.lemma());
        assertEquals(PartOfSpeech.VERB, track.partOfSpeech());
        assertEquals(3, track.positionIndex());
        assertEquals(0.9, track.importance(), 1e-9);

        Token jobs = tokens.get(5);
        assertEquals("job", jobs.lemma());
        assertTrue(jobs.is(PartOfSpeech.NOUN));

        assertEquals(0.1, tokens.get(2).importance(), 1e-9);
    }

    @Test
    void tokenizeRecognisesNumbersAndMoney() {
        List<Token> tokens = tokenizer.tokenize("5 technicians $200");

        assertEquals(PartOfSpeech.NUMBER, tokens.get(0).partOfSpeech());
        assertEquals("technician", tokens.get(1).lemma());
        assertEquals(PartOfSpeech.NUMBER, tokens.get(2).partOfSpeech());
    }

    @Test
    void tokenKeepsPunctuationInText() {
        Token t = tokenizer.tokenize("jobs, quotes").get(0);
        assertEquals("jobs,", t.text());
        assertEquals("job", t.lemma());
    }

    @Test
    void importanceStaysInUnitRange() {
        for (Token t : tokenizer.tokenize("please automatically schedule the professional appointments for everyone")) {
            assertTrue(t.importance() >= 0.0 && t.importance() <= 1.0, t.toString());
        }
    }
}
