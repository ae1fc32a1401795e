package org.calista.arasaka.blueprint.intent;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InputParserTest {

    private final InputParser parser = new InputParser();

    @Test
    void tracksEntitiesAsActionsAndNouns() {
        ParsedInput p = parser.parse("I want to track my jobs");

        assertEquals(IntentType.ADD_ENTITY, p.intent);
        assertEquals(0.8, p.confidence, 1e-9);
        assertEquals(List.of("track"), p.actions);
        assertTrue(p.nouns.contains("job"));
        assertTrue(p.has(SemanticIntent.TRACKING));
        assertEquals("i want to track my jobs", p.normalized);
        assertEquals("I want to track my jobs", p.original);
    }

    @Test
    void semanticIntentsAreMultiLabel() {
        ParsedInput p = parser.parse("Send an invoice when the job is done");

        assertEquals(EnumSet.of(SemanticIntent.COMMUNICATING, SemanticIntent.BILLING), p.intents);
    }

    @Test
    void automationNeedsWhenThen() {
        assertTrue(InputParser.detectSemanticIntents("when a job closes then email the client")
                .contains(SemanticIntent.AUTOMATING));
        assertTrue(InputParser.detectSemanticIntents("").isEmpty());
        assertTrue(InputParser.detectSemanticIntents(null).isEmpty());
    }

    @Test
    @DisplayName("named entities are scanned on the original text, rule by rule")
    void namedEntities() {
        String text = "call John Smith on 12/25/2024 at 3:30 pm for $1,500.00";
        List<NamedEntity> entities = parser.parse(text).namedEntities;

        assertEquals(4, entities.size());

        assertEquals(NamedEntity.Type.MONEY, entities.get(0).type());
        assertEquals("$1,500.00", entities.get(0).text());

        assertEquals(NamedEntity.Type.DATE, entities.get(1).type());
        assertEquals("12/25/2024", entities.get(1).text());

        assertEquals(NamedEntity.Type.TIME, entities.get(2).type());
        assertEquals("3:30 pm", entities.get(2).text());

        NamedEntity person = entities.get(3);
        assertEquals(NamedEntity.Type.PERSON, person.type());
        assertEquals("John Smith", person.text());
        assertEquals(5, person.start());
        assertEquals(15, person.end());
        assertEquals("John Smith", text.substring(person.start(), person.end()));
        assertEquals(0.8, person.confidence(), 1e-9);
    }

    @Test
    void quantityEntity() {
        List<NamedEntity> entities = InputParser.extractNamedEntities("remind me 3 days before");

        assertEquals(1, entities.size());
        assertEquals(NamedEntity.Type.QUANTITY, entities.get(0).type());
        assertEquals("3 days", entities.get(0).text());
    }

    @Test
    void modifiersCarryTheFollowingWord() {
        List<Modifier> mods = parser.parse("show all open jobs today").modifiers;

        assertEquals(3, mods.size());
        assertEquals(new Modifier("all", Modifier.Type.QUANTITY, "open"), mods.get(0));
        assertEquals(new Modifier("open", Modifier.Type.STATUS, "jobs"), mods.get(1));
        assertEquals(new Modifier("today", Modifier.Type.TIME, null), mods.get(2));
        assertFalse(mods.get(2).hasTarget());
    }

    @Test
    void styleWordsBecomeAdjectivesAndModifiers() {
        ParsedInput p = parser.parse("Make it more modern");

        assertEquals(IntentType.CHANGE_DESIGN, p.intent);
        assertEquals(List.of("modern"), p.adjectives);
        assertEquals(List.of(new Modifier("modern", Modifier.Type.STYLE, null)), p.modifiers);
    }

    @Test
    void phrasesAreRunsOfSalientWords() {
        assertEquals(List.of("send invoice reminders"), parser.parse("send invoice reminders").phrases);
        assertTrue(parser.parse("track it").phrases.isEmpty());
    }

    @Test
    void nullInputIsUnknown() {
        ParsedInput p = parser.parse(null);

        assertEquals(IntentType.UNKNOWN, p.intent);
        assertEquals(0.0, p.confidence, 1e-9);
        assertEquals("", p.original);
        assertTrue(p.tokens.isEmpty());
        assertTrue(p.intents.isEmpty());
        assertTrue(p.namedEntities.isEmpty());
    }
}
