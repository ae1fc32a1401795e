package org.calista.arasaka.blueprint.events;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TurnJournalTest {

    @TempDir Path temp;

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void appendsAndReadsBack() throws Exception {
        TurnJournal journal = new TurnJournal(om, temp.resolve("data/turns.jsonl"), true);

        journal.append(TurnEvent.of("USER", "sess-1", "we do plumbing", 1000L));
        journal.append(TurnEvent.of("SUMMARY", "sess-1", "{\"kit\":\"plumber\"}", 1001L));

        List<TurnEvent> events = journal.readAll();
        assertEquals(2, events.size());
        assertEquals("USER", events.get(0).type);
        assertEquals("we do plumbing", events.get(0).text);
        assertEquals(1000L, events.get(0).tsEpochMs);
        assertEquals("{\"kit\":\"plumber\"}", events.get(1).text);
        assertEquals(2, Files.readAllLines(journal.file()).size());
    }

    @Test
    void disabledJournalWritesNothing() throws Exception {
        Path file = temp.resolve("turns.jsonl");
        TurnJournal journal = new TurnJournal(om, file, false);

        journal.append(TurnEvent.of("USER", "sess-1", "hello", 1L));

        assertFalse(journal.isEnabled());
        assertFalse(Files.exists(file));
        assertTrue(journal.readAll().isEmpty());
    }

    @Test
    void blankLinesAreSkipped() throws Exception {
        Path file = temp.resolve("turns.jsonl");
        Files.writeString(file, "{\"type\":\"USER\",\"sessionId\":\"s\",\"text\":\"a\",\"tsEpochMs\":1,\"extra\":true}\n\n");

        List<TurnEvent> events = new TurnJournal(om, file, true).readAll();

        assertEquals(1, events.size());
        assertEquals("a", events.get(0).text);
    }
}
