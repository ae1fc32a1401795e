package org.calista.arasaka.blueprint.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSON-lines log of console turns. A disabled journal accepts and drops events.
 */
public final class TurnJournal {

    private static final Logger log = LogManager.getLogger(TurnJournal.class);

    private final ObjectMapper mapper;
    private final Path file;
    private final boolean enabled;

    public TurnJournal(ObjectMapper mapper, Path file, boolean enabled) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
        this.enabled = enabled;
    }

    public static TurnJournal disabled(ObjectMapper mapper) {
        return new TurnJournal(mapper, Path.of("turns.jsonl"), false);
    }

    public Path file() {
        return file;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public synchronized void append(TurnEvent e) throws IOException {
        if (!enabled) return;
        Objects.requireNonNull(e, "event");

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        String line = mapper.writeValueAsString(e);
        Files.writeString(file, line + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    /**
     * Reads every event back; blank lines are skipped, a missing file reads as empty.
     */
    public List<TurnEvent> readAll() throws IOException {
        if (!Files.exists(file)) return List.of();

        List<TurnEvent> out = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) continue;
            out.add(mapper.readValue(line, TurnEvent.class));
        }
        if (log.isDebugEnabled()) log.debug("journal read file={} events={}", file, out.size());
        return out;
    }
}
