package org.calista.arasaka.blueprint.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.blueprint.kits.IndustryKitCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * BlueprintConfig: plain Jackson POJO.
 * - defaults live in the fields and match the pipeline constants
 * - loadOrCreate() writes a default file when it is missing or blank
 * - validate() normalizes values in place
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BlueprintConfig {

    private static final Logger log = LoggerFactory.getLogger(BlueprintConfig.class);

    public Intent intent = new Intent();
    public Ledger ledger = new Ledger();
    public Workflow workflow = new Workflow();
    public Revision revision = new Revision();
    public Kits kits = new Kits();
    public Journal journal = new Journal();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Intent {
        public double fallbackThreshold = 0.6;
        public double defaultConfidence = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Ledger {
        public double minIndustryConfidence = 0.7;
        public double minReadiness = 0.6;
        public int maxSuggestions = 5;
        /** Clarifying questions before the build is forced. */
        public int maxQuestions = 3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Workflow {
        public double minPatternScore = 0.15;
        public double causalConfidence = 0.75;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Revision {
        public int maxListedChanges = 3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Kits {
        /** Classpath resource with the industry kits. */
        public String resource = IndustryKitCatalog.DEFAULT_RESOURCE;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Journal {
        public boolean enabled = true;
        public String file = "data/turns.jsonl";
    }

    public static BlueprintConfig defaults() {
        BlueprintConfig c = new BlueprintConfig();
        c.validate();
        return c;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing or blank file is replaced by the defaults, written pretty-printed.
     */
    public static BlueprintConfig loadOrCreate(Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = Files.readString(configFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            BlueprintConfig created = defaults();
            writePretty(configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json.isBlank()) {
            BlueprintConfig created = defaults();
            writePretty(configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        BlueprintConfig cfg = mapper.readValue(json, BlueprintConfig.class);
        if (cfg == null) cfg = new BlueprintConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(Path configFile, ObjectMapper mapper, BlueprintConfig cfg) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(configFile, mapper, cfg);
    }

    private static void writePretty(Path configFile, ObjectMapper mapper, BlueprintConfig cfg) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        Files.writeString(configFile, out + System.lineSeparator(), StandardCharsets.UTF_8);
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (intent == null) intent = new Intent();
        intent.fallbackThreshold = unit(intent.fallbackThreshold, 0.6);
        intent.defaultConfidence = unit(intent.defaultConfidence, 0.5);

        if (ledger == null) ledger = new Ledger();
        ledger.minIndustryConfidence = unit(ledger.minIndustryConfidence, 0.7);
        ledger.minReadiness = unit(ledger.minReadiness, 0.6);
        if (ledger.maxSuggestions < 0) ledger.maxSuggestions = 5;
        if (ledger.maxQuestions < 0) ledger.maxQuestions = 3;

        if (workflow == null) workflow = new Workflow();
        workflow.minPatternScore = unit(workflow.minPatternScore, 0.15);
        workflow.causalConfidence = unit(workflow.causalConfidence, 0.75);

        if (revision == null) revision = new Revision();
        if (revision.maxListedChanges < 1) revision.maxListedChanges = 3;

        if (kits == null) kits = new Kits();
        if (kits.resource == null || kits.resource.isBlank()) kits.resource = IndustryKitCatalog.DEFAULT_RESOURCE;

        if (journal == null) journal = new Journal();
        if (journal.file == null || journal.file.isBlank()) journal.file = "data/turns.jsonl";
    }

    private static double unit(double v, double def) {
        if (!Double.isFinite(v)) return def;
        if (v < 0.0) return 0.0;
        if (v > 1.0) return 1.0;
        return v;
    }
}
