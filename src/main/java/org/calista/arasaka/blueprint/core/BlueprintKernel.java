package org.calista.arasaka.blueprint.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.blueprint.events.TurnJournal;
import org.calista.arasaka.blueprint.intent.InputParser;
import org.calista.arasaka.blueprint.intent.impl.PatternIntentDetector;
import org.calista.arasaka.blueprint.kits.IndustryKitCatalog;
import org.calista.arasaka.blueprint.ledger.LedgerFlow;
import org.calista.arasaka.blueprint.ledger.LedgerUpdater;
import org.calista.arasaka.blueprint.revision.VoiceRevisionEngine;
import org.calista.arasaka.blueprint.tokenizer.impl.LexicalTokenizer;
import org.calista.arasaka.blueprint.workflow.WorkflowInferenceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * BlueprintKernel: instance-owned container wiring the pipeline from one {@link BlueprintConfig}.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config, load kit catalog, wire engines
 *   2) newSession()      -> per-user state (ledger, app context)
 *
 * The engines are stateless and shared by all sessions.
 */
public final class BlueprintKernel {

    private static final Logger log = LoggerFactory.getLogger(BlueprintKernel.class);

    private final ObjectMapper mapper;
    private final BlueprintConfig cfg;
    private final IndustryKitCatalog catalog;
    private final TurnJournal journal;

    private final InputParser parser;
    private final LedgerUpdater ledgerUpdater;
    private final LedgerFlow ledgerFlow;
    private final WorkflowInferenceEngine workflows;
    private final VoiceRevisionEngine revisions;

    private BlueprintKernel(ObjectMapper mapper,
                            BlueprintConfig cfg,
                            IndustryKitCatalog catalog,
                            TurnJournal journal,
                            Supplier<String> workflowIds) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.journal = Objects.requireNonNull(journal, "journal");

        this.parser = new InputParser(new LexicalTokenizer(), new PatternIntentDetector(
                PatternIntentDetector.Config.builder()
                        .fallbackThreshold(cfg.intent.fallbackThreshold)
                        .defaultConfidence(cfg.intent.defaultConfidence)
                        .build()));

        this.ledgerUpdater = new LedgerUpdater(LedgerUpdater.Config.builder()
                .maxSuggestions(cfg.ledger.maxSuggestions)
                .build());

        this.ledgerFlow = new LedgerFlow(LedgerFlow.Config.builder()
                .maxQuestions(cfg.ledger.maxQuestions)
                .minIndustryConfidence(cfg.ledger.minIndustryConfidence)
                .build());

        WorkflowInferenceEngine.Config.Builder wb = WorkflowInferenceEngine.Config.builder()
                .minPatternScore(cfg.workflow.minPatternScore)
                .causalConfidence(cfg.workflow.causalConfidence);
        if (workflowIds != null) wb.idSupplier(workflowIds);
        this.workflows = new WorkflowInferenceEngine(wb.build());

        this.revisions = new VoiceRevisionEngine(parser, VoiceRevisionEngine.Config.builder()
                .maxListedChanges(cfg.revision.maxListedChanges)
                .build());
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Path configRoot = Path.of(".");
        private ObjectMapper mapper;
        private IndustryKitCatalog catalog;
        private TurnJournal journal;
        private Supplier<String> workflowIds;

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Overrides the classpath catalog named in the config. */
        public Builder catalog(IndustryKitCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        /** Overrides the journal named in the config. */
        public Builder journal(TurnJournal journal) {
            this.journal = Objects.requireNonNull(journal, "journal");
            return this;
        }

        /** Ids of causal workflows; the engine default is random. */
        public Builder workflowIds(Supplier<String> workflowIds) {
            this.workflowIds = Objects.requireNonNull(workflowIds, "workflowIds");
            return this;
        }

        /**
         * Loads (or creates) the config file and wires the pipeline.
         */
        public BlueprintKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");
            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            BlueprintConfig cfg = BlueprintConfig.loadOrCreate(cfgPath, om);

            BlueprintKernel k = build(cfg, om);
            log.info("BlueprintKernel created: config={}, kits={}, journal={}",
                    cfgPath, k.catalog.size(), k.journal.isEnabled() ? k.journal.file() : "<disabled>");
            return k;
        }

        /**
         * Wires the pipeline from an in-memory config; touches no file unless the journal writes.
         */
        public BlueprintKernel build(BlueprintConfig config) {
            return build(config, (this.mapper != null) ? this.mapper : defaultMapper());
        }

        private BlueprintKernel build(BlueprintConfig config, ObjectMapper om) {
            Objects.requireNonNull(config, "config");
            config.validate();

            IndustryKitCatalog kits = (this.catalog != null)
                    ? this.catalog
                    : IndustryKitCatalog.fromClasspath(config.kits.resource, om);

            TurnJournal j = (this.journal != null)
                    ? this.journal
                    : new TurnJournal(om, configRoot.resolve(config.journal.file), config.journal.enabled);

            return new BlueprintKernel(om, config, kits, j, workflowIds);
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    public BlueprintSession newSession() {
        return new BlueprintSession(this, "sess-" + Long.toHexString(System.nanoTime()));
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public ObjectMapper mapper() { return mapper; }
    public BlueprintConfig config() { return cfg; }
    public IndustryKitCatalog catalog() { return catalog; }
    public TurnJournal journal() { return journal; }
    public InputParser parser() { return parser; }
    public LedgerUpdater ledgerUpdater() { return ledgerUpdater; }
    public LedgerFlow ledgerFlow() { return ledgerFlow; }
    public WorkflowInferenceEngine workflowEngine() { return workflows; }
    public VoiceRevisionEngine revisionEngine() { return revisions; }
}
