package org.calista.arasaka.blueprint.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.kits.IndustryKit;
import org.calista.arasaka.blueprint.ledger.CertaintyLedger;
import org.calista.arasaka.blueprint.ledger.FlowAction;
import org.calista.arasaka.blueprint.ledger.LedgerFlow;
import org.calista.arasaka.blueprint.ledger.SlotValue;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.RevisionResult;
import org.calista.arasaka.blueprint.workflow.InferredWorkflow;
import org.calista.arasaka.blueprint.workflow.KnownEntity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One conversation: owns its ledger, the industry kit resolved so far and the app being revised.
 * Not thread-safe; give each user their own session.
 *
 * A kit resolved from the industry of turn N is supplied to the ledger from turn N+1 on.
 * Every turn that ends in a clarifying question spends one question of the budget.
 */
public final class BlueprintSession {

    private static final Logger log = LogManager.getLogger(BlueprintSession.class);

    public final String id;

    private final BlueprintKernel kernel;
    private CertaintyLedger ledger = CertaintyLedger.empty();
    private IndustryKit kit;
    private AppContext app;
    private int questionsAsked;

    BlueprintSession(BlueprintKernel kernel, String id) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.id = Objects.requireNonNull(id, "id");
        this.app = new AppContext(id, "Untitled", List.of(), List.of(), List.of(), null);
    }

    public static final class Turn {
        public final ParsedInput parsed;
        public final CertaintyLedger ledger;
        public final List<InferredWorkflow> workflows;
        /** Null while no kit is resolved. */
        public final String kitId;
        public final boolean readyToBuild;
        public final FlowAction action;
        public final String status;

        Turn(ParsedInput parsed, CertaintyLedger ledger, List<InferredWorkflow> workflows, String kitId,
             boolean readyToBuild, FlowAction action, String status) {
            this.parsed = parsed;
            this.ledger = ledger;
            this.workflows = workflows;
            this.kitId = kitId;
            this.readyToBuild = readyToBuild;
            this.action = action;
            this.status = status;
        }
    }

    /**
     * Discovery turn: updates the ledger, resolves a kit once the industry is certain enough,
     * then infers workflows for the kit's entities and features and decides the next step.
     */
    public Turn turn(String utterance) {
        final String text = utterance == null ? "" : utterance;
        final BlueprintConfig cfg = kernel.config();

        ParsedInput parsed = kernel.parser().parse(text);
        ledger = kernel.ledgerUpdater().update(ledger, text, kit);
        resolveKit(cfg.ledger.minIndustryConfidence);

        List<InferredWorkflow> workflows = kernel.workflowEngine().infer(parsed, knownEntities(kit), features(kit));
        boolean ready = ledger.isReadyToBuild(cfg.ledger.minIndustryConfidence, cfg.ledger.minReadiness);

        FlowAction action = kernel.ledgerFlow().next(ledger, questionsAsked);
        if (action.type() == FlowAction.Type.CLARIFY) questionsAsked++;

        if (log.isDebugEnabled()) {
            log.debug("turn session={} intent={} readiness={} kit={} workflows={} action={}",
                    id, parsed.intent.label(), ledger.overallReadiness, kit == null ? "<none>" : kit.id,
                    workflows.size(), action.type().label());
        }
        return new Turn(parsed, ledger, workflows, kit == null ? null : kit.id, ready, action,
                LedgerFlow.statusMessage(ledger));
    }

    private void resolveKit(double minIndustryConfidence) {
        SlotValue<String> industry = ledger.industry();
        if (!industry.isPresent() || industry.confidence() < minIndustryConfidence) return;
        if (kit != null && kit.id.equals(industry.value())) return;

        kernel.catalog().find(industry.value()).ifPresentOrElse(
                k -> {
                    kit = k;
                    log.info("session {} resolved industry kit {}", id, k.id);
                },
                () -> log.warn("session {} has no industry kit for '{}'", id, industry.value()));
    }

    // -------------------- Revisions --------------------

    public RevisionResult revise(String utterance) {
        return kernel.revisionEngine().processRevision(utterance, app);
    }

    /** Applies the result's changes to the session's app and returns the new context. */
    public AppContext apply(RevisionResult result) {
        Objects.requireNonNull(result, "result");
        app = kernel.revisionEngine().applyChanges(app, result.changes);
        return app;
    }

    public void useApp(AppContext app) {
        this.app = Objects.requireNonNull(app, "app");
    }

    // -------------------- Accessors --------------------

    public CertaintyLedger ledger() { return ledger; }
    public IndustryKit kit() { return kit; }
    public AppContext app() { return app; }
    public int questionsAsked() { return questionsAsked; }

    // -------------------- Kit mapping --------------------

    static List<KnownEntity> knownEntities(IndustryKit kit) {
        if (kit == null || kit.entities == null) return List.of();
        List<KnownEntity> out = new ArrayList<>(kit.entities.size());
        for (IndustryKit.KitEntity e : kit.entities) {
            out.add(new KnownEntity(e.id, e.name, e.pluralName, List.of()));
        }
        return out;
    }

    /** Core then recommended features of the kit's bundle. */
    static List<String> features(IndustryKit kit) {
        if (kit == null || kit.featureBundle == null) return List.of();
        Set<String> out = new LinkedHashSet<>(kit.featureBundle.core);
        out.addAll(kit.featureBundle.recommended);
        return List.copyOf(out);
    }
}
