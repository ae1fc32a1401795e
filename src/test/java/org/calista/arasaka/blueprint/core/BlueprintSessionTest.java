package org.calista.arasaka.blueprint.core;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.calista.arasaka.blueprint.events.TurnJournal;
import org.calista.arasaka.blueprint.intent.IntentType;
import org.calista.arasaka.blueprint.kits.IndustryKit;
import org.calista.arasaka.blueprint.ledger.FlowAction;
import org.calista.arasaka.blueprint.ledger.SlotId;
import org.calista.arasaka.blueprint.ledger.SlotSource;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.RevisionIntent;
import org.calista.arasaka.blueprint.revision.RevisionResult;
import org.calista.arasaka.blueprint.workflow.InferredWorkflow;
import org.calista.arasaka.blueprint.workflow.KnownEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BlueprintSessionTest {

    @TempDir Path temp;

    private static BlueprintKernel kernel(BlueprintConfig cfg) {
        return BlueprintKernel.builder()
                .journal(TurnJournal.disabled(new ObjectMapper()))
                .workflowIds(() -> "workflow-test")
                .build(cfg);
    }

    private static boolean hasWorkflow(List<InferredWorkflow> workflows, String id) {
        for (InferredWorkflow w : workflows) {
            if (w.id.equals(id)) return true;
        }
        return false;
    }

    @Test
    @DisplayName("industry resolves a kit which feeds the ledger on the next turn")
    void discoveryAcrossTurns() {
        BlueprintSession session = kernel(BlueprintConfig.defaults()).newSession();

        BlueprintSession.Turn first = session.turn("I need an app for my plumbing business with 5 technicians");

        assertEquals(IntentType.CREATE_APP, first.parsed.intent);
        assertEquals("plumber", first.kitId);
        assertEquals(0.7, first.ledger.industry().confidence(), 1e-9);
        assertEquals(List.of(SlotId.PRIMARY_ENTITIES), first.ledger.gaps);
        assertFalse(first.readyToBuild);
        assertTrue(hasWorkflow(first.workflows, "create-job"));
        assertTrue(hasWorkflow(first.workflows, "navigate-homeowner-list"));
        assertEquals(FlowAction.Type.CLARIFY, first.action.type());
        assertEquals(SlotId.SUB_VERTICAL, first.action.gap());
        assertEquals(1, session.questionsAsked());

        BlueprintSession.Turn second = session.turn("we also need invoices");

        assertEquals(0.95, second.ledger.industry().confidence(), 1e-9);
        assertEquals(SlotSource.EXPLICIT, second.ledger.industry().source());
        assertEquals(9, second.ledger.primaryEntities().value().size());
        assertEquals(5, second.ledger.scale().value());
        assertEquals(0.69175, second.ledger.overallReadiness, 1e-9);
        assertTrue(second.readyToBuild);
        assertEquals(FlowAction.Type.READY_TO_BUILD, second.action.type());
        assertEquals("Almost ready (69% confidence). Need to clarify: ", second.status);
        assertEquals(1, session.questionsAsked());
        assertSame(second.ledger, session.ledger());
    }

    @Test
    @DisplayName("vague turns spend the question budget, then the build is forced")
    void questionBudgetForcesBuild() {
        BlueprintSession session = kernel(BlueprintConfig.defaults()).newSession();

        for (int i = 1; i <= 3; i++) {
            BlueprintSession.Turn t = session.turn("hello there");
            assertEquals(FlowAction.Type.CLARIFY, t.action.type());
            assertEquals(SlotId.INDUSTRY, t.action.gap());
            assertEquals(i, session.questionsAsked());
        }

        BlueprintSession.Turn forced = session.turn("hello there");
        assertEquals(FlowAction.Type.FORCE_BUILD, forced.action.type());
        assertEquals(3, session.questionsAsked());
        assertTrue(forced.status.startsWith("Need more information (0% confidence)"));
    }

    @Test
    void questionBudgetComesFromConfig() {
        BlueprintConfig cfg = BlueprintConfig.defaults();
        cfg.ledger.maxQuestions = 1;
        BlueprintSession session = kernel(cfg).newSession();

        assertEquals(FlowAction.Type.CLARIFY, session.turn("hello there").action.type());
        assertEquals(FlowAction.Type.FORCE_BUILD, session.turn("hello there").action.type());
    }

    @Test
    void kitNeedsEnoughIndustryConfidence() {
        BlueprintConfig cfg = BlueprintConfig.defaults();
        cfg.ledger.minIndustryConfidence = 0.9;
        BlueprintSession session = kernel(cfg).newSession();

        BlueprintSession.Turn turn = session.turn("I need an app for my plumbing business");

        assertNull(turn.kitId);
        assertNull(session.kit());
        assertFalse(hasWorkflow(turn.workflows, "create-job"));
    }

    @Test
    void unknownIndustryKeepsWorking() {
        BlueprintSession session = kernel(BlueprintConfig.defaults()).newSession();

        BlueprintSession.Turn turn = session.turn("we run a bakery with fresh bread");

        assertEquals("bakery", turn.ledger.industry().value());
        assertNull(turn.kitId);
    }

    @Test
    void revisionsApplyToTheSessionApp() {
        BlueprintSession session = kernel(BlueprintConfig.defaults()).newSession();
        session.useApp(new AppContext("app-1", "Demo",
                List.of(new AppContext.Page("jobs", "Jobs"), new AppContext.Page("calendar", "Calendar")),
                List.of(), List.of(), "jobs"));

        RevisionResult r = session.revise("remove the calendar");
        assertEquals(RevisionIntent.REMOVE_FEATURE, r.intent);
        assertTrue(r.requiresConfirmation);

        AppContext after = session.apply(r);
        assertNull(after.page("calendar"));
        assertSame(after, session.app());
        assertEquals(1, after.pages.size());
    }

    @Test
    void kitMapping() {
        IndustryKit pm = kernel(BlueprintConfig.defaults()).catalog().find("property-management").orElseThrow();

        List<KnownEntity> entities = BlueprintSession.knownEntities(pm);
        assertEquals(6, entities.size());
        assertEquals(new KnownEntity("tenant", "Tenant", "Tenants", List.of()), entities.get(0));

        assertEquals(List.of("tenant_management", "lease_tracking", "rent_collection", "property_tracking",
                "maintenance_requests", "document_storage", "payment_processing", "automated_reminders"),
                BlueprintSession.features(pm));

        assertTrue(BlueprintSession.knownEntities(null).isEmpty());
        assertTrue(BlueprintSession.features(null).isEmpty());
    }

    @Test
    void kernelFromConfigFile() throws Exception {
        BlueprintKernel k = BlueprintKernel.builder()
                .configRoot(temp)
                .build(Path.of("config/blueprint.json"));

        assertTrue(Files.exists(temp.resolve("config/blueprint.json")));
        assertEquals(5, k.catalog().size());
        assertTrue(k.journal().isEnabled());
        assertEquals(temp.resolve("data/turns.jsonl"), k.journal().file());
        assertEquals(3, k.config().revision.maxListedChanges);
        assertTrue(k.newSession().id.startsWith("sess-"));
    }
}
