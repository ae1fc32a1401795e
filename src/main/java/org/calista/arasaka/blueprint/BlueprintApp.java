package org.calista.arasaka.blueprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.blueprint.core.BlueprintKernel;
import org.calista.arasaka.blueprint.core.BlueprintSession;
import org.calista.arasaka.blueprint.events.TurnEvent;
import org.calista.arasaka.blueprint.ledger.FlowAction;
import org.calista.arasaka.blueprint.ledger.LedgerFormatter;
import org.calista.arasaka.blueprint.ledger.SlotDecisions;
import org.calista.arasaka.blueprint.ledger.SlotId;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.RevisionResult;
import org.calista.arasaka.blueprint.workflow.InferredWorkflow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Scanner;

/**
 * BlueprintApp: interactive console runner.
 *
 * Plain lines are discovery turns (ledger update + workflow inference + next step).
 * After the question budget is spent the next step is always a build.
 * {@code revise: <text>} edits the session's app; changes needing confirmation wait for "y".
 * {@code ledger} prints the slot decisions. {@code exit} quits.
 */
public final class BlueprintApp {

    private static final Logger log = LogManager.getLogger(BlueprintApp.class);

    static final String REVISE = "revise:";

    private final Path cfgPath;
    private BlueprintKernel kernel;
    private BlueprintSession session;

    public static void main(String[] args) throws Exception {
        new BlueprintApp(args.length > 0 ? Path.of(args[0]) : Path.of("config/blueprint.json")).run();
    }

    public BlueprintApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public void run() throws IOException {
        kernel = BlueprintKernel.builder()
                .configRoot(Path.of("."))
                .build(cfgPath);

        session = kernel.newSession();
        session.useApp(demoApp(session.id));

        runConsoleLoop();
    }

    private void runConsoleLoop() throws IOException {
        log.info("Blueprint started. kits={}", kernel.catalog().ids());
        log.info("Type 'exit' to quit, 'ledger' for slot decisions, '{} ...' to edit the app.\n", REVISE);

        try (Scanner sc = new Scanner(System.in)) {
            while (true) {
                System.out.print("> ");
                if (!sc.hasNextLine()) break;
                String user = sc.nextLine().trim();

                if (user.equalsIgnoreCase("exit")) break;
                if (user.isEmpty()) continue;

                if (user.equalsIgnoreCase("ledger")) {
                    printDecisions();
                    continue;
                }

                journal("USER", user);

                if (user.regionMatches(true, 0, REVISE, 0, REVISE.length())) {
                    revise(user.substring(REVISE.length()).trim(), sc);
                } else {
                    discover(user);
                }
            }
        }
        System.out.println("Bye.");
    }

    private void discover(String user) throws IOException {
        BlueprintSession.Turn t = session.turn(user);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("intent", t.parsed.intent.label());
        out.put("confidence", t.parsed.confidence);
        out.put("semanticIntents", t.parsed.intents);
        out.put("readiness", t.ledger.overallReadiness);
        out.put("readyToBuild", t.readyToBuild);
        out.put("gaps", t.ledger.gapNames());
        out.put("suggestions", t.ledger.suggestions);
        out.put("kit", t.kitId);
        out.put("workflows", workflowIds(t.workflows));
        out.put("action", t.action.type().label());
        out.put("questionsAsked", session.questionsAsked());

        String json = pretty(out);
        System.out.println("\n" + LedgerFormatter.asContext(t.ledger) + "\n" + json + "\n");
        System.out.println(t.status);
        System.out.println(prompt(t.action) + "\n");
        journal("SUMMARY", json);
    }

    private void revise(String text, Scanner sc) throws IOException {
        RevisionResult r = session.revise(text);
        System.out.println("\n" + pretty(r) + "\n");
        journal("REVISION", r.toString());

        if (r.isEmpty()) {
            if (r.confirmationMessage != null) System.out.println(r.confirmationMessage);
            return;
        }

        if (r.requiresConfirmation) {
            System.out.println(r.confirmationMessage + " (y/n)");
            System.out.print("> ");
            if (!sc.hasNextLine() || !sc.nextLine().trim().equalsIgnoreCase("y")) {
                System.out.println("Skipped.");
                return;
            }
        }

        AppContext app = session.apply(r);
        List<String> pages = new ArrayList<>();
        for (AppContext.Page p : app.pages) pages.add(p.id);
        System.out.println("Applied " + r.changes.size() + " change(s). Pages: " + pages);
        journal("APPLY", String.join(",", r.affectedComponents));
    }

    /** What the assistant says after a discovery turn. */
    static String prompt(FlowAction action) {
        if (action.isBuild()) return action.message();
        if (action.gap() == SlotId.INDUSTRY) return "What kind of business is this app for?";
        if (action.gap() == SlotId.SUB_VERTICAL) return "Which part of the business should it focus on?";
        return "Tell me more about your " + action.gap().key() + ".";
    }

    private void printDecisions() {
        SlotDecisions.Summary s = SlotDecisions.summarize(session.ledger());
        System.out.println("\nassumed=" + s.assumed + " confirm=" + s.toConfirm + " ask=" + s.toAsk
                + " skipped=" + s.skipped + " canProceed=" + s.canProceed + "\n");
    }

    private void journal(String type, String text) throws IOException {
        kernel.journal().append(TurnEvent.of(type, session.id, text, System.currentTimeMillis()));
    }

    private String pretty(Object o) throws JsonProcessingException {
        return kernel.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(o);
    }

    private static List<String> workflowIds(List<InferredWorkflow> workflows) {
        List<String> ids = new ArrayList<>(workflows.size());
        for (InferredWorkflow w : workflows) ids.add(w.id);
        return ids;
    }

    static AppContext demoApp(String appId) {
        return new AppContext(appId, "Demo App",
                List.of(
                        new AppContext.Page("dashboard", "Dashboard"),
                        new AppContext.Page("jobs", "Jobs"),
                        new AppContext.Page("calendar", "Calendar"),
                        new AppContext.Page("invoices", "Invoices")),
                List.of(
                        new AppContext.Entity("job", "Job", List.of("title", "status")),
                        new AppContext.Entity("client", "Client", List.of("name", "email"))),
                List.of(new AppContext.Workflow("create-job", "Create Job")),
                "dashboard");
    }
}
