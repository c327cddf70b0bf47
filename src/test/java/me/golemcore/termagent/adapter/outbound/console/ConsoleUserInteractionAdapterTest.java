package me.golemcore.termagent.adapter.outbound.console;

import me.golemcore.termagent.domain.exception.UserInterruptException;
import me.golemcore.termagent.domain.model.ConfirmationDecision;
import me.golemcore.termagent.domain.model.Plan;
import me.golemcore.termagent.domain.model.PlanReviewDecision;
import me.golemcore.termagent.domain.model.PlanStep;
import me.golemcore.termagent.domain.model.RiskTier;
import me.golemcore.termagent.domain.model.SecurityVerdict;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.InputStreamReader;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleUserInteractionAdapterTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ConsoleUserInteractionAdapter adapterWithInput(String input) {
        return new ConsoleUserInteractionAdapter(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void confirmMapsAnswersAndRepromptsOnGarbage() {
        ConsoleUserInteractionAdapter adapter = adapterWithInput("maybe\nY\n");

        ConfirmationDecision decision = adapter.confirm("Run command: ls", SecurityVerdict.safe());

        assertEquals(ConfirmationDecision.APPROVE, decision);
        assertTrue(printed().contains("Please answer y, n or a."));
    }

    @Test
    void confirmShowsRiskWarningForDangerousCommand() {
        ConsoleUserInteractionAdapter adapter = adapterWithInput("a\n");

        ConfirmationDecision decision = adapter.confirm("Run command: rm -rf build",
                new SecurityVerdict(RiskTier.DANGEROUS, "recursive forced deletion"));

        assertEquals(ConfirmationDecision.APPROVE_ALL, decision);
        assertTrue(printed().contains("!! DANGEROUS: recursive forced deletion"));
    }

    @Test
    void confirmDenyAndJustification() {
        ConsoleUserInteractionAdapter adapter = adapterWithInput("n\n\n");

        assertEquals(ConfirmationDecision.DENY, adapter.confirm("Write file", null));
        assertEquals("no reason given", adapter.requestJustification("Write file"));
    }

    @Test
    void endOfInputRaisesInterrupt() {
        ConsoleUserInteractionAdapter adapter = adapterWithInput("");

        assertThrows(UserInterruptException.class, () -> adapter.confirm("Run command: ls", null));
        assertThrows(UserInterruptException.class, () -> adapter.ask("Which port?"));
    }

    @Test
    void interruptAtPromptRaisesInterruptAndNextPromptKeepsTheLine() throws Exception {
        PipedOutputStream keyboard = new PipedOutputStream();
        ConsoleUserInteractionAdapter adapter = new ConsoleUserInteractionAdapter(
                new BufferedReader(new InputStreamReader(new PipedInputStream(keyboard), StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
        try {
            Thread.currentThread().interrupt();
            assertThrows(UserInterruptException.class, () -> adapter.askYesNo("Proceed?"));
            assertTrue(Thread.interrupted());

            keyboard.write("y\n".getBytes(StandardCharsets.UTF_8));
            keyboard.flush();

            assertTrue(adapter.askYesNo("Proceed?"));
        } finally {
            adapter.shutdown();
        }
    }

    @Test
    void reviewPlanRequiresFeedbackForRevision() {
        Plan plan = Plan.builder()
                .revision(1)
                .steps(List.of(PlanStep.builder().id(1).description("Install nginx")
                        .command("apt-get install -y nginx").build()))
                .build();
        ConsoleUserInteractionAdapter adapter = adapterWithInput("e\n\ne\nuse the official repo\n");

        PlanReviewDecision decision = adapter.reviewPlan(plan);

        assertEquals(PlanReviewDecision.Action.REVISE, decision.action());
        assertEquals("use the official repo", decision.feedback());
        assertTrue(printed().contains("1. Install nginx"));
        assertTrue(printed().contains("$ apt-get install -y nginx"));
        assertTrue(printed().contains("Feedback is required"));
    }

    @Test
    void reviewPlanAcceptAndReject() {
        Plan plan = Plan.builder().steps(List.of(PlanStep.builder().id(1).description("x").build())).build();

        assertEquals(PlanReviewDecision.Action.ACCEPT, adapterWithInput("yes\n").reviewPlan(plan).action());
        assertEquals(PlanReviewDecision.Action.REJECT, adapterWithInput("n\n").reviewPlan(plan).action());
    }

    @Test
    void askYesNoLoopsUntilClearAnswer() {
        ConsoleUserInteractionAdapter adapter = adapterWithInput("sure\nno\n");

        assertFalse(adapter.askYesNo("Run a deep analysis?"));
    }

    @Test
    void requestNextGoalTreatsBlankAsQuit() {
        assertEquals(Optional.of("Configure TLS"), adapterWithInput("  Configure TLS  \n").requestNextGoal());
        assertEquals(Optional.empty(), adapterWithInput("\n").requestNextGoal());
    }

    @Test
    void readInputPrintsLabelWithoutQuestionFraming() {
        ConsoleUserInteractionAdapter adapter = adapterWithInput("  how do I list sockets?  \n");

        assertEquals("how do I list sockets?", adapter.readInput("you> "));
        assertTrue(printed().startsWith("you> "));
        assertFalse(printed().contains("Agent asks"));
    }
}
