package me.golemcore.termagent.domain.service;

import me.golemcore.termagent.domain.model.ExecutionMode;
import me.golemcore.termagent.domain.model.PlanStep.StepStatus;
import me.golemcore.termagent.domain.model.RiskTier;
import me.golemcore.termagent.domain.model.SecurityVerdict;
import me.golemcore.termagent.domain.model.ToolInvocation;
import me.golemcore.termagent.domain.service.ToolConfirmationPolicy.Requirement;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolConfirmationPolicyTest {

    private static final SecurityVerdict SAFE = SecurityVerdict.safe();
    private static final SecurityVerdict DANGEROUS = new SecurityVerdict(RiskTier.DANGEROUS, "recursive forced deletion");
    private static final SecurityVerdict BLOCKED = new SecurityVerdict(RiskTier.BLOCKED, "disabled");

    private final ToolConfirmationPolicy policy = new ToolConfirmationPolicy();

    private final ToolInvocation command = new ToolInvocation.ExecuteCommand("ls", null, null);
    private final ToolInvocation write = new ToolInvocation.WriteFile("a.txt", "hello", null);

    @Test
    void shouldConfirmEveryEffectInConfirmEachMode() {
        assertEquals(Requirement.CONFIRM, policy.requirementFor(command, ExecutionMode.CONFIRM_EACH, SAFE));
        assertEquals(Requirement.CONFIRM, policy.requirementFor(write, ExecutionMode.CONFIRM_EACH, null));
        assertEquals(Requirement.CONFIRM, policy.requirementFor(
                new ToolInvocation.WebSearch("java records", null), ExecutionMode.CONFIRM_EACH, null));
    }

    @Test
    void shouldSkipConfirmationInAutonomousModeForNonDangerousEffects() {
        assertEquals(Requirement.NONE, policy.requirementFor(command, ExecutionMode.AUTONOMOUS, SAFE));
        assertEquals(Requirement.NONE, policy.requirementFor(write, ExecutionMode.AUTONOMOUS, null));
    }

    @Test
    void shouldAlwaysConfirmDangerousCommands() {
        assertEquals(Requirement.CONFIRM, policy.requirementFor(command, ExecutionMode.AUTONOMOUS, DANGEROUS));
        assertEquals(Requirement.CONFIRM, policy.requirementFor(command, ExecutionMode.CONFIRM_EACH, DANGEROUS));
    }

    @Test
    void shouldRejectBlockedCommandsWithoutAsking() {
        assertEquals(Requirement.REJECT, policy.requirementFor(command, ExecutionMode.CONFIRM_EACH, BLOCKED));
        assertEquals(Requirement.REJECT, policy.requirementFor(command, ExecutionMode.AUTONOMOUS, BLOCKED));
    }

    @Test
    void shouldNeverConfirmBookkeepingTools() {
        for (ToolInvocation invocation : new ToolInvocation[] {
                new ToolInvocation.ListDirectory(".", false, null),
                new ToolInvocation.UpdatePlanStep(1, StepStatus.IN_PROGRESS, null),
                new ToolInvocation.AskUser("Which port?"),
                new ToolInvocation.Finish("done") }) {
            assertEquals(Requirement.NONE, policy.requirementFor(invocation, ExecutionMode.CONFIRM_EACH, null));
        }
    }

    @Test
    void shouldDescribeWriteWithPreviewAndPurpose() {
        // Act
        String description = policy.describeAction(new ToolInvocation.WriteFile("conf/app.yml", "port: 8080",
                "set the port"));

        // Assert
        assertTrue(description.startsWith("Write file: conf/app.yml (10 chars)"));
        assertTrue(description.contains("Purpose: set the port"));
        assertTrue(description.contains("port: 8080"));
    }
}
