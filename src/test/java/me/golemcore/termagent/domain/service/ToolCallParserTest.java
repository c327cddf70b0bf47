package me.golemcore.termagent.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.termagent.domain.exception.MalformedToolCallException;
import me.golemcore.termagent.domain.model.PlanStep.StepStatus;
import me.golemcore.termagent.domain.model.ResponseDefect;
import me.golemcore.termagent.domain.model.ToolInvocation;
import me.golemcore.termagent.domain.model.ToolName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallParserTest {

    private ToolCallParser parser;

    @BeforeEach
    void setUp() {
        parser = new ToolCallParser(new LenientJsonParser(new ObjectMapper()));
    }

    private ResponseDefect.Kind defectOf(String raw) {
        return assertThrows(MalformedToolCallException.class, () -> parser.parse(raw)).getDefect().kind();
    }

    @Test
    void shouldParseCommandWithNestedArguments() {
        // Act
        ToolInvocation invocation = parser.parse(
                "{\"tool\": \"execute_command\", \"arguments\": {\"command\": \"ls -la\", \"timeout\": 10}}");

        // Assert
        ToolInvocation.ExecuteCommand command = assertInstanceOf(ToolInvocation.ExecuteCommand.class, invocation);
        assertEquals("ls -la", command.command());
        assertEquals(10, command.timeoutSeconds());
        assertEquals(ToolName.EXECUTE_COMMAND, command.toolName());
    }

    @Test
    void shouldParseFlatObjectWithAlias() {
        // Act
        ToolInvocation invocation = parser.parse("{\"name\": \"bash\", \"command\": \"uptime\"}");

        // Assert
        assertEquals("uptime", assertInstanceOf(ToolInvocation.ExecuteCommand.class, invocation).command());
    }

    @Test
    void shouldParseReplyWrappedInProseAndFence() {
        // Arrange
        String raw = "Sure, let me write it.\n```json\n{\"tool\": \"write_file\", \"arguments\": "
                + "{\"path\": \"a.txt\", \"content\": \"\"}}\n```";

        // Act
        ToolInvocation.WriteFile write = assertInstanceOf(ToolInvocation.WriteFile.class, parser.parse(raw));

        // Assert
        assertEquals("a.txt", write.path());
        assertEquals("", write.content());
    }

    @Test
    void shouldAcceptSingleElementArray() {
        // Act
        ToolInvocation invocation = parser.parse("[{\"tool\": \"finish\", \"arguments\": {\"summary\": \"done\"}}]");

        // Assert
        assertEquals("done", assertInstanceOf(ToolInvocation.Finish.class, invocation).summary());
    }

    @Test
    void shouldRejectMultipleToolCalls() {
        assertEquals(ResponseDefect.Kind.MALFORMED_STRUCTURE,
                defectOf("[{\"tool\": \"finish\"}, {\"tool\": \"finish\"}]"));
    }

    @Test
    void shouldReportUnknownToolWithValidNames() {
        // Act
        MalformedToolCallException error = assertThrows(MalformedToolCallException.class,
                () -> parser.parse("{\"tool\": \"format_disk\"}"));

        // Assert
        assertEquals(ResponseDefect.Kind.UNKNOWN_TOOL, error.getDefect().kind());
        assertTrue(error.getMessage().contains("execute_command"));
    }

    @Test
    void shouldReportMissingRequiredArgument() {
        assertEquals(ResponseDefect.Kind.MISSING_ARGUMENT, defectOf("{\"tool\": \"read_file\", \"arguments\": {}}"));
        assertEquals(ResponseDefect.Kind.MISSING_ARGUMENT, defectOf("{\"arguments\": {\"path\": \"x\"}}"));
        assertEquals(ResponseDefect.Kind.MALFORMED_STRUCTURE, defectOf("I will now list the files."));
    }

    @Test
    void shouldRequireReplacementForReplaceEdit() {
        assertEquals(ResponseDefect.Kind.MISSING_ARGUMENT, defectOf(
                "{\"tool\": \"edit_file\", \"arguments\": {\"path\": \"f\", \"action\": \"replace\", \"search\": \"a\"}}"));
        assertEquals(ResponseDefect.Kind.INVALID_ARGUMENT, defectOf(
                "{\"tool\": \"edit_file\", \"arguments\": {\"path\": \"f\", \"action\": \"rewrite\", \"search\": \"a\"}}"));
    }

    @Test
    void shouldParseInsertEdit() {
        // Act
        ToolInvocation.EditFile edit = assertInstanceOf(ToolInvocation.EditFile.class, parser.parse(
                "{\"tool\": \"edit_file\", \"arguments\": {\"path\": \"f\", \"action\": \"insert_after\", "
                        + "\"search\": \"[main]\", \"line\": \"debug = true\"}}"));

        // Assert
        assertEquals(ToolInvocation.EditAction.INSERT_AFTER, edit.action());
        assertEquals("debug = true", edit.line());
        assertNull(edit.replace());
    }

    @Test
    void shouldParseStepUpdateWithAliases() {
        // Act
        ToolInvocation.UpdatePlanStep update = assertInstanceOf(ToolInvocation.UpdatePlanStep.class, parser.parse(
                "{'tool': 'update_plan_step', 'arguments': {'step_id': '2', 'status': 'done', 'notes': 'ok',}}"));

        // Assert
        assertEquals(2, update.stepId());
        assertEquals(StepStatus.COMPLETED, update.status());
        assertEquals("ok", update.result());
    }

    @Test
    void shouldRejectUnknownStepStatus() {
        assertEquals(ResponseDefect.Kind.INVALID_ARGUMENT, defectOf(
                "{\"tool\": \"update_plan_step\", \"arguments\": {\"step\": 1, \"status\": \"almost\"}}"));
    }

    @Test
    void shouldDefaultOptionalArguments() {
        // Act
        ToolInvocation.ListDirectory list = assertInstanceOf(ToolInvocation.ListDirectory.class,
                parser.parse("{\"tool\": \"list_directory\"}"));
        ToolInvocation.Finish finish = assertInstanceOf(ToolInvocation.Finish.class,
                parser.parse("{\"tool\": \"finish\"}"));

        // Assert
        assertEquals(".", list.path());
        assertFalse(list.recursive());
        assertFalse(finish.summary().isBlank());
    }
}
