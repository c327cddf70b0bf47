/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.termagent.domain.service;

import me.golemcore.termagent.domain.model.AgentSession;
import me.golemcore.termagent.domain.model.Plan;
import org.springframework.stereotype.Component;

/**
 * Builds the fixed prompts sent to the model: the tool protocol, planning
 * requests and plan corrections.
 */
@Component
public class PromptBuilder {

    private static final String TOOL_PROTOCOL = """
            Reply with exactly ONE JSON object per turn and nothing else:
            {"tool": "<tool name>", "arguments": {<named arguments>}}

            Tools:
            - execute_command: {"command": str, "timeout": int seconds (optional), "explain": str}
            - read_file: {"path": str, "start_line": int (optional), "end_line": int (optional)}
            - write_file: {"path": str, "content": str, "explain": str}
            - edit_file: {"path": str, "action": "replace"|"insert_after"|"insert_before"|"delete_line",
                          "search": str (whole line to match), "replace": str (for replace),
                          "line": str (for inserts), "explain": str}
            - copy_file: {"source": str, "destination": str, "overwrite": bool}
            - delete_file: {"path": str, "backup": bool}
            - list_directory: {"path": str, "recursive": bool, "pattern": glob (optional)}
            - web_search: {"query": str, "max_sources": int (optional)}
            - update_plan_step: {"step": int, "status": "in_progress"|"completed"|"failed"|"skipped", "result": str}
            - ask_user: {"question": str}
            - finish: {"summary": str}

            Rules:
            - Work through the plan in order. Mark a step in_progress when you start it, then completed,
              failed or skipped when it is resolved. Resolved steps cannot change again.
            - finish is rejected while any step is pending or in_progress.
            - Never run interactive programs (vim, nano, less, top); they hang until the timeout.
            - If the user refuses an action, read their justification and adapt.
            """;

    public String systemPrompt(AgentSession session) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an autonomous system administration and development agent. ");
        sb.append("You reach goals by calling tools that act on ").append(session.getTarget().isRemote()
                ? "the remote host " + session.getTarget().describe() + " over SSH"
                : "the local machine").append(".\n\n");
        sb.append(TOOL_PROTOCOL);
        sb.append("- Commands time out; prefer non-interactive flags (-y, --no-pager).\n");
        if (session.isAutonomous()) {
            sb.append("- You run autonomously: ask_user is unavailable, decide on your own.\n");
        }
        return sb.toString();
    }

    public String goalMessage(String goal) {
        return "GOAL: " + goal;
    }

    public String planningRequest(String goal) {
        return "Before acting, draft an ordered plan for the goal: " + goal + "\n"
                + "Reply with JSON only, no tool call:\n"
                + "{\"steps\": [{\"description\": \"what the step achieves\", "
                + "\"command\": \"shell command if one applies, else omit\"}]}\n"
                + "Keep steps concrete and verifiable; avoid more steps than needed.";
    }

    public String revisionRequest(Plan plan, String feedback) {
        StringBuilder sb = new StringBuilder("The user asked for changes to the plan.\nCurrent plan:\n");
        plan.getSteps().forEach(step -> sb.append(step.getId()).append(". ").append(step.getDescription())
                .append('\n'));
        sb.append("Feedback: ").append(feedback).append('\n');
        sb.append("Reply with the complete revised plan in the same JSON format: ")
                .append("{\"steps\": [{\"description\": \"...\", \"command\": \"...\"}]}");
        return sb.toString();
    }

    public String planCorrection(String error) {
        return "The plan could not be used: " + error + "\n"
                + "Reply with JSON only: {\"steps\": [{\"description\": \"...\", \"command\": \"...\"}]} "
                + "with at least one step.";
    }

    public String continuationMessage(String goal) {
        return "NEW GOAL (previous work stays in context): " + goal;
    }
}
