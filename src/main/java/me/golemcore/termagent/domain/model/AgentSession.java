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

package me.golemcore.termagent.domain.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root aggregate for one goal-to-completion run. Owns the plan and the
 * conversation context and records every effect for the final report.
 *
 * <p>
 * The execution mode can only move from confirm-each to autonomous while the
 * session lives.
 */
@Getter
public class AgentSession {

    private static final Map<SessionState, Set<SessionState>> TRANSITIONS = new EnumMap<>(SessionState.class);

    static {
        TRANSITIONS.put(SessionState.PLAN_PENDING, EnumSet.of(SessionState.PLAN_REVIEW, SessionState.ABORTED));
        TRANSITIONS.put(SessionState.PLAN_REVIEW,
                EnumSet.of(SessionState.EXECUTING, SessionState.PLAN_PENDING, SessionState.ABORTED));
        TRANSITIONS.put(SessionState.EXECUTING, EnumSet.of(SessionState.FINISHED, SessionState.ABORTED));
        TRANSITIONS.put(SessionState.FINISHED, EnumSet.of(SessionState.CONTINUING));
        TRANSITIONS.put(SessionState.ABORTED, EnumSet.of(SessionState.CONTINUING));
        TRANSITIONS.put(SessionState.CONTINUING, EnumSet.of(SessionState.PLAN_PENDING));
    }

    private final String id;
    private final ExecutionTarget target;
    private final int stepLimit;
    private final Instant createdAt;
    private final ConversationContext context = new ConversationContext();
    private final List<String> goals = new ArrayList<>();
    private final List<CommandRecord> commands = new ArrayList<>();
    private final List<FileOperationRecord> fileOperations = new ArrayList<>();
    private final List<SearchReport> searches = new ArrayList<>();

    private ExecutionMode mode;
    private SessionState state = SessionState.PLAN_PENDING;
    private int stepCount;

    @Setter
    private Plan plan;
    @Setter
    private String finishSummary;
    @Setter
    private String abortReason;
    @Setter
    private String stoppedAt;

    public AgentSession(String id, String goal, ExecutionMode mode, int stepLimit, ExecutionTarget target,
            Instant createdAt) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Goal must not be empty");
        }
        if (stepLimit < 1) {
            throw new IllegalArgumentException("Step limit must be positive: " + stepLimit);
        }
        this.id = id;
        this.goals.add(goal.trim());
        this.mode = mode;
        this.stepLimit = stepLimit;
        this.target = target;
        this.createdAt = createdAt;
    }

    public String getGoal() {
        return goals.get(goals.size() - 1);
    }

    public List<String> getGoals() {
        return Collections.unmodifiableList(goals);
    }

    public List<CommandRecord> getCommands() {
        return Collections.unmodifiableList(commands);
    }

    public List<FileOperationRecord> getFileOperations() {
        return Collections.unmodifiableList(fileOperations);
    }

    public List<SearchReport> getSearches() {
        return Collections.unmodifiableList(searches);
    }

    public boolean isAutonomous() {
        return mode == ExecutionMode.AUTONOMOUS;
    }

    /**
     * The only runtime mode change. Repeated calls are no-ops.
     */
    public void switchToAutonomous() {
        mode = ExecutionMode.AUTONOMOUS;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public void transitionTo(SessionState next) {
        if (!TRANSITIONS.getOrDefault(state, Set.of()).contains(next)) {
            throw new IllegalStateException("Illegal session transition " + state + " -> " + next);
        }
        state = next;
    }

    /**
     * Increments the executing-turn counter and returns the new value.
     */
    public int nextStep() {
        return ++stepCount;
    }

    public boolean isStepLimitExceeded() {
        return stepCount > stepLimit;
    }

    /**
     * Feeds a fresh goal back into planning, keeping the accumulated context.
     */
    public void continueWith(String goal) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Goal must not be empty");
        }
        transitionTo(SessionState.CONTINUING);
        goals.add(goal.trim());
        plan = null;
        finishSummary = null;
        abortReason = null;
        stoppedAt = null;
        stepCount = 0;
        transitionTo(SessionState.PLAN_PENDING);
    }

    public void recordCommand(CommandRecord record) {
        commands.add(record);
    }

    public void recordFileOperation(FileOperationRecord record) {
        fileOperations.add(record);
    }

    public void recordSearch(SearchReport report) {
        searches.add(report);
    }
}
