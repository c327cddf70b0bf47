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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Final statement of a goal run: what was attempted, what succeeded and where
 * it stopped.
 */
@Data
@Builder
public class SessionReport {

    private String sessionId;
    private String goal;
    private SessionState state;
    private int stepsUsed;
    private int stepLimit;
    private PlanProgress progress;
    private String summary;
    private String abortReason;
    private String stoppedAt;
    private int commandsExecuted;
    private int fileOperations;
    private AnalysisReport analysis;
    private Instant finishedAt;

    public boolean isFinished() {
        return state == SessionState.FINISHED;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Goal: ").append(goal).append('\n');
        sb.append("Result: ").append(state == SessionState.FINISHED ? "finished" : "aborted").append('\n');
        if (abortReason != null) {
            sb.append("Reason: ").append(abortReason).append('\n');
        }
        sb.append("Attempted: ").append(stepsUsed).append(" model turn(s), ")
                .append(commandsExecuted).append(" command(s), ")
                .append(fileOperations).append(" file operation(s)\n");
        if (progress != null) {
            sb.append("Plan: ").append(progress.describe()).append('\n');
        }
        if (stoppedAt != null) {
            sb.append("Stopped at: ").append(stoppedAt).append('\n');
        }
        if (summary != null && !summary.isBlank()) {
            sb.append("Summary: ").append(summary).append('\n');
        }
        return sb.toString();
    }
}
