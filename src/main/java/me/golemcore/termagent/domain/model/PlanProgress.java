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

/**
 * Snapshot of plan progress. {@code percentage} counts completed steps only.
 */
public record PlanProgress(int completedCount, int failedCount, int skippedCount, int pendingCount,
        int inProgressCount, int total, int percentage) {

    public int resolvedCount() {
        return completedCount + failedCount + skippedCount;
    }

    public String describe() {
        return String.format("%d/%d completed (%d%%), %d failed, %d skipped, %d pending, %d in progress",
                completedCount, total, percentage, failedCount, skippedCount, pendingCount, inProgressCount);
    }
}
