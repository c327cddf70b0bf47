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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered conversation log of a session. Messages are only appended, or
 * removed by sliding-window eviction; pinned messages are never removed. The
 * current plan snapshot is held apart from the log and always pinned.
 */
public class ConversationContext {

    private final List<Message> messages = new ArrayList<>();
    private final List<Message> pendingSummary = new ArrayList<>();

    @Getter
    @Setter
    private Message planSnapshot;

    @Getter
    @Setter
    private String rollingSummary;

    @Getter
    private int evictedCount;

    public void append(Message message) {
        messages.add(message);
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }

    public List<Message> getPinnedMessages() {
        return messages.stream().filter(Message::isPinned).toList();
    }

    public List<Message> getUnpinnedMessages() {
        return messages.stream().filter(message -> !message.isPinned()).toList();
    }

    /**
     * Removes the oldest non-pinned message and queues it for the rolling
     * summary.
     */
    public Optional<Message> evictOldestUnpinned() {
        for (int i = 0; i < messages.size(); i++) {
            if (!messages.get(i).isPinned()) {
                Message evicted = messages.remove(i);
                pendingSummary.add(evicted);
                evictedCount++;
                return Optional.of(evicted);
            }
        }
        return Optional.empty();
    }

    public List<Message> getPendingSummary() {
        return Collections.unmodifiableList(pendingSummary);
    }

    public void clearPendingSummary() {
        pendingSummary.clear();
    }
}
