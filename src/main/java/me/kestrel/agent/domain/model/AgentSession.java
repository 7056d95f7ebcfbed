package me.kestrel.agent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a persistent conversation session keyed by {@code channel:chatId}.
 * Tracks the ordered message history and the consolidation cursor
 * {@code lastConsolidated}, which marks how much of the history has already
 * been summarized into long-term memory.
 *
 * <p>
 * The message list is append-only. {@link #clear()} is the only operation that
 * removes messages; it also resets the cursor and bumps {@code epoch} so that a
 * consolidation started before the reset can no longer move the cursor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSession {

    private String id;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private int lastConsolidated;
    private long epoch;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Appends a message to the session history.
     */
    public synchronized void addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
        this.updatedAt = message.getTimestamp() != null ? message.getTimestamp() : updatedAt;
    }

    /**
     * Returns the last {@code maxMessages} messages reduced to role and content,
     * the shape fed back to the LLM as conversation history.
     */
    public synchronized List<Message> getHistory(int maxMessages) {
        int from = Math.max(0, messages.size() - Math.max(0, maxMessages));
        List<Message> history = new ArrayList<>(messages.size() - from);
        for (Message message : messages.subList(from, messages.size())) {
            history.add(Message.builder()
                    .role(message.getRole())
                    .content(message.getContent())
                    .build());
        }
        return history;
    }

    /**
     * Number of messages appended since the cursor.
     */
    @JsonIgnore
    public synchronized int getUnconsolidatedCount() {
        return messages.size() - lastConsolidated;
    }

    /**
     * Drops all messages, resets the cursor and starts a new epoch.
     */
    public synchronized void clear() {
        messages.clear();
        lastConsolidated = 0;
        epoch++;
    }

    /**
     * Moves the cursor forward after a successful consolidation. The update is
     * ignored when the session was cleared since the snapshot was taken, or when
     * the new value would move the cursor backwards or past the end of the
     * history.
     *
     * @return true if the cursor moved
     */
    public synchronized boolean advanceConsolidation(long expectedEpoch, int cursor) {
        if (expectedEpoch != epoch || cursor < lastConsolidated || cursor > messages.size()) {
            return false;
        }
        lastConsolidated = cursor;
        return true;
    }

    /**
     * Takes a private copy of the history for background work.
     */
    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(id, List.copyOf(messages), lastConsolidated, epoch);
    }
}
