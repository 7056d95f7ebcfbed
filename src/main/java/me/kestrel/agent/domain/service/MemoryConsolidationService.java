package me.kestrel.agent.domain.service;

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

import me.kestrel.agent.domain.component.MemoryComponent;
import me.kestrel.agent.domain.loop.BackgroundTaskSupervisor;
import me.kestrel.agent.domain.model.AgentSession;
import me.kestrel.agent.domain.model.LlmRequest;
import me.kestrel.agent.domain.model.LlmResponse;
import me.kestrel.agent.domain.model.Message;
import me.kestrel.agent.domain.model.SessionSnapshot;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.outbound.LlmPort;
import me.kestrel.agent.port.outbound.SessionPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Summarizes old conversation history into long-term memory.
 *
 * <p>
 * A slice of the session (from the consolidation cursor up to the most recent
 * {@code memoryWindow / 2} messages) is rendered as a transcript and sent to
 * the LLM together with the current MEMORY.md. The model answers with a JSON
 * object carrying a {@code history_entry} (appended to HISTORY.md) and a
 * {@code memory_update} (the new MEMORY.md). Only after both are written is the
 * cursor moved, through {@link SessionPort#commitConsolidation}, which ignores
 * the move if the session was reset in the meantime.
 *
 * <p>
 * Jobs run on the {@link BackgroundTaskSupervisor}; at most one reactive job
 * per session is in flight.
 */
@Service
@Slf4j
public class MemoryConsolidationService {

    static final String SYSTEM_PROMPT = "You are a memory consolidation agent. Respond only with valid JSON.";
    private static final String KEY_HISTORY_ENTRY = "history_entry";
    private static final String KEY_MEMORY_UPDATE = "memory_update";
    private static final String CODE_FENCE = "```";
    private static final int LOG_PREVIEW_CHARS = 200;
    private static final DateTimeFormatter TRANSCRIPT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private static final ObjectMapper LENIENT_JSON = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    private final LlmPort llmPort;
    private final MemoryComponent memory;
    private final SessionPort sessionPort;
    private final BackgroundTaskSupervisor supervisor;
    private final BotProperties properties;
    private final Clock clock;

    private final Set<String> reactiveInFlight = ConcurrentHashMap.newKeySet();

    public MemoryConsolidationService(LlmPort llmPort, MemoryComponent memory, SessionPort sessionPort,
            BackgroundTaskSupervisor supervisor, BotProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.memory = memory;
        this.sessionPort = sessionPort;
        this.supervisor = supervisor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Detaches a consolidation job when more than {@code memoryWindow} messages
     * sit past the cursor and no job for the same session is running.
     *
     * @return true if a job was scheduled
     */
    public boolean scheduleIfNeeded(AgentSession session) {
        if (!properties.getConsolidation().isEnabled()) {
            return false;
        }
        if (session.getUnconsolidatedCount() <= properties.getAgent().getMemoryWindow()) {
            return false;
        }
        SessionSnapshot snapshot = session.snapshot();

        String key = snapshot.sessionKey();
        if (!reactiveInFlight.add(key)) {
            log.debug("[Consolidation] Already running for {}", key);
            return false;
        }
        boolean submitted = supervisor.submit("consolidate:" + key, () -> {
            try {
                consolidate(snapshot, false)
                        .ifPresent(cursor -> sessionPort.commitConsolidation(key, snapshot.epoch(), cursor));
            } finally {
                reactiveInFlight.remove(key);
            }
        });
        if (!submitted) {
            reactiveInFlight.remove(key);
        }
        return submitted;
    }

    /**
     * Archives every message of {@code snapshot}. Used when a session is reset,
     * so the live session is not touched afterwards.
     *
     * <p>
     * The snapshot is the only remaining copy of those messages: when the
     * supervisor refuses the job the archive runs on the calling thread.
     *
     * @return true if the snapshot was archived or handed to a background job
     */
    public boolean scheduleArchiveAll(String sessionKey, SessionSnapshot snapshot) {
        if (!properties.getConsolidation().isEnabled() || snapshot.messages().isEmpty()) {
            return false;
        }
        if (supervisor.submit("archive:" + sessionKey, () -> consolidate(snapshot, true))) {
            return true;
        }
        log.warn("[Consolidation] Background slot unavailable, archiving {} messages of {} inline",
                snapshot.size(), sessionKey);
        consolidate(snapshot, true);
        return true;
    }

    /**
     * Runs one consolidation synchronously.
     *
     * @return the new cursor value, or empty if there was nothing to do or the
     *         attempt failed
     */
    public OptionalInt consolidate(SessionSnapshot snapshot, boolean archiveAll) {
        List<Message> messages = snapshot.messages();
        int keepCount;
        List<Message> slice;
        if (archiveAll) {
            keepCount = 0;
            slice = messages;
            log.info("[Consolidation] Archiving all {} messages of {}", messages.size(), snapshot.sessionKey());
        } else {
            keepCount = properties.getAgent().getMemoryWindow() / 2;
            if (messages.size() <= keepCount) {
                log.debug("[Consolidation] {}: nothing to do (messages={}, keep={})",
                        snapshot.sessionKey(), messages.size(), keepCount);
                return OptionalInt.empty();
            }
            int end = messages.size() - keepCount;
            if (snapshot.lastConsolidated() >= end) {
                return OptionalInt.empty();
            }
            slice = messages.subList(snapshot.lastConsolidated(), end);
            log.info("[Consolidation] {}: {} total, {} to consolidate, {} kept",
                    snapshot.sessionKey(), messages.size(), slice.size(), keepCount);
        }

        String transcript = buildTranscript(slice);
        String currentMemory = memory.readLongTerm();

        try {
            JsonNode result = requestSummary(currentMemory, transcript);
            if (result == null) {
                return OptionalInt.empty();
            }

            String entry = textOf(result.get(KEY_HISTORY_ENTRY));
            if (entry != null && !entry.isBlank()) {
                memory.appendHistory(entry);
            }
            String update = textOf(result.get(KEY_MEMORY_UPDATE));
            if (update != null && !update.isBlank() && !update.equals(currentMemory)) {
                memory.writeLongTerm(update);
            }
        } catch (RuntimeException e) {
            log.warn("[Consolidation] Failed for {}: {}", snapshot.sessionKey(), e.getMessage());
            return OptionalInt.empty();
        }

        int cursor = archiveAll ? 0 : messages.size() - keepCount;
        log.info("[Consolidation] Done for {}: {} messages, cursor -> {}", snapshot.sessionKey(), messages.size(),
                cursor);
        return OptionalInt.of(cursor);
    }

    String buildTranscript(List<Message> slice) {
        StringBuilder sb = new StringBuilder();
        for (Message message : slice) {
            if (message.getContent() == null || message.getContent().isEmpty()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            String time = message.getTimestamp() != null
                    ? TRANSCRIPT_TIME.format(message.getTimestamp().atZone(clock.getZone()))
                    : "?";
            sb.append('[').append(time).append("] ").append(message.getRole().toUpperCase(Locale.ROOT));
            if (message.hasToolsUsed()) {
                sb.append(" [tools: ").append(String.join(", ", message.getToolsUsed())).append(']');
            }
            sb.append(": ").append(message.getContent());
        }
        return sb.toString();
    }

    private JsonNode requestSummary(String currentMemory, String transcript) {
        LlmRequest request = LlmRequest.builder()
                .model(properties.getAgent().getModel())
                .messages(List.of(
                        Message.system(SYSTEM_PROMPT),
                        Message.user(buildPrompt(currentMemory, transcript), clock.instant())))
                .temperature(properties.getAgent().getTemperature())
                .maxTokens(properties.getAgent().getMaxTokens())
                .build();

        LlmResponse response;
        try {
            response = llmPort.chat(request)
                    .get(properties.getConsolidation().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Consolidation] LLM call interrupted");
            return null;
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Consolidation] LLM call failed: {}", cause.getMessage());
            return null;
        }

        String text = response != null && response.getContent() != null ? response.getContent().strip() : "";
        if (text.isEmpty()) {
            log.warn("[Consolidation] LLM returned empty response, skipping");
            return null;
        }
        JsonNode parsed = parseLenient(text);
        if (parsed == null || !parsed.isObject()) {
            log.warn("[Consolidation] Unexpected response, skipping. Response: {}", preview(text));
            return null;
        }
        return parsed;
    }

    static String buildPrompt(String currentMemory, String transcript) {
        String memorySection = currentMemory == null || currentMemory.isBlank() ? "(empty)" : currentMemory;
        return """
                You are a memory consolidation agent. Process this conversation and return a JSON object \
                with exactly two keys:

                1. "history_entry": A paragraph (2-5 sentences) summarizing the key events/decisions/topics. \
                Start with a timestamp like [YYYY-MM-DD HH:MM]. Include enough detail to be useful when found \
                by grep search later.

                2. "memory_update": The updated long-term memory content. Add any new facts: user location, \
                preferences, personal info, habits, project context, technical decisions, tools/services used. \
                If nothing new, return the existing content unchanged.

                ## Current Long-term Memory
                %s

                ## Conversation to Process
                %s

                Respond with ONLY valid JSON, no markdown fences.""".formatted(memorySection, transcript);
    }

    /**
     * Parses model output that is meant to be a JSON object but may be wrapped
     * in code fences or surrounded by prose, or use single quotes and trailing
     * commas.
     *
     * @return the parsed node, or null if nothing parseable was found
     */
    static JsonNode parseLenient(String text) {
        String candidate = text.strip();
        if (candidate.startsWith(CODE_FENCE)) {
            int firstNewline = candidate.indexOf('\n');
            candidate = firstNewline >= 0 ? candidate.substring(firstNewline + 1) : "";
            int closing = candidate.lastIndexOf(CODE_FENCE);
            if (closing >= 0) {
                candidate = candidate.substring(0, closing);
            }
            candidate = candidate.strip();
        }
        int open = candidate.indexOf('{');
        int close = candidate.lastIndexOf('}');
        if (open >= 0 && close > open) {
            candidate = candidate.substring(open, close + 1);
        }
        try {
            return LENIENT_JSON.readTree(candidate);
        } catch (JsonProcessingException e) {
            log.debug("[Consolidation] JSON parse failed: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private static String preview(String text) {
        return text.length() <= LOG_PREVIEW_CHARS ? text : text.substring(0, LOG_PREVIEW_CHARS);
    }
}
