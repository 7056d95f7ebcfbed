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
import me.kestrel.agent.domain.model.Message;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;

/**
 * Assembles the message list sent to the LLM for one turn: a system prompt,
 * the recent session history, then the new user message.
 *
 * <p>
 * The system prompt is made of sections separated by blank lines: identity
 * and runtime, workspace bootstrap files that exist (AGENTS.md, SOUL.md, ...),
 * long-term memory, and the channel/chat of the current conversation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextBuilder {

    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String SECTION_SEPARATOR = "\n\n---\n\n";
    private static final String WORKSPACE_ROOT = "";
    private static final DateTimeFormatter NOW_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm (EEEE)", Locale.ENGLISH);

    private final StoragePort storagePort;
    private final MemoryComponent memoryComponent;
    private final BotProperties properties;
    private final Clock clock;

    public String buildSystemPrompt(String channel, String chatId) {
        List<String> sections = new ArrayList<>();
        sections.add(identity());

        String bootstrap = loadBootstrapFiles();
        if (!bootstrap.isEmpty()) {
            sections.add(bootstrap);
        }

        String memory = memoryComponent.getMemoryContext();
        if (memory != null && !memory.isBlank()) {
            sections.add("# Memory\n\n" + memory);
        }

        if (channel != null && chatId != null) {
            sections.add("## Current Session\nChannel: " + channel + "\nChat ID: " + chatId);
        }
        return String.join(SECTION_SEPARATOR, sections);
    }

    /**
     * Builds the full message list for a provider call.
     *
     * @param history
     *            prior turns, already reduced to role and content
     */
    public List<Message> buildMessages(List<Message> history, String currentMessage, List<String> media,
            String channel, String chatId) {
        List<Message> messages = new ArrayList<>(history.size() + 2);
        messages.add(Message.system(buildSystemPrompt(channel, chatId)));
        messages.addAll(history);
        messages.add(Message.user(withMedia(currentMessage, media), clock.instant()));
        return messages;
    }

    private String identity() {
        String botName = properties.getPrompts().getBotName();
        ZonedDateTime now = ZonedDateTime.now(clock);
        String workspace = properties.getStorage().getLocal().resolveBasePath().toString();

        return "# " + botName + DOUBLE_NEWLINE
                + "You are " + botName + ", a helpful AI assistant. You can search and fetch web pages "
                + "and send messages to the user with the tools provided." + DOUBLE_NEWLINE
                + "## Current Time\n" + NOW_FORMAT.format(now) + " " + now.getZone().getId() + DOUBLE_NEWLINE
                + "## Runtime\nJava " + System.getProperty("java.version") + " on "
                + System.getProperty("os.name") + " " + System.getProperty("os.arch") + DOUBLE_NEWLINE
                + "## Workspace\nYour workspace is at: " + workspace + "\n"
                + "- Long-term memory: memory/MEMORY.md\n"
                + "- History log: memory/HISTORY.md (grep-searchable)" + DOUBLE_NEWLINE
                + "Reply directly with text for conversations. Only use the 'message' tool to send "
                + "to a different chat or to post an update before the turn is over.";
    }

    private String loadBootstrapFiles() {
        StringBuilder sb = new StringBuilder();
        for (String fileName : properties.getPrompts().getBootstrapFiles()) {
            String content = readWorkspaceFile(fileName);
            if (content != null && !content.isBlank()) {
                if (!sb.isEmpty()) {
                    sb.append(DOUBLE_NEWLINE);
                }
                sb.append("## ").append(fileName).append(DOUBLE_NEWLINE).append(content.strip());
            }
        }
        return sb.toString();
    }

    private String readWorkspaceFile(String fileName) {
        try {
            return storagePort.getText(WORKSPACE_ROOT, fileName).join();
        } catch (CompletionException e) {
            log.warn("Failed to read bootstrap file {}: {}", fileName, e.getMessage());
            return null;
        }
    }

    private static String withMedia(String content, List<String> media) {
        String text = content != null ? content : "";
        if (media == null || media.isEmpty()) {
            return text;
        }
        return text + "\n[Attached media: " + String.join(", ", media) + "]";
    }
}
