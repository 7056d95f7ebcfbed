package me.kestrel.agent.tools;

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

import me.kestrel.agent.domain.component.ContextualTool;
import me.kestrel.agent.domain.model.OutboundMessage;
import me.kestrel.agent.domain.model.ToolDefinition;
import me.kestrel.agent.domain.model.ToolResult;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.outbound.MessageBusPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool that lets the LLM push a message to a chat before the turn finishes.
 *
 * <p>
 * The target defaults to the chat of the turn being processed. The agent loop
 * updates that default through {@link #setContext(String, String)} before each
 * turn; turns are processed one at a time so a single instance is enough.
 */
@Component
@Slf4j
public class MessageTool implements ContextualTool {

    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_CHANNEL = "channel";
    private static final String PARAM_CHAT_ID = "chat_id";

    private final MessageBusPort messageBus;
    private final boolean enabled;

    private volatile String defaultChannel = "";
    private volatile String defaultChatId = "";

    public MessageTool(MessageBusPort messageBus, BotProperties properties) {
        this.messageBus = messageBus;
        this.enabled = properties.getTools().getMessage().isEnabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setContext(String channel, String chatId) {
        this.defaultChannel = channel;
        this.defaultChatId = chatId;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("message")
                .description("Send a message to the user. Use this when you want to communicate something.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_CONTENT, Map.of(
                                        "type", "string",
                                        "description", "The message content to send"),
                                PARAM_CHANNEL, Map.of(
                                        "type", "string",
                                        "description", "Optional: target channel (cli, telegram, etc.)"),
                                PARAM_CHAT_ID, Map.of(
                                        "type", "string",
                                        "description", "Optional: target chat/user ID")),
                        "required", List.of(PARAM_CONTENT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String content = String.valueOf(parameters.get(PARAM_CONTENT));
        String channel = stringOr(parameters.get(PARAM_CHANNEL), defaultChannel);
        String chatId = stringOr(parameters.get(PARAM_CHAT_ID), defaultChatId);

        if (channel.isEmpty() || chatId.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.failure("No target channel/chat specified"));
        }

        messageBus.publishOutbound(OutboundMessage.builder()
                .channel(channel)
                .chatId(chatId)
                .content(content)
                .build());
        log.debug("[Message] Queued {} chars for {}:{}", content.length(), channel, chatId);
        return CompletableFuture.completedFuture(ToolResult.success("Message sent to " + channel + ":" + chatId));
    }

    private static String stringOr(Object value, String fallback) {
        if (value instanceof String s && !s.isBlank()) {
            return s;
        }
        return fallback != null ? fallback : "";
    }
}
