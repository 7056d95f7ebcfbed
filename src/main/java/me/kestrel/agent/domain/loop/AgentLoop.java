package me.kestrel.agent.domain.loop;

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
import me.kestrel.agent.domain.component.ToolComponent;
import me.kestrel.agent.domain.model.AgentSession;
import me.kestrel.agent.domain.model.InboundMessage;
import me.kestrel.agent.domain.model.LlmException;
import me.kestrel.agent.domain.model.LlmRequest;
import me.kestrel.agent.domain.model.LlmResponse;
import me.kestrel.agent.domain.model.Message;
import me.kestrel.agent.domain.model.OutboundMessage;
import me.kestrel.agent.domain.model.SessionSnapshot;
import me.kestrel.agent.domain.service.ContextBuilder;
import me.kestrel.agent.domain.service.MemoryConsolidationService;
import me.kestrel.agent.domain.service.ToolRegistry;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.infrastructure.i18n.MessageService;
import me.kestrel.agent.port.outbound.LlmPort;
import me.kestrel.agent.port.outbound.MessageBusPort;
import me.kestrel.agent.port.outbound.SessionPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Core processing engine: consumes inbound messages from the bus, runs the
 * bounded LLM/tool iteration for each one and publishes the reply.
 *
 * <p>
 * One turn goes like this: the session is loaded, the context (system prompt,
 * recent history, user message) is built, and the model is called repeatedly.
 * Whenever the model asks for tools they are executed in order through the
 * {@link ToolRegistry}, their results are appended as tool messages and the
 * model is called again. The turn ends when the model answers without tool
 * calls or after {@code bot.agent.max-iterations} calls. The user message and
 * the final answer are then saved to the session and consolidation may be
 * detached.
 *
 * <p>
 * {@code /new} and {@code /help} are answered without calling the model.
 * Messages on the {@code system} channel are replies from background work; they
 * are routed back to the conversation named in their chat id
 * ({@code origin_channel:origin_chat_id}).
 */
@Component
@Slf4j
public class AgentLoop {

    static final String STEERING_PROMPT = "Reflect on the results and decide next steps.";
    static final String CMD_NEW = "/new";
    static final String CMD_HELP = "/help";
    private static final String DEFAULT_ORIGIN_CHANNEL = "cli";
    private static final String DIRECT_SESSION_KEY = "cli:direct";
    private static final String DIRECT_CHAT_ID = "direct";
    private static final int LOG_PREVIEW_CHARS = 120;

    private final MessageBusPort messageBus;
    private final SessionPort sessionService;
    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final ContextBuilder contextBuilder;
    private final MemoryConsolidationService consolidationService;
    private final MessageService messageService;
    private final BotProperties.AgentProperties agentConfig;
    private final Duration requestTimeout;
    private final Clock clock;

    private volatile boolean running;

    public AgentLoop(MessageBusPort messageBus, SessionPort sessionService, LlmPort llmPort,
            ToolRegistry toolRegistry, ContextBuilder contextBuilder,
            MemoryConsolidationService consolidationService, MessageService messageService,
            BotProperties properties, Clock clock) {
        this.messageBus = messageBus;
        this.sessionService = sessionService;
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.contextBuilder = contextBuilder;
        this.consolidationService = consolidationService;
        this.messageService = messageService;
        this.agentConfig = properties.getAgent();
        this.requestTimeout = properties.getLlm().getRequestTimeout();
        this.clock = clock;
    }

    /**
     * Consumes the inbound queue until {@link #stop()} is called. Blocks the
     * calling thread.
     */
    public void run() {
        running = true;
        log.info("[AgentLoop] Started (model: {}, max iterations: {})", agentConfig.getModel(),
                agentConfig.getMaxIterations());

        while (running) {
            Optional<InboundMessage> next;
            try {
                next = messageBus.consumeInbound(agentConfig.getPollTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[AgentLoop] Interrupted, leaving loop");
                break;
            }
            next.ifPresent(this::handle);
        }
        running = false;
        log.info("[AgentLoop] Stopped");
    }

    /**
     * Stops taking new messages. The turn in progress, if any, completes.
     */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    private void handle(InboundMessage message) {
        try {
            OutboundMessage reply = processMessage(message);
            if (reply != null) {
                messageBus.publishOutbound(reply);
            }
        } catch (RuntimeException e) {
            log.error("[AgentLoop] Error processing message from {}:{}", message.getChannel(),
                    message.getChatId(), e);
            messageBus.publishOutbound(OutboundMessage.builder()
                    .channel(message.getChannel())
                    .chatId(message.getChatId())
                    .content(messageService.getMessage("agent.error"))
                    .build());
        }
    }

    /**
     * Processes one inbound message end to end.
     *
     * @return the reply, or null when there is nothing to send
     * @throws LlmException
     *             if the provider fails
     */
    public OutboundMessage processMessage(InboundMessage message) {
        if (message.isSystemMessage()) {
            return processSystemMessage(message);
        }

        log.info("[AgentLoop] Processing message from {}:{}", message.getChannel(), message.getSenderId());
        log.debug("[AgentLoop] Content: {}", truncate(message.getContent()));

        String sessionKey = message.sessionKey();
        AgentSession session = sessionService.getOrCreate(sessionKey);

        String command = message.getContent() != null
                ? message.getContent().trim().toLowerCase(Locale.ROOT)
                : "";
        if (CMD_NEW.equals(command)) {
            return startNewSession(message, session);
        }
        if (CMD_HELP.equals(command)) {
            return reply(message, messageService.getMessage("command.help"));
        }

        setToolContext(message.getChannel(), message.getChatId());
        List<String> media = message.hasMedia() ? message.getMedia() : List.of();
        if (!media.isEmpty()) {
            log.debug("[AgentLoop] {} media attachment(s) from {}", media.size(), message.getSenderId());
        }
        List<Message> initialMessages = contextBuilder.buildMessages(
                session.getHistory(agentConfig.getMemoryWindow()),
                message.getContent(),
                media,
                message.getChannel(),
                message.getChatId());

        TurnResult turn = runIterations(initialMessages);
        String finalContent = orFallback(turn.content(), messageService.getMessage("agent.fallback"));
        log.info("[AgentLoop] Response to {}:{}: {}", message.getChannel(), message.getSenderId(),
                truncate(finalContent));

        session.addMessage(Message.user(message.getContent(), clock.instant()));
        session.addMessage(assistantTurn(finalContent, turn.toolsUsed()));
        sessionService.save(session);
        consolidationService.scheduleIfNeeded(session);

        return OutboundMessage.builder()
                .channel(message.getChannel())
                .chatId(message.getChatId())
                .content(finalContent)
                .metadata(message.getMetadata() != null ? message.getMetadata() : Map.of())
                .build();
    }

    /**
     * Processes a message without going through the bus, for the CLI and
     * programmatic callers.
     *
     * @return the reply text, empty if there is none
     */
    public String processDirect(String content, String sessionKey, String channel, String chatId) {
        InboundMessage.InboundMessageBuilder builder = InboundMessage.builder()
                .channel(channel)
                .chatId(chatId)
                .senderId("user")
                .content(content)
                .timestamp(clock.instant());
        if (sessionKey != null && !sessionKey.equals(channel + ":" + chatId)) {
            builder.sessionKeyOverride(sessionKey);
        }
        OutboundMessage response = processMessage(builder.build());
        return response != null && response.getContent() != null ? response.getContent() : "";
    }

    public String processDirect(String content) {
        return processDirect(content, DIRECT_SESSION_KEY, DEFAULT_ORIGIN_CHANNEL, DIRECT_CHAT_ID);
    }

    private OutboundMessage startNewSession(InboundMessage message, AgentSession session) {
        SessionSnapshot snapshot = session.snapshot();
        session.clear();
        if (sessionService.save(session)) {
            sessionService.invalidate(session.getId());
        } else {
            // a reload would bring back the stored history
            log.warn("[AgentLoop] Session {} reset not persisted, keeping the cleared instance cached",
                    session.getId());
        }
        boolean archived = consolidationService.scheduleArchiveAll(session.getId(), snapshot);
        log.info("[AgentLoop] Session {} reset, {} messages {}", session.getId(), snapshot.size(),
                archived ? "archived" : "not archived");
        return reply(message, messageService.getMessage("command.new.done"));
    }

    private OutboundMessage processSystemMessage(InboundMessage message) {
        log.info("[AgentLoop] Processing system message from {}", message.getSenderId());

        String originChannel = DEFAULT_ORIGIN_CHANNEL;
        String originChatId = message.getChatId();
        int separator = message.getChatId() != null ? message.getChatId().indexOf(':') : -1;
        if (separator >= 0) {
            originChannel = message.getChatId().substring(0, separator);
            originChatId = message.getChatId().substring(separator + 1);
        }

        AgentSession session = sessionService.getOrCreate(originChannel + ":" + originChatId);
        setToolContext(originChannel, originChatId);
        List<Message> initialMessages = contextBuilder.buildMessages(
                session.getHistory(agentConfig.getMemoryWindow()),
                message.getContent(),
                List.of(),
                originChannel,
                originChatId);

        TurnResult turn = runIterations(initialMessages);
        String finalContent = orFallback(turn.content(), messageService.getMessage("agent.system.default"));

        session.addMessage(Message.user("[System: " + message.getSenderId() + "] " + message.getContent(),
                clock.instant()));
        session.addMessage(assistantTurn(finalContent, turn.toolsUsed()));
        sessionService.save(session);
        consolidationService.scheduleIfNeeded(session);

        return OutboundMessage.builder()
                .channel(originChannel)
                .chatId(originChatId)
                .content(finalContent)
                .build();
    }

    TurnResult runIterations(List<Message> initialMessages) {
        List<Message> messages = new ArrayList<>(initialMessages);
        List<String> toolsUsed = new ArrayList<>();
        String lastContent = null;
        int maxIterations = agentConfig.getMaxIterations();

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            log.debug("[AgentLoop] --- Iteration {}/{} ---", iteration, maxIterations);
            LlmResponse response = callLlm(messages);

            if (!response.hasToolCalls()) {
                return new TurnResult(response.getContent(), toolsUsed);
            }
            lastContent = response.getContent();

            messages.add(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(response.getContent())
                    .toolCalls(response.getToolCalls())
                    .reasoningContent(response.getReasoningContent())
                    .timestamp(clock.instant())
                    .build());

            for (Message.ToolCall toolCall : response.getToolCalls()) {
                toolsUsed.add(toolCall.getName());
                log.info("[AgentLoop] Tool call: {}({})", toolCall.getName(), truncate(String.valueOf(
                        toolCall.getArguments())));
                String result = toolRegistry.execute(toolCall.getName(),
                        toolCall.getArguments() != null ? toolCall.getArguments() : Map.of());
                messages.add(Message.builder()
                        .role(Message.ROLE_TOOL)
                        .toolCallId(toolCall.getId())
                        .toolName(toolCall.getName())
                        .content(result)
                        .timestamp(clock.instant())
                        .build());
            }
            messages.add(Message.user(STEERING_PROMPT, clock.instant()));
        }

        log.warn("[AgentLoop] Reached max iterations limit ({})", maxIterations);
        return new TurnResult(lastContent, toolsUsed);
    }

    private LlmResponse callLlm(List<Message> messages) {
        LlmRequest request = LlmRequest.builder()
                .model(agentConfig.getModel())
                .messages(List.copyOf(messages))
                .tools(toolRegistry.getDefinitions())
                .temperature(agentConfig.getTemperature())
                .maxTokens(agentConfig.getMaxTokens())
                .build();
        try {
            LlmResponse response = llmPort.chat(request).get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response == null) {
                throw new LlmException("LLM returned no response");
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("LLM call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LlmException llmException) {
                throw llmException;
            }
            throw new LlmException("LLM call failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new LlmException("LLM call timed out after " + requestTimeout.toSeconds() + "s", e);
        }
    }

    private void setToolContext(String channel, String chatId) {
        for (ToolComponent tool : toolRegistry.getTools()) {
            if (tool instanceof ContextualTool contextual) {
                contextual.setContext(channel, chatId);
            }
        }
    }

    private Message assistantTurn(String content, List<String> toolsUsed) {
        return Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .toolsUsed(toolsUsed.isEmpty() ? null : List.copyOf(toolsUsed))
                .timestamp(clock.instant())
                .build();
    }

    private static OutboundMessage reply(InboundMessage message, String content) {
        return OutboundMessage.builder()
                .channel(message.getChannel())
                .chatId(message.getChatId())
                .content(content)
                .build();
    }

    private static String orFallback(String content, String fallback) {
        return content != null && !content.isBlank() ? content : fallback;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "<null>";
        }
        if (text.length() <= LOG_PREVIEW_CHARS) {
            return text;
        }
        return text.substring(0, LOG_PREVIEW_CHARS) + "...";
    }

    record TurnResult(String content, List<String> toolsUsed) {
    }
}
