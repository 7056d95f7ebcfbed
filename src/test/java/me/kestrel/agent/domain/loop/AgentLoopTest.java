package me.kestrel.agent.domain.loop;

import me.kestrel.agent.domain.component.ContextualTool;
import me.kestrel.agent.domain.model.AgentSession;
import me.kestrel.agent.domain.model.InboundMessage;
import me.kestrel.agent.domain.model.LlmException;
import me.kestrel.agent.domain.model.LlmRequest;
import me.kestrel.agent.domain.model.LlmResponse;
import me.kestrel.agent.domain.model.Message;
import me.kestrel.agent.domain.model.OutboundMessage;
import me.kestrel.agent.domain.model.SessionSnapshot;
import me.kestrel.agent.domain.model.ToolDefinition;
import me.kestrel.agent.domain.model.ToolResult;
import me.kestrel.agent.domain.service.ContextBuilder;
import me.kestrel.agent.domain.service.MemoryConsolidationService;
import me.kestrel.agent.domain.service.ToolRegistry;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.infrastructure.i18n.MessageService;
import me.kestrel.agent.port.outbound.LlmPort;
import me.kestrel.agent.port.outbound.MessageBusPort;
import me.kestrel.agent.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentLoopTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SYSTEM_PROMPT = "system prompt";
    private static final String FALLBACK = "I've completed processing but have no response to give.";
    private static final String APOLOGY = "Sorry, I encountered an internal error. Please try again.";

    private MessageBusPort messageBus;
    private SessionPort sessionService;
    private LlmPort llmPort;
    private ContextBuilder contextBuilder;
    private MemoryConsolidationService consolidationService;
    private BotProperties properties;
    private ToolRegistry toolRegistry;
    private RecordingTool echoTool;
    private final Map<String, AgentSession> sessions = new HashMap<>();
    private AgentLoop agentLoop;

    @BeforeEach
    void setUp() {
        messageBus = mock(MessageBusPort.class);
        sessionService = mock(SessionPort.class);
        llmPort = mock(LlmPort.class);
        contextBuilder = mock(ContextBuilder.class);
        consolidationService = mock(MemoryConsolidationService.class);
        properties = new BotProperties();
        properties.getAgent().setMaxIterations(5);

        echoTool = new RecordingTool();
        toolRegistry = new ToolRegistry(properties, List.of(echoTool));

        when(sessionService.getOrCreate(anyString())).thenAnswer(inv -> sessions.computeIfAbsent(
                inv.getArgument(0), key -> AgentSession.builder().id(key).build()));
        when(sessionService.save(any())).thenReturn(true);
        when(contextBuilder.buildMessages(anyList(), any(), any(), any(), any())).thenAnswer(inv -> {
            List<Message> messages = new ArrayList<>();
            messages.add(Message.system(SYSTEM_PROMPT));
            messages.addAll(inv.getArgument(0));
            messages.add(Message.user(inv.getArgument(1), NOW));
            return messages;
        });

        agentLoop = new AgentLoop(messageBus, sessionService, llmPort, toolRegistry, contextBuilder,
                consolidationService, new MessageService(properties), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static InboundMessage inbound(String content) {
        return InboundMessage.builder()
                .channel("cli")
                .chatId("direct")
                .senderId("user")
                .content(content)
                .timestamp(NOW)
                .build();
    }

    private static LlmResponse text(String content) {
        return LlmResponse.builder().content(content).build();
    }

    private static LlmResponse toolCall(String content, String id, String name, Map<String, Object> args) {
        return LlmResponse.builder()
                .content(content)
                .toolCalls(List.of(Message.ToolCall.builder().id(id).name(name).arguments(args).build()))
                .build();
    }

    @SuppressWarnings("unchecked")
    private void llmReplies(LlmResponse first, LlmResponse... rest) {
        CompletableFuture<LlmResponse>[] futures = new CompletableFuture[rest.length];
        for (int i = 0; i < rest.length; i++) {
            futures[i] = CompletableFuture.completedFuture(rest[i]);
        }
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(first), futures);
    }

    // ===== Plain turns =====

    @Test
    void shouldReplyAndPersistTurn() {
        llmReplies(text("Hello there!"));

        OutboundMessage reply = agentLoop.processMessage(inbound("Hi"));

        assertEquals("cli", reply.getChannel());
        assertEquals("direct", reply.getChatId());
        assertEquals("Hello there!", reply.getContent());

        AgentSession session = sessions.get("cli:direct");
        assertEquals(2, session.getMessages().size());
        assertEquals("Hi", session.getMessages().get(0).getContent());
        assertEquals(Message.ROLE_ASSISTANT, session.getMessages().get(1).getRole());
        assertEquals("Hello there!", session.getMessages().get(1).getContent());
        assertNull(session.getMessages().get(1).getToolsUsed());
        verify(sessionService).save(session);
        verify(consolidationService).scheduleIfNeeded(session);
    }

    @Test
    void shouldPassAttachedMediaToContextAndEmptyListWhenAbsent() {
        llmReplies(text("seen"), text("ok"));
        InboundMessage withMedia = InboundMessage.builder()
                .channel("cli").chatId("direct").senderId("user")
                .content("look").media(List.of("/tmp/a.png")).timestamp(NOW).build();
        InboundMessage withoutMedia = InboundMessage.builder()
                .channel("cli").chatId("direct").senderId("user")
                .content("again").media(null).timestamp(NOW).build();

        agentLoop.processMessage(withMedia);
        agentLoop.processMessage(withoutMedia);

        verify(contextBuilder).buildMessages(anyList(), eq("look"), eq(List.of("/tmp/a.png")), eq("cli"),
                eq("direct"));
        verify(contextBuilder).buildMessages(anyList(), eq("again"), eq(List.of()), eq("cli"), eq("direct"));
    }

    @Test
    void shouldSendConfiguredGenerationParameters() {
        properties.getAgent().setModel("anthropic/claude-sonnet");
        llmReplies(text("ok"));

        agentLoop.processMessage(inbound("Hi"));

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        assertEquals(properties.getAgent().getModel(), request.getValue().getModel());
        assertEquals(List.of("echo"), request.getValue().getTools().stream().map(ToolDefinition::getName).toList());
        assertEquals(SYSTEM_PROMPT, request.getValue().getMessages().get(0).getContent());
    }

    // ===== Tool calling =====

    @Test
    void shouldFeedToolResultsBackWithMatchingCallId() {
        llmReplies(
                toolCall("Let me check", "call_1", "echo", Map.of("text", "ping")),
                text("Echo said pong"));

        OutboundMessage reply = agentLoop.processMessage(inbound("Use echo"));

        assertEquals("Echo said pong", reply.getContent());
        assertEquals(List.of(Map.of("text", "ping")), echoTool.calls);

        ArgumentCaptor<LlmRequest> requests = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(requests.capture());
        List<Message> second = requests.getAllValues().get(1).getMessages();
        assertEquals(5, second.size());
        Message assistant = second.get(2);
        assertEquals(Message.ROLE_ASSISTANT, assistant.getRole());
        assertEquals("Let me check", assistant.getContent());
        assertEquals("call_1", assistant.getToolCalls().get(0).getId());
        Message toolMessage = second.get(3);
        assertEquals(Message.ROLE_TOOL, toolMessage.getRole());
        assertEquals("call_1", toolMessage.getToolCallId());
        assertEquals("echo", toolMessage.getToolName());
        assertEquals("pong: ping", toolMessage.getContent());
        assertEquals(Message.ROLE_USER, second.get(4).getRole());
        assertEquals(AgentLoop.STEERING_PROMPT, second.get(4).getContent());

        List<Message> history = sessions.get("cli:direct").getMessages();
        assertEquals(2, history.size());
        assertEquals(List.of("echo"), history.get(1).getToolsUsed());
    }

    @Test
    void shouldExecuteMultipleToolCallsInOrder() {
        LlmResponse threeCalls = LlmResponse.builder()
                .toolCalls(List.of(
                        Message.ToolCall.builder().id("a").name("echo").arguments(Map.of("text", "1")).build(),
                        Message.ToolCall.builder().id("b").name("missing").arguments(Map.of()).build(),
                        Message.ToolCall.builder().id("c").name("echo").arguments(Map.of("text", "3")).build()))
                .build();
        llmReplies(threeCalls, text("done"));

        agentLoop.processMessage(inbound("go"));

        ArgumentCaptor<LlmRequest> requests = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(requests.capture());
        List<Message> second = requests.getAllValues().get(1).getMessages();
        assertEquals("a", second.get(3).getToolCallId());
        assertEquals("pong: 1", second.get(3).getContent());
        assertEquals("b", second.get(4).getToolCallId());
        assertEquals("Error: Tool 'missing' not found", second.get(4).getContent());
        assertEquals("c", second.get(5).getToolCallId());
        assertEquals("pong: 3", second.get(5).getContent());
        assertEquals(List.of("echo", "missing", "echo"),
                sessions.get("cli:direct").getMessages().get(1).getToolsUsed());
    }

    @Test
    void shouldStopAtMaxIterationsWithLastContent() {
        properties.getAgent().setMaxIterations(3);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                toolCall("still working", "call", "echo", Map.of("text", "x"))));

        OutboundMessage reply = agentLoop.processMessage(inbound("loop forever"));

        verify(llmPort, times(3)).chat(any());
        assertEquals("still working", reply.getContent());
        assertEquals(3, echoTool.calls.size());
    }

    @Test
    void shouldUseFallbackWhenNoContentAfterMaxIterations() {
        properties.getAgent().setMaxIterations(2);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                toolCall(null, "call", "echo", Map.of("text", "x"))));

        OutboundMessage reply = agentLoop.processMessage(inbound("loop"));

        verify(llmPort, times(2)).chat(any());
        assertEquals(FALLBACK, reply.getContent());
        assertEquals(FALLBACK, sessions.get("cli:direct").getMessages().get(1).getContent());
    }

    @Test
    void shouldUseFallbackForBlankReply() {
        llmReplies(text("   "));

        assertEquals(FALLBACK, agentLoop.processMessage(inbound("Hi")).getContent());
    }

    // ===== Commands =====

    @Test
    void shouldAnswerHelpWithoutModel() {
        OutboundMessage reply = agentLoop.processMessage(inbound("  /HELP "));

        assertTrue(reply.getContent().contains("/new - Start a new conversation"));
        assertTrue(reply.getContent().contains("/help - Show available commands"));
        verify(llmPort, never()).chat(any());
        assertTrue(sessions.get("cli:direct").getMessages().isEmpty());
    }

    @Test
    void shouldResetSessionAndArchiveSnapshotOnNew() {
        AgentSession session = sessionService.getOrCreate("cli:direct");
        session.addMessage(Message.user("old question", NOW));
        session.addMessage(Message.builder().role(Message.ROLE_ASSISTANT).content("old answer").build());

        OutboundMessage reply = agentLoop.processMessage(inbound("/new"));

        assertEquals("New session started. Memory consolidation in progress.", reply.getContent());
        assertTrue(session.getMessages().isEmpty());
        assertEquals(0, session.getLastConsolidated());
        assertEquals(1, session.getEpoch());
        verify(sessionService).save(session);
        verify(sessionService).invalidate("cli:direct");

        ArgumentCaptor<SessionSnapshot> snapshot = ArgumentCaptor.forClass(SessionSnapshot.class);
        verify(consolidationService).scheduleArchiveAll(eq("cli:direct"), snapshot.capture());
        assertEquals(2, snapshot.getValue().size());
        assertEquals(0, snapshot.getValue().epoch());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldKeepClearedSessionCachedWhenResetIsNotPersisted() {
        AgentSession session = sessionService.getOrCreate("cli:direct");
        session.addMessage(Message.user("old question", NOW));
        when(sessionService.save(session)).thenReturn(false);

        OutboundMessage reply = agentLoop.processMessage(inbound("/new"));

        assertEquals("New session started. Memory consolidation in progress.", reply.getContent());
        assertTrue(session.getMessages().isEmpty());
        verify(sessionService, never()).invalidate(anyString());
        verify(consolidationService).scheduleArchiveAll(eq("cli:direct"), any(SessionSnapshot.class));
    }

    @Test
    void shouldProcessMessageRightAfterNewOnFreshSession() {
        AgentSession old = sessionService.getOrCreate("cli:direct");
        old.addMessage(Message.user("old question", NOW));
        when(sessionService.getOrCreate("cli:direct"))
                .thenReturn(old)
                .thenReturn(AgentSession.builder().id("cli:direct").epoch(1).build());
        llmReplies(text("fresh answer"));

        agentLoop.processMessage(inbound("/new"));
        OutboundMessage reply = agentLoop.processMessage(inbound("new topic"));

        assertEquals("fresh answer", reply.getContent());
        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        assertEquals(2, request.getValue().getMessages().size());
        ArgumentCaptor<SessionSnapshot> snapshot = ArgumentCaptor.forClass(SessionSnapshot.class);
        verify(consolidationService).scheduleArchiveAll(eq("cli:direct"), snapshot.capture());
        assertEquals("old question", snapshot.getValue().messages().get(0).getContent());
        assertEquals(1, snapshot.getValue().size());
    }

    // ===== System messages =====

    @Test
    void shouldRouteSystemMessageToOrigin() {
        llmReplies(text("Task summary for the user"));
        InboundMessage system = InboundMessage.builder()
                .channel(InboundMessage.SYSTEM_CHANNEL)
                .senderId("subagent")
                .chatId("telegram:42")
                .content("research finished")
                .build();

        OutboundMessage reply = agentLoop.processMessage(system);

        assertEquals("telegram", reply.getChannel());
        assertEquals("42", reply.getChatId());
        assertEquals("Task summary for the user", reply.getContent());
        List<Message> history = sessions.get("telegram:42").getMessages();
        assertEquals("[System: subagent] research finished", history.get(0).getContent());
        assertFalse(sessions.containsKey("system:telegram:42"));
        verify(contextBuilder).buildMessages(anyList(), eq("research finished"), any(), eq("telegram"), eq("42"));
    }

    @Test
    void shouldRouteSystemMessageWithoutSeparatorToCli() {
        llmReplies(text(""));
        InboundMessage system = InboundMessage.builder()
                .channel(InboundMessage.SYSTEM_CHANNEL)
                .senderId("cron")
                .chatId("direct")
                .content("tick")
                .build();

        OutboundMessage reply = agentLoop.processMessage(system);

        assertEquals("cli", reply.getChannel());
        assertEquals("direct", reply.getChatId());
        assertEquals("Background task completed.", reply.getContent());
        assertTrue(sessions.containsKey("cli:direct"));
    }

    @Test
    void shouldSetToolContextBeforeTurn() {
        llmReplies(text("ok"));

        agentLoop.processMessage(InboundMessage.builder().channel("telegram").chatId("7").senderId("u")
                .content("hi").build());

        assertEquals("telegram", echoTool.channel);
        assertEquals("7", echoTool.chatId);
    }

    @Test
    void shouldCopyInboundMetadataToReply() {
        llmReplies(text("ok"));
        InboundMessage message = InboundMessage.builder().channel("cli").chatId("direct").senderId("user")
                .content("hi").metadata(Map.of("message_id", 99)).build();

        assertEquals(Map.of("message_id", 99), agentLoop.processMessage(message).getMetadata());
    }

    @Test
    void shouldPropagateProviderFailureFromProcessMessage() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new LlmException("provider down")));

        LlmException error = assertThrows(LlmException.class, () -> agentLoop.processMessage(inbound("Hi")));

        assertEquals("provider down", error.getMessage());
        assertTrue(sessions.get("cli:direct").getMessages().isEmpty());
        verify(sessionService, never()).save(any());
    }

    // ===== Bus loop and direct calls =====

    @Test
    void runShouldPublishReplyAndApologizeOnFailure() throws InterruptedException {
        InboundMessage ok = inbound("first");
        InboundMessage broken = inbound("second");
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(text("answer")))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("socket closed")));
        when(messageBus.consumeInbound(any()))
                .thenReturn(Optional.of(ok))
                .thenReturn(Optional.of(broken))
                .thenAnswer(inv -> {
                    agentLoop.stop();
                    return Optional.empty();
                });

        agentLoop.run();

        ArgumentCaptor<OutboundMessage> published = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(messageBus, times(2)).publishOutbound(published.capture());
        assertEquals("answer", published.getAllValues().get(0).getContent());
        OutboundMessage apology = published.getAllValues().get(1);
        assertEquals(APOLOGY, apology.getContent());
        assertEquals("cli", apology.getChannel());
        assertEquals("direct", apology.getChatId());
        assertFalse(agentLoop.isRunning());
    }

    @Test
    void processDirectShouldUseDefaultSession() {
        llmReplies(text("direct answer"));

        assertEquals("direct answer", agentLoop.processDirect("hello"));
        assertEquals(2, sessions.get("cli:direct").getMessages().size());
    }

    @Test
    void processDirectShouldHonorCustomSessionKey() {
        llmReplies(text("scoped"));

        assertEquals("scoped", agentLoop.processDirect("hello", "api:job-7", "cli", "direct"));
        assertTrue(sessions.containsKey("api:job-7"));
        assertFalse(sessions.containsKey("cli:direct"));
    }

    static class RecordingTool implements ContextualTool {
        final List<Map<String, Object>> calls = new ArrayList<>();
        String channel;
        String chatId;

        @Override
        public void setContext(String channel, String chatId) {
            this.channel = channel;
            this.chatId = chatId;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder()
                    .name("echo")
                    .description("Echo text back")
                    .inputSchema(Map.of(
                            "type", "object",
                            "properties", Map.of("text", Map.of("type", "string")),
                            "required", List.of("text")))
                    .build();
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            calls.add(parameters);
            return CompletableFuture.completedFuture(ToolResult.success("pong: " + parameters.get("text")));
        }
    }
}
