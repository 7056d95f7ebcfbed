package me.kestrel.agent.domain.service;

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
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryConsolidationServiceTest {

    private static final String KEY = "cli:direct";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration AWAIT = Duration.ofSeconds(5);
    private static final String GOOD_REPLY = "{\"history_entry\": \"[2026-03-01 10:00] Talked about tea.\", "
            + "\"memory_update\": \"- likes tea\"}";

    private LlmPort llmPort;
    private MemoryComponent memory;
    private SessionPort sessionPort;
    private BackgroundTaskSupervisor supervisor;
    private BotProperties properties;
    private MemoryConsolidationService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        memory = mock(MemoryComponent.class);
        sessionPort = mock(SessionPort.class);
        properties = new BotProperties();
        properties.getAgent().setMemoryWindow(50);
        supervisor = new BackgroundTaskSupervisor(properties);
        when(memory.readLongTerm()).thenReturn("");
        service = new MemoryConsolidationService(llmPort, memory, sessionPort, supervisor, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown(Duration.ofSeconds(1));
    }

    private static AgentSession sessionWith(int count) {
        AgentSession session = AgentSession.builder().id(KEY).build();
        for (int i = 0; i < count; i++) {
            session.addMessage(Message.user("m" + i, NOW));
        }
        return session;
    }

    private void replyWith(String content) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).build()));
    }

    // ===== Reactive consolidation =====

    @Test
    void shouldConsolidateOldestMessagesAndCommitCursor() {
        replyWith(GOOD_REPLY);
        AgentSession session = sessionWith(51);

        assertTrue(service.scheduleIfNeeded(session));
        assertTrue(supervisor.awaitAll(AWAIT));

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(1)).chat(request.capture());
        String prompt = request.getValue().getMessages().get(1).getContent();
        assertTrue(prompt.contains("[2026-03-01T10:00] USER: m0\n"), prompt);
        assertTrue(prompt.contains("USER: m25\n"), prompt);
        assertFalse(prompt.contains("USER: m26"), prompt);
        assertTrue(prompt.contains("## Current Long-term Memory\n(empty)"), prompt);
        assertEquals(MemoryConsolidationService.SYSTEM_PROMPT, request.getValue().getMessages().get(0).getContent());

        verify(memory).appendHistory("[2026-03-01 10:00] Talked about tea.");
        verify(memory).writeLongTerm("- likes tea");
        verify(sessionPort).commitConsolidation(KEY, 0L, 26);
    }

    @Test
    void shouldNotScheduleWithinWindow() {
        assertFalse(service.scheduleIfNeeded(sessionWith(50)));

        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldCountOnlyMessagesPastCursor() {
        AgentSession session = sessionWith(60);
        session.setLastConsolidated(20);

        assertFalse(service.scheduleIfNeeded(session));
    }

    @Test
    void shouldNotScheduleWhenDisabled() {
        properties.getConsolidation().setEnabled(false);

        assertFalse(service.scheduleIfNeeded(sessionWith(80)));
        assertFalse(service.scheduleArchiveAll(KEY, sessionWith(3).snapshot()));
    }

    @Test
    void shouldKeepCursorWhenLlmFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        assertTrue(service.scheduleIfNeeded(sessionWith(51)));
        assertTrue(supervisor.awaitAll(AWAIT));

        verify(sessionPort, never()).commitConsolidation(anyString(), anyLong(), anyInt());
        verify(memory, never()).appendHistory(anyString());
        verify(memory, never()).writeLongTerm(anyString());
    }

    @Test
    void shouldKeepCursorWhenReplyIsNotJson() {
        replyWith("Sorry, I cannot help with that.");

        OptionalInt cursor = service.consolidate(sessionWith(51).snapshot(), false);

        assertTrue(cursor.isEmpty());
        verify(memory, never()).appendHistory(anyString());
    }

    @Test
    void shouldKeepCursorWhenWritingMemoryFails() {
        replyWith(GOOD_REPLY);
        doThrow(new IllegalStateException("disk full")).when(memory).writeLongTerm(anyString());

        assertTrue(service.consolidate(sessionWith(51).snapshot(), false).isEmpty());
    }

    @Test
    void shouldNotRewriteUnchangedMemory() {
        when(memory.readLongTerm()).thenReturn("- likes tea");
        replyWith(GOOD_REPLY);

        OptionalInt cursor = service.consolidate(sessionWith(51).snapshot(), false);

        assertEquals(26, cursor.getAsInt());
        verify(memory, never()).writeLongTerm(anyString());
        verify(memory).appendHistory(anyString());
    }

    @Test
    void shouldStartFromExistingCursor() {
        replyWith(GOOD_REPLY);
        AgentSession session = sessionWith(80);
        session.setLastConsolidated(26);

        assertEquals(55, service.consolidate(session.snapshot(), false).getAsInt());

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        String prompt = request.getValue().getMessages().get(1).getContent();
        assertFalse(prompt.contains("USER: m25\n"), prompt);
        assertTrue(prompt.contains("USER: m26\n"), prompt);
        assertTrue(prompt.contains("USER: m54\n"), prompt);
        assertFalse(prompt.contains("USER: m55"), prompt);
    }

    // ===== Archive all =====

    @Test
    void archiveAllShouldSummarizeEverythingWithoutCommitting() {
        replyWith(GOOD_REPLY);
        SessionSnapshot snapshot = sessionWith(3).snapshot();

        assertTrue(service.scheduleArchiveAll(KEY, snapshot));
        assertTrue(supervisor.awaitAll(AWAIT));

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        String prompt = request.getValue().getMessages().get(1).getContent();
        assertTrue(prompt.contains("USER: m0") && prompt.contains("USER: m2"), prompt);
        verify(memory).appendHistory(anyString());
        verify(sessionPort, never()).commitConsolidation(anyString(), anyLong(), anyInt());
    }

    @Test
    void archiveAllShouldRunInlineWhenNoBackgroundSlotIsFree() throws Exception {
        supervisor.shutdown(Duration.ofSeconds(1));
        properties.getBackground().setMaxInFlight(1);
        supervisor = new BackgroundTaskSupervisor(properties);
        service = new MemoryConsolidationService(llmPort, memory, sessionPort, supervisor, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        CountDownLatch release = new CountDownLatch(1);
        assertTrue(supervisor.submit("blocker", () -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        replyWith(GOOD_REPLY);
        AgentSession session = AgentSession.builder().id(KEY).build();
        session.addMessage(Message.user("precious fact", NOW));

        try {
            assertTrue(service.scheduleArchiveAll(KEY, session.snapshot()));

            ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
            verify(llmPort).chat(request.capture());
            assertTrue(request.getValue().getMessages().get(1).getContent().contains("precious fact"));
            verify(memory).appendHistory("[2026-03-01 10:00] Talked about tea.");
            assertEquals(1, supervisor.inFlightCount());
        } finally {
            release.countDown();
        }
    }

    @Test
    void archiveAllShouldSkipEmptySnapshot() {
        assertFalse(service.scheduleArchiveAll(KEY, sessionWith(0).snapshot()));
    }

    @Test
    void shouldRunOneReactiveJobPerSession() {
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any())).thenReturn(pending);
        AgentSession session = sessionWith(51);

        assertTrue(service.scheduleIfNeeded(session));
        assertFalse(service.scheduleIfNeeded(session));

        pending.complete(LlmResponse.builder().content(GOOD_REPLY).build());
        assertTrue(supervisor.awaitAll(AWAIT));
        verify(llmPort, times(1)).chat(any());

        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(GOOD_REPLY).build()));
        assertTrue(service.scheduleIfNeeded(session));
        assertTrue(supervisor.awaitAll(AWAIT));
    }

    // ===== Helpers =====

    @Test
    void buildTranscript_formatsRolesToolsAndTimestamps() {
        List<Message> slice = List.of(
                Message.user("hello", NOW),
                Message.builder().role(Message.ROLE_ASSISTANT).content("found it")
                        .toolsUsed(List.of("web_search", "web_fetch")).timestamp(NOW).build(),
                Message.builder().role(Message.ROLE_ASSISTANT).content("").timestamp(NOW).build(),
                Message.builder().role(Message.ROLE_USER).content("no time").build());

        assertEquals("[2026-03-01T10:00] USER: hello\n"
                + "[2026-03-01T10:00] ASSISTANT [tools: web_search, web_fetch]: found it\n"
                + "[?] USER: no time", service.buildTranscript(slice));
    }

    @Test
    void parseLenient_acceptsFencedAndSloppyJson() {
        JsonNode fenced = MemoryConsolidationService.parseLenient("```json\n{\"history_entry\": \"a\"}\n```");
        JsonNode prose = MemoryConsolidationService.parseLenient("Here you go: {\"memory_update\": \"b\"} Done.");
        JsonNode sloppy = MemoryConsolidationService.parseLenient("{'history_entry': 'c', memory_update: 'd',}");

        assertEquals("a", fenced.get("history_entry").asText());
        assertEquals("b", prose.get("memory_update").asText());
        assertEquals("c", sloppy.get("history_entry").asText());
        assertEquals("d", sloppy.get("memory_update").asText());
    }

    @Test
    void parseLenient_returnsNullForGarbage() {
        assertNull(MemoryConsolidationService.parseLenient("{ this is not json"));
    }
}
