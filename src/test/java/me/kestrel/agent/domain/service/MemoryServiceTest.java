package me.kestrel.agent.domain.service;

import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryServiceTest {

    private StoragePort storagePort;
    private MemoryService memoryService;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        memoryService = new MemoryService(storagePort, new BotProperties());
    }

    @Test
    void readLongTerm_returnsEmptyWhenMissing() {
        when(storagePort.getText("memory", "MEMORY.md")).thenReturn(CompletableFuture.completedFuture(null));

        assertEquals("", memoryService.readLongTerm());
        assertEquals("", memoryService.getMemoryContext());
    }

    @Test
    void readLongTerm_returnsEmptyWhenUnreadable() {
        when(storagePort.getText("memory", "MEMORY.md"))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("denied"))));

        assertEquals("", memoryService.readLongTerm());
    }

    @Test
    void getMemoryContext_wrapsContent() {
        when(storagePort.getText("memory", "MEMORY.md"))
                .thenReturn(CompletableFuture.completedFuture("- likes tea"));

        assertEquals("## Long-term Memory\n- likes tea", memoryService.getMemoryContext());
    }

    @Test
    void writeLongTerm_writesAtomically() {
        when(storagePort.putTextAtomic("memory", "MEMORY.md", "facts"))
                .thenReturn(CompletableFuture.completedFuture(null));

        memoryService.writeLongTerm("facts");

        verify(storagePort).putTextAtomic("memory", "MEMORY.md", "facts");
    }

    @Test
    void writeLongTerm_propagatesFailure() {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));

        assertThrows(CompletionException.class, () -> memoryService.writeLongTerm("facts"));
    }

    @Test
    void appendHistory_separatesEntriesWithBlankLine() {
        when(storagePort.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        memoryService.appendHistory("[2026-03-01 10:00] User asked about tea.\n\n\n");

        verify(storagePort).appendText("memory", "HISTORY.md", "[2026-03-01 10:00] User asked about tea.\n\n");
    }
}
