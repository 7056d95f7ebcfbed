package me.kestrel.agent.adapter.outbound.bus;

import me.kestrel.agent.domain.model.OutboundMessage;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboundDispatcherTest {

    private InMemoryMessageBus bus;
    private ChannelPort cli;
    private OutboundDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
        cli = mock(ChannelPort.class);
        when(cli.getChannelType()).thenReturn("cli");
        when(cli.sendMessage(any())).thenReturn(CompletableFuture.completedFuture(null));
        BotProperties properties = new BotProperties();
        properties.getAgent().setPollTimeout(Duration.ofMillis(20));
        dispatcher = new OutboundDispatcher(bus, List.of(cli), properties);
    }

    @Test
    void dispatchesToMatchingChannel() {
        OutboundMessage message = OutboundMessage.builder().channel("cli").chatId("direct").content("hi").build();

        dispatcher.dispatch(message);

        verify(cli).sendMessage(message);
    }

    @Test
    void dropsMessageForUnknownChannel() {
        dispatcher.dispatch(OutboundMessage.builder().channel("telegram").chatId("1").content("hi").build());

        verify(cli, never()).sendMessage(any());
    }

    @Test
    void survivesDeliveryFailure() {
        when(cli.sendMessage(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("closed")));

        assertDoesNotThrow(() -> dispatcher.dispatch(
                OutboundMessage.builder().channel("cli").chatId("direct").content("hi").build()));
    }

    @Test
    void drainsQueueWhileRunning() {
        dispatcher.start();
        assertTrue(dispatcher.isRunning());

        OutboundMessage message = OutboundMessage.builder().channel("cli").chatId("direct").content("queued").build();
        bus.publishOutbound(message);

        verify(cli, timeout(2000)).sendMessage(message);
        dispatcher.stop();
        assertFalse(dispatcher.isRunning());
    }
}
