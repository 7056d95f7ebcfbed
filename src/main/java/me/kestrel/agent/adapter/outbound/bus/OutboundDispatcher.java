package me.kestrel.agent.adapter.outbound.bus;

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

import me.kestrel.agent.domain.model.OutboundMessage;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.inbound.ChannelPort;
import me.kestrel.agent.port.outbound.MessageBusPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drains the outbound queue and hands each message to the channel adapter
 * whose type matches {@link OutboundMessage#getChannel()}. Messages for an
 * unknown channel are logged and dropped.
 */
@Component
@Slf4j
public class OutboundDispatcher {

    private static final long JOIN_TIMEOUT_MS = 5000;

    private final MessageBusPort messageBus;
    private final Map<String, ChannelPort> channels = new HashMap<>();
    private final Duration pollTimeout;

    private volatile boolean running;
    private Thread worker;

    public OutboundDispatcher(MessageBusPort messageBus, List<ChannelPort> channelPorts, BotProperties properties) {
        this.messageBus = messageBus;
        for (ChannelPort port : channelPorts) {
            channels.put(port.getChannelType(), port);
        }
        this.pollTimeout = properties.getAgent().getPollTimeout();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker = new Thread(this::dispatchLoop, "outbound-dispatcher");
        worker.setDaemon(true);
        worker.start();
        log.info("[Dispatch] Started for channels: {}", channels.keySet());
    }

    public synchronized void stop() {
        running = false;
        if (worker == null) {
            return;
        }
        try {
            worker.join(JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        worker = null;
        log.info("[Dispatch] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void dispatchLoop() {
        while (running) {
            try {
                Optional<OutboundMessage> next = messageBus.consumeOutbound(pollTimeout);
                next.ifPresent(this::dispatch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
            }
        }
    }

    void dispatch(OutboundMessage message) {
        ChannelPort channel = channels.get(message.getChannel());
        if (channel == null) {
            log.warn("[Dispatch] No channel adapter for '{}', dropping message to {}", message.getChannel(),
                    message.getChatId());
            return;
        }
        try {
            channel.sendMessage(message).exceptionally(ex -> {
                log.error("[Dispatch] Failed to deliver to {}:{}", message.getChannel(), message.getChatId(), ex);
                return null;
            });
        } catch (RuntimeException e) {
            log.error("[Dispatch] Channel {} rejected message", message.getChannel(), e);
        }
    }
}
