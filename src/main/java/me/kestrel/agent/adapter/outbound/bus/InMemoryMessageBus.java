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

import me.kestrel.agent.domain.model.InboundMessage;
import me.kestrel.agent.domain.model.OutboundMessage;
import me.kestrel.agent.port.outbound.MessageBusPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process message bus: two unbounded FIFO queues decoupling channels from
 * the agent loop.
 */
@Component
@Slf4j
public class InMemoryMessageBus implements MessageBusPort {

    private final BlockingQueue<InboundMessage> inbound = new LinkedBlockingQueue<>();
    private final BlockingQueue<OutboundMessage> outbound = new LinkedBlockingQueue<>();

    @Override
    public void publishInbound(InboundMessage message) {
        inbound.add(message);
        log.debug("[Bus] Inbound from {}:{} queued ({} pending)", message.getChannel(), message.getChatId(),
                inbound.size());
    }

    @Override
    public Optional<InboundMessage> consumeInbound(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void publishOutbound(OutboundMessage message) {
        outbound.add(message);
        log.debug("[Bus] Outbound to {}:{} queued", message.getChannel(), message.getChatId());
    }

    @Override
    public Optional<OutboundMessage> consumeOutbound(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(outbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int inboundSize() {
        return inbound.size();
    }

    public int outboundSize() {
        return outbound.size();
    }
}
