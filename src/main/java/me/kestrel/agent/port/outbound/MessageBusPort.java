package me.kestrel.agent.port.outbound;

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

import java.time.Duration;
import java.util.Optional;

/**
 * Message transport between channels and the agent loop. Inbound and outbound
 * traffic use separate queues.
 */
public interface MessageBusPort {

    void publishInbound(InboundMessage message);

    /**
     * Waits up to {@code timeout} for the next inbound message.
     *
     * @return the message, or empty on timeout
     * @throws InterruptedException
     *             if the waiting thread is interrupted
     */
    Optional<InboundMessage> consumeInbound(Duration timeout) throws InterruptedException;

    void publishOutbound(OutboundMessage message);

    /**
     * Waits up to {@code timeout} for the next outbound message.
     *
     * @return the message, or empty on timeout
     * @throws InterruptedException
     *             if the waiting thread is interrupted
     */
    Optional<OutboundMessage> consumeOutbound(Duration timeout) throws InterruptedException;
}
