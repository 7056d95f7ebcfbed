package me.kestrel.agent.port.inbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for input channels (CLI and similar). A channel publishes what the user
 * types to the message bus and delivers replies addressed to its type.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "cli").
     */
    String getChannelType();

    /**
     * Starts listening for incoming messages from the channel.
     */
    void start();

    /**
     * Stops listening for messages and disconnects from the channel.
     */
    void stop();

    /**
     * Checks if the channel is currently active and listening.
     */
    boolean isRunning();

    /**
     * Delivers a reply to the chat it is addressed to.
     */
    CompletableFuture<Void> sendMessage(OutboundMessage message);
}
