package me.kestrel.agent.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A message received from a channel and waiting to be processed by the agent
 * loop. Immutable once published on the bus.
 */
@Value
@Builder
public class InboundMessage {

    /** Reserved channel for synthetic notifications from background work. */
    public static final String SYSTEM_CHANNEL = "system";

    String channel;
    String chatId;
    String senderId;
    String content;

    /** Local paths or URLs of attached media. */
    @Builder.Default
    List<String> media = List.of();

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    Instant timestamp;

    /** Explicit session key, replacing the {@code channel:chatId} default. */
    String sessionKeyOverride;

    public String sessionKey() {
        if (sessionKeyOverride != null && !sessionKeyOverride.isBlank()) {
            return sessionKeyOverride;
        }
        return channel + ":" + chatId;
    }

    public boolean isSystemMessage() {
        return SYSTEM_CHANNEL.equals(channel);
    }

    public boolean hasMedia() {
        return media != null && !media.isEmpty();
    }
}
