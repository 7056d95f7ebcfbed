package me.kestrel.agent.infrastructure.config;

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

import me.kestrel.agent.domain.service.ToolRegistry;
import me.kestrel.agent.port.inbound.ChannelPort;
import me.kestrel.agent.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;

/**
 * Application-wide beans and the startup report.
 *
 * <p>
 * Besides the {@link Clock} and the Jackson {@link ObjectMapper} (ISO-8601
 * dates, unknown properties ignored so older session files still load), this
 * starts every {@link ChannelPort} whose {@code bot.channels.<type>.enabled}
 * is set. The agent loop itself is started later by
 * {@link me.kestrel.agent.domain.loop.AgentLoopLifecycle}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<ChannelPort> channelPorts;
    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public void init() {
        BotProperties.AgentProperties agent = properties.getAgent();
        log.info("{} starting: model {} via {} ({}), {} iterations max, window {}",
                properties.getPrompts().getBotName(), agent.getModel(), llmPort.getProviderId(),
                llmPort.isAvailable() ? "available" : "NOT available", agent.getMaxIterations(),
                agent.getMemoryWindow());
        log.info("Tools: {}", toolRegistry.getToolNames());
        log.info("Workspace: {}", properties.getStorage().getLocal().resolveBasePath());

        List<ChannelPort> enabled = channelPorts.stream()
                .filter(channel -> isChannelEnabled(channel.getChannelType()))
                .toList();
        if (enabled.isEmpty()) {
            log.warn("No channels enabled, only processDirect callers can reach the agent");
        }
        for (ChannelPort channel : enabled) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }
    }

    private boolean isChannelEnabled(String channelType) {
        BotProperties.ChannelProperties channel = properties.getChannels().get(channelType);
        return channel != null && channel.isEnabled();
    }
}
