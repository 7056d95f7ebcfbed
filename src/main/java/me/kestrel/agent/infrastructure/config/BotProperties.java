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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix. This class
 * contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link AgentProperties} - iteration limits, generation parameters and
 * the memory window</li>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * <li>{@link ConsolidationProperties} - background memory consolidation</li>
 * <li>{@link BackgroundProperties} - background job supervisor</li>
 * <li>{@link ChannelProperties} - input channels (CLI)</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link ToolsProperties} - tool enablement and configuration</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private AgentProperties agent = new AgentProperties();
    private LlmProperties llm = new LlmProperties();
    private ConsolidationProperties consolidation = new ConsolidationProperties();
    private BackgroundProperties background = new BackgroundProperties();
    private Map<String, ChannelProperties> channels = new HashMap<>();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private ToolsProperties tools = new ToolsProperties();
    private PromptsProperties prompts = new PromptsProperties();

    // ==================== AGENT LOOP ====================

    @Data
    public static class AgentProperties {
        private String model = "openai/gpt-4o-mini";
        private int maxIterations = 20;
        private double temperature = 0.7;
        private int maxTokens = 4096;

        /** Messages kept as prompt history; also the consolidation trigger. */
        private int memoryWindow = 50;

        /** How long the loop waits for an inbound message before re-checking its running flag. */
        private Duration pollTimeout = Duration.ofSeconds(1);
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private Duration requestTimeout = Duration.ofSeconds(120);
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        /** Overrides {@code bot.llm.request-timeout} for this provider when set. */
        private Duration requestTimeout;
    }

    // ==================== CONSOLIDATION ====================

    @Data
    public static class ConsolidationProperties {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class BackgroundProperties {
        private int threads = 2;
        private int maxInFlight = 16;
        private Duration drainTimeout = Duration.ofSeconds(30);
    }

    // ==================== CHANNELS / STORAGE / HTTP ====================

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.kestrel/workspace";

        /**
         * Base path with {@code ${user.home}} expanded, absolute and normalized.
         */
        public Path resolveBasePath() {
            return Paths.get(basePath.replace("${user.home}", System.getProperty("user.home")))
                    .toAbsolutePath().normalize();
        }
    }

    @Data
    public static class DirectoriesProperties {
        private String sessions = "sessions";
        private String memory = "memory";
    }

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration writeTimeout = Duration.ofSeconds(60);
        private int maxIdleConnections = 5;
        private Duration keepAlive = Duration.ofMinutes(5);
        private int maxRequestsPerHost = 10;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private Duration executionTimeout = Duration.ofSeconds(120);
        private WebFetchToolProperties webFetch = new WebFetchToolProperties();
        private WebSearchToolProperties webSearch = new WebSearchToolProperties();
        private MessageToolProperties message = new MessageToolProperties();
    }

    @Data
    public static class WebFetchToolProperties {
        private boolean enabled = true;
        private int maxChars = 50000;
        private int maxRedirects = 5;
        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_7_2) AppleWebKit/537.36";

        /** Wall-clock budget for the whole redirect chain. */
        private Duration totalTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class WebSearchToolProperties {
        private boolean enabled = false;
        private String apiKey = "";
        private int maxResults = 5;
    }

    @Data
    public static class MessageToolProperties {
        private boolean enabled = true;
    }

    // ==================== PROMPTS ====================

    @Data
    public static class PromptsProperties {
        private String botName = "Kestrel";
        private String language = "en";
        private List<String> bootstrapFiles = new ArrayList<>(
                List.of("AGENTS.md", "SOUL.md", "USER.md", "TOOLS.md", "IDENTITY.md"));
    }
}
