package me.kestrel.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Kestrel agent.
 *
 * <p>
 * Kestrel is a personal AI assistant runtime: messages arrive on channels, an
 * agent loop lets the model call tools for a bounded number of iterations, and
 * replies go back to the channel they came from. Conversations are kept per
 * session and older history is condensed into long-term memory in the
 * background.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleChannelAdapter, InMemoryMessageBus
 * Domain Layer       → AgentLoop, ToolRegistry, MemoryConsolidationService
 * Infrastructure     → LLM/Storage/HTTP adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class KestrelAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(KestrelAgentApplication.class, args);
    }

}
