package me.kestrel.agent.adapter.outbound.llm;

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

import me.kestrel.agent.domain.model.LlmRequest;
import me.kestrel.agent.domain.model.LlmResponse;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The {@link LlmPort} the rest of the application sees.
 *
 * <p>
 * Picks one {@link LlmProviderAdapter} at startup: the one whose id matches
 * {@code bot.llm.provider}, else the {@code none} adapter, else the first one
 * registered. Every call is forwarded to it unchanged.
 */
@Component
@Primary
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final String configuredProvider;
    private final Map<String, LlmProviderAdapter> adaptersById = new LinkedHashMap<>();
    private volatile LlmProviderAdapter activeAdapter;

    public LlmAdapterFactory(BotProperties properties, List<LlmProviderAdapter> adapters) {
        this.configuredProvider = properties.getLlm().getProvider();
        for (LlmProviderAdapter adapter : adapters) {
            adaptersById.putIfAbsent(adapter.getProviderId(), adapter);
        }
    }

    @PostConstruct
    public void init() {
        activeAdapter = select().orElse(null);
        if (activeAdapter == null) {
            log.warn("No LLM adapters registered, all chat calls will fail");
            return;
        }
        if (!activeAdapter.getProviderId().equals(configuredProvider)) {
            log.warn("LLM provider '{}' not found, falling back to '{}'", configuredProvider,
                    activeAdapter.getProviderId());
        }
        activeAdapter.initialize();
        log.info("Active LLM provider: {} (model {})", activeAdapter.getProviderId(),
                activeAdapter.getCurrentModel());
    }

    private Optional<LlmProviderAdapter> select() {
        return Optional.ofNullable(adaptersById.get(configuredProvider))
                .or(() -> Optional.ofNullable(adaptersById.get(PROVIDER_NONE)))
                .or(() -> adaptersById.values().stream().findFirst());
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        LlmProviderAdapter adapter = activeAdapter;
        return adapter != null ? adapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        LlmProviderAdapter adapter = activeAdapter;
        if (adapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter available"));
        }
        return adapter.chat(request);
    }

    @Override
    public String getCurrentModel() {
        LlmProviderAdapter adapter = activeAdapter;
        return adapter != null ? adapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        LlmProviderAdapter adapter = activeAdapter;
        return adapter != null && adapter.isAvailable();
    }
}
