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

package me.kestrel.agent.tools;

import me.kestrel.agent.domain.component.ToolComponent;
import me.kestrel.agent.domain.model.ToolDefinition;
import me.kestrel.agent.domain.model.ToolResult;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.infrastructure.http.FeignClientFactory;
import me.kestrel.agent.infrastructure.i18n.MessageService;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for web search using Brave Search API.
 *
 * <p>
 * Returns a numbered list of results with title, URL and description.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.tools.web-search.enabled} - Enable/disable
 * <li>{@code bot.tools.web-search.api-key} - Brave API key (required)
 * <li>{@code bot.tools.web-search.max-results} - Number of results when the
 * LLM does not ask for a count (default 5)
 * </ul>
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COUNT = "count";
    private static final int MAX_COUNT = 10;

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private static final String BRAVE_API_URL = "https://api.search.brave.com";
    private static final String AUTH_HEADER = "X-Subscription-Token";

    private final FeignClientFactory feignClientFactory;
    private final BotProperties properties;
    private final MessageService messageService;

    private BraveSearchApi searchApi;
    private boolean enabled;
    private String apiKey;
    private int defaultCount;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getWebSearch();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();
        this.defaultCount = Math.max(1, Math.min(MAX_COUNT, config.getMaxResults()));

        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("Web search tool is enabled but API key is not configured. Disabling.");
            this.enabled = false;
        }

        if (enabled) {
            String key = apiKey;
            this.searchApi = feignClientFactory.create(BraveSearchApi.class, BRAVE_API_URL,
                    List.of(template -> template.header(AUTH_HEADER, key)));
            log.info("Web search tool initialized (default results: {})", defaultCount);
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("web_search")
                .description("Search the web. Returns titles, URLs, and snippets.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "Search query"),
                                PARAM_COUNT, Map.of(
                                        "type", "integer",
                                        "description", "Results (1-10)",
                                        "minimum", 1,
                                        "maximum", MAX_COUNT)),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            if (searchApi == null) {
                return ToolResult.failure("Web search API key is not configured");
            }
            Object queryObj = parameters.get(PARAM_QUERY);
            String query = queryObj instanceof String s ? s : null;
            if (query == null || query.isBlank()) {
                return ToolResult.failure("Search query is required");
            }

            int count = defaultCount;
            if (parameters.get(PARAM_COUNT) instanceof Number n) {
                count = Math.max(1, Math.min(MAX_COUNT, n.intValue()));
            }

            return executeWithRetry(query, count);
        });
    }

    private ToolResult executeWithRetry(String query, int count) {
        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try {
                log.debug("Web search: query='{}', count={}, attempt={}", query, count, attempt);

                BraveSearchResponse response = searchApi.search(query, count);
                return buildSuccessResult(query, count, response);

            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < MAX_RETRIES) {
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[WebSearch] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleep(backoffMs);
                } else if (e.status() == HTTP_TOO_MANY_REQUESTS) {
                    log.error("[WebSearch] Rate limit exceeded after {} retries for query: {}", MAX_RETRIES, query);
                    return ToolResult.failure(messageService.getMessage("tool.web_search.rate_limit"));
                } else {
                    log.error("[WebSearch] API error (status {}) for query: {}", e.status(), query, e);
                    return ToolResult.failure(messageService.getMessage("tool.web_search.error"));
                }
            }
        }
        return ToolResult.failure(messageService.getMessage("tool.web_search.error"));
    }

    private ToolResult buildSuccessResult(String query, int count, BraveSearchResponse response) {
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null
                || response.getWeb().getResults().isEmpty()) {
            return ToolResult.success("No results for: " + query);
        }

        List<WebResult> results = response.getWeb().getResults();
        StringBuilder output = new StringBuilder("Results for: ").append(query).append('\n');
        int shown = Math.min(count, results.size());
        for (int i = 0; i < shown; i++) {
            WebResult result = results.get(i);
            output.append('\n').append(i + 1).append(". ").append(nullToEmpty(result.getTitle()))
                    .append("\n   ").append(nullToEmpty(result.getUrl()));
            if (result.getDescription() != null && !result.getDescription().isBlank()) {
                output.append("\n   ").append(result.getDescription());
            }
        }
        return ToolResult.success(output.toString(), Map.of(PARAM_QUERY, query, PARAM_COUNT, shown));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Web search retry sleep interrupted", e);
        }
    }

    // Feign API interface
    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers("Accept: application/json")
        BraveSearchResponse search(
                @Param("query") String query,
                @Param("count") int count);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}
