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
import me.kestrel.agent.domain.model.FetchOutcome;
import me.kestrel.agent.domain.model.ToolDefinition;
import me.kestrel.agent.domain.model.ToolFailureKind;
import me.kestrel.agent.domain.model.ToolResult;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.tools.web.ContentExtractor;
import me.kestrel.agent.tools.web.ExtractMode;
import me.kestrel.agent.tools.web.FetchException;
import me.kestrel.agent.tools.web.FetchedPage;
import me.kestrel.agent.tools.web.SafeHttpFetcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for fetching a web page and extracting its readable content.
 *
 * <p>
 * Every request, including each redirect hop, is checked by
 * {@link me.kestrel.agent.security.UrlValidator} so the LLM cannot reach
 * localhost, private networks or cloud metadata endpoints. The result is a JSON
 * document with the final URL, HTTP status, extractor used, truncation flag and
 * text; failures produce {@code {"url": ..., "error": ...}} instead of an
 * exception.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.tools.web-fetch.enabled} - Enable/disable
 * <li>{@code bot.tools.web-fetch.max-chars} - Default text budget (default
 * 50000)
 * <li>{@code bot.tools.web-fetch.max-redirects} - Redirect hop limit (default
 * 5)
 * <li>{@code bot.tools.web-fetch.total-timeout} - Wall-clock budget for the
 * whole redirect chain
 * </ul>
 */
@Component
@Slf4j
public class WebFetchTool implements ToolComponent {

    private static final String PARAM_URL = "url";
    private static final String PARAM_EXTRACT_MODE = "extractMode";
    private static final String PARAM_MAX_CHARS = "maxChars";
    private static final String TYPE_STRING = "string";
    private static final int MIN_CHARS = 100;

    private final SafeHttpFetcher fetcher;
    private final ContentExtractor extractor;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final int defaultMaxChars;

    public WebFetchTool(SafeHttpFetcher fetcher, ContentExtractor extractor, ObjectMapper objectMapper,
            BotProperties properties) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.objectMapper = objectMapper;
        this.enabled = properties.getTools().getWebFetch().isEnabled();
        this.defaultMaxChars = properties.getTools().getWebFetch().getMaxChars();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("web_fetch")
                .description("Fetch URL and extract readable content (HTML to markdown/text).")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_URL, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "URL to fetch"),
                                PARAM_EXTRACT_MODE, Map.of(
                                        "type", TYPE_STRING,
                                        "enum", List.of(ExtractMode.MARKDOWN.value(), ExtractMode.TEXT.value()),
                                        "description", "How to render HTML pages (default: markdown)"),
                                PARAM_MAX_CHARS, Map.of(
                                        "type", "integer",
                                        "minimum", MIN_CHARS,
                                        "description", "Maximum characters of text to return")),
                        "required", List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String url = String.valueOf(parameters.get(PARAM_URL));
            ExtractMode mode = ExtractMode.fromValue((String) parameters.get(PARAM_EXTRACT_MODE));
            int maxChars = resolveMaxChars(parameters.get(PARAM_MAX_CHARS));

            FetchOutcome outcome = fetch(url, mode, maxChars);
            String json = toJson(outcome);
            if (!outcome.isSuccess()) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, outcome.getError(), json);
            }
            return ToolResult.success(json, outcome);
        });
    }

    private int resolveMaxChars(Object value) {
        if (!(value instanceof Number n)) {
            return defaultMaxChars;
        }
        // models send Long or Double for large values
        return (int) Math.max(MIN_CHARS, Math.min(n.longValue(), Integer.MAX_VALUE));
    }

    FetchOutcome fetch(String url, ExtractMode mode, int maxChars) {
        try {
            FetchedPage page = fetcher.fetch(url);
            ContentExtractor.Extraction extraction = extractor.extract(page, mode);
            String text = extraction.text();
            boolean truncated = text.length() > maxChars;
            if (truncated) {
                text = text.substring(0, maxChars);
            }
            log.info("[WebFetch] {} -> {} ({} chars via {}{})", url, page.status(), text.length(),
                    extraction.extractor(), truncated ? ", truncated" : "");
            return FetchOutcome.success(url, page.finalUrl(), page.status(), extraction.extractor(), truncated, text);
        } catch (FetchException e) {
            log.warn("[WebFetch] {} failed: {}", url, e.getMessage());
            return FetchOutcome.failure(url, e.getMessage());
        }
    }

    private String toJson(FetchOutcome outcome) {
        try {
            return objectMapper.writeValueAsString(outcome);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize fetch outcome", e);
        }
    }
}
