package me.kestrel.agent.tools;

import me.kestrel.agent.domain.model.FetchOutcome;
import me.kestrel.agent.domain.model.ToolDefinition;
import me.kestrel.agent.domain.model.ToolResult;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.tools.web.ContentExtractor;
import me.kestrel.agent.tools.web.FetchException;
import me.kestrel.agent.tools.web.FetchedPage;
import me.kestrel.agent.tools.web.SafeHttpFetcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebFetchToolTest {

    private static final String URL = "https://example.com/a";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SafeHttpFetcher fetcher;
    private WebFetchTool tool;

    @BeforeEach
    void setUp() {
        fetcher = mock(SafeHttpFetcher.class);
        tool = new WebFetchTool(fetcher, new ContentExtractor(objectMapper), objectMapper, new BotProperties());
    }

    @Test
    void shouldAdvertiseUrlAsRequired() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("web_fetch", definition.getName());
        assertEquals(List.of("url"), definition.getInputSchema().get("required"));
        assertTrue(tool.isEnabled());
    }

    @Test
    void shouldReturnJsonDocumentOnSuccess() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(new FetchedPage(URL, "https://example.com/b", 200, "text/plain", "body"));

        ToolResult result = tool.execute(Map.of("url", URL)).get();

        assertTrue(result.isSuccess());
        JsonNode json = objectMapper.readTree(result.getOutput());
        assertEquals(URL, json.get("url").asText());
        assertEquals("https://example.com/b", json.get("finalUrl").asText());
        assertEquals(200, json.get("status").asInt());
        assertEquals(FetchOutcome.EXTRACTOR_RAW, json.get("extractor").asText());
        assertFalse(json.get("truncated").asBoolean());
        assertEquals(4, json.get("length").asInt());
        assertEquals("body", json.get("text").asText());
        assertFalse(json.has("error"));
    }

    @Test
    void shouldTruncateToMaxChars() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(new FetchedPage(URL, URL, 200, "text/plain", "x".repeat(500)));

        ToolResult result = tool.execute(Map.of("url", URL, "maxChars", 100)).get();

        JsonNode json = objectMapper.readTree(result.getOutput());
        assertTrue(json.get("truncated").asBoolean());
        assertEquals(100, json.get("length").asInt());
        assertEquals(100, json.get("text").asText().length());
    }

    @Test
    void shouldClampOutOfRangeMaxChars() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(new FetchedPage(URL, URL, 200, "text/plain", "x".repeat(500)));

        ToolResult huge = tool.execute(Map.of("url", URL, "maxChars", 3_000_000_000L)).get();
        ToolResult negative = tool.execute(Map.of("url", URL, "maxChars", -5)).get();

        assertTrue(huge.isSuccess());
        JsonNode hugeJson = objectMapper.readTree(huge.getOutput());
        assertFalse(hugeJson.get("truncated").asBoolean());
        assertEquals(500, hugeJson.get("length").asInt());
        assertTrue(negative.isSuccess());
        assertEquals(100, objectMapper.readTree(negative.getOutput()).get("length").asInt());
    }

    @Test
    void shouldReturnErrorDocumentOnFailure() throws Exception {
        when(fetcher.fetch(URL)).thenThrow(new FetchException("Too many redirects (max 5)"));

        ToolResult result = tool.execute(Map.of("url", URL)).get();

        assertFalse(result.isSuccess());
        JsonNode json = objectMapper.readTree(result.toModelText());
        assertEquals(URL, json.get("url").asText());
        assertEquals("Too many redirects (max 5)", json.get("error").asText());
        assertFalse(json.has("text"));
    }
}
