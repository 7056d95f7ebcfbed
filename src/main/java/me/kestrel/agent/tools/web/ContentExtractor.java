package me.kestrel.agent.tools.web;

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

import me.kestrel.agent.domain.model.FetchOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a fetched page into text for the LLM.
 *
 * <p>
 * JSON is pretty-printed. HTML goes through a readability pass: boilerplate
 * elements are dropped, the main content block is located, and the result is
 * rendered either as light markdown (headings, links, list items, paragraphs)
 * or as plain text. Anything else is passed through unchanged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentExtractor {

    private static final String NOISE_SELECTOR = "script, style, noscript, template, iframe, svg, canvas, "
            + "nav, header, footer, aside, form, button, [aria-hidden=true]";
    private static final String[] MAIN_CONTENT_SELECTORS = { "article", "main", "[role=main]" };
    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "section", "article", "main", "ul", "ol", "table", "tr", "blockquote", "pre",
            "figure", "dl", "dd", "dt");
    private static final int MIN_PARAGRAPH_CHARS = 25;
    private static final int SNIFF_CHARS = 256;

    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" *\\n *");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private final ObjectMapper objectMapper;

    /**
     * Extracted text and the tag of the extractor that produced it.
     */
    public record Extraction(String extractor, String text) {
    }

    public Extraction extract(FetchedPage page, ExtractMode mode) {
        String contentType = page.contentType() != null ? page.contentType().toLowerCase(Locale.ROOT) : "";
        String body = page.body() != null ? page.body() : "";

        if (contentType.contains("application/json")) {
            try {
                Object json = objectMapper.readValue(body, Object.class);
                return new Extraction(FetchOutcome.EXTRACTOR_JSON,
                        objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json));
            } catch (JsonProcessingException e) {
                log.debug("[WebFetch] Declared JSON did not parse, returning raw: {}", e.getOriginalMessage());
                return new Extraction(FetchOutcome.EXTRACTOR_RAW, body);
            }
        }
        if (contentType.contains("text/html") || looksLikeHtml(body)) {
            return new Extraction(FetchOutcome.EXTRACTOR_READABILITY, readability(body, page.finalUrl(), mode));
        }
        return new Extraction(FetchOutcome.EXTRACTOR_RAW, body);
    }

    String readability(String html, String baseUrl, ExtractMode mode) {
        Document document = Jsoup.parse(html, baseUrl != null ? baseUrl : "");
        String title = document.title().trim();
        document.select(NOISE_SELECTOR).remove();

        Element main = findMainContent(document);
        StringBuilder out = new StringBuilder();
        render(main, mode == ExtractMode.MARKDOWN, out);
        String content = normalize(out.toString());
        return title.isEmpty() ? content : "# " + title + "\n\n" + content;
    }

    private Element findMainContent(Document document) {
        for (String selector : MAIN_CONTENT_SELECTORS) {
            Element candidate = document.selectFirst(selector);
            if (candidate != null && !candidate.text().isBlank()) {
                return candidate;
            }
        }

        // Densest paragraph container wins
        Map<Element, Integer> scores = new HashMap<>();
        Elements paragraphs = document.select("p");
        for (Element paragraph : paragraphs) {
            int length = paragraph.text().length();
            Element parent = paragraph.parent();
            if (length >= MIN_PARAGRAPH_CHARS && parent != null) {
                scores.merge(parent, length, Integer::sum);
            }
        }
        Element best = null;
        int bestScore = 0;
        for (Map.Entry<Element, Integer> entry : scores.entrySet()) {
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        if (best != null) {
            return best;
        }
        return document.body() != null ? document.body() : document;
    }

    private void render(Node node, boolean markdown, StringBuilder out) {
        if (node instanceof TextNode textNode) {
            out.append(textNode.text());
            return;
        }
        if (!(node instanceof Element element)) {
            return;
        }

        String tag = element.normalName();
        switch (tag) {
        case "a" -> {
            String href = element.absUrl("href");
            String text = element.text().trim();
            if (markdown && !href.isEmpty() && !text.isEmpty()) {
                out.append('[').append(text).append("](").append(href).append(')');
            } else {
                out.append(text);
            }
        }
        case "h1", "h2", "h3", "h4", "h5", "h6" -> {
            out.append("\n\n");
            if (markdown) {
                out.append("#".repeat(tag.charAt(1) - '0')).append(' ');
            }
            out.append(element.text().trim()).append("\n\n");
        }
        case "li" -> {
            out.append(markdown ? "\n- " : "\n");
            renderChildren(element, markdown, out);
        }
        case "br", "hr" -> out.append('\n');
        case "img" -> {
            // images carry no text worth keeping
        }
        default -> {
            boolean block = BLOCK_TAGS.contains(tag);
            if (block) {
                out.append("\n\n");
            }
            renderChildren(element, markdown, out);
            if (block) {
                out.append("\n\n");
            }
        }
        }
    }

    private void renderChildren(Element element, boolean markdown, StringBuilder out) {
        for (Node child : element.childNodes()) {
            render(child, markdown, out);
        }
    }

    private static String normalize(String text) {
        String result = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        result = SPACE_AROUND_NEWLINE.matcher(result).replaceAll("\n");
        result = EXCESS_NEWLINES.matcher(result).replaceAll("\n\n");
        return result.trim();
    }

    private static boolean looksLikeHtml(String body) {
        String head = body.substring(0, Math.min(body.length(), SNIFF_CHARS)).stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype") || head.startsWith("<html");
    }
}
