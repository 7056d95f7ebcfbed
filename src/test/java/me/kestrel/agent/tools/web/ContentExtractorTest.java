package me.kestrel.agent.tools.web;

import me.kestrel.agent.domain.model.FetchOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentExtractorTest {

    private static final String PAGE_URL = "https://example.com/blog/post";
    private static final String ARTICLE_HTML = """
            <html>
              <head><title>Post Title</title><script>var tracking = 1;</script></head>
              <body>
                <nav>Home | About | Contact</nav>
                <article>
                  <h2>Section</h2>
                  <p>Hello <a href="/docs">the docs</a> world.</p>
                  <ul><li>first</li><li>second</li></ul>
                </article>
                <footer>Copyright footer</footer>
              </body>
            </html>
            """;

    private final ContentExtractor extractor = new ContentExtractor(new ObjectMapper());

    private static FetchedPage page(String contentType, String body) {
        return new FetchedPage(PAGE_URL, PAGE_URL, 200, contentType, body);
    }

    @Test
    void shouldRenderArticleAsMarkdown() {
        ContentExtractor.Extraction extraction = extractor.extract(page("text/html", ARTICLE_HTML),
                ExtractMode.MARKDOWN);

        assertEquals(FetchOutcome.EXTRACTOR_READABILITY, extraction.extractor());
        String text = extraction.text();
        assertTrue(text.startsWith("# Post Title\n\n"), text);
        assertTrue(text.contains("## Section"), text);
        assertTrue(text.contains("[the docs](https://example.com/docs)"), text);
        assertTrue(text.contains("- first\n- second"), text);
        assertFalse(text.contains("Home | About"), text);
        assertFalse(text.contains("Copyright footer"), text);
        assertFalse(text.contains("tracking"), text);
    }

    @Test
    void shouldRenderPlainTextWithoutMarkup() {
        String text = extractor.extract(page("text/html", ARTICLE_HTML), ExtractMode.TEXT).text();

        assertTrue(text.contains("Hello the docs world."), text);
        assertFalse(text.contains("##"), text);
        assertFalse(text.contains("](https"), text);
        assertFalse(text.contains("- first"), text);
    }

    @Test
    void shouldPickDensestParagraphContainerWithoutArticle() {
        String html = """
                <html><body>
                  <div><p>short</p></div>
                  <div id="content">
                    <p>This paragraph is long enough to count as real content.</p>
                    <p>And here is a second paragraph with enough text in it.</p>
                  </div>
                  <div><p>Sidebar with one reasonably sized blurb of text.</p></div>
                </body></html>
                """;

        String text = extractor.extract(page("text/html", html), ExtractMode.TEXT).text();

        assertTrue(text.contains("long enough to count"), text);
        assertTrue(text.contains("second paragraph"), text);
        assertFalse(text.contains("Sidebar"), text);
        assertFalse(text.contains("short"), text);
    }

    @Test
    void shouldSniffHtmlWithoutContentType() {
        ContentExtractor.Extraction extraction = extractor.extract(
                page(null, "<!DOCTYPE html><html><body><main><p>Sniffed body text</p></main></body></html>"),
                ExtractMode.TEXT);

        assertEquals(FetchOutcome.EXTRACTOR_READABILITY, extraction.extractor());
        assertEquals("Sniffed body text", extraction.text());
    }

    @Test
    void shouldPrettyPrintJson() {
        ContentExtractor.Extraction extraction = extractor.extract(
                page("application/json; charset=utf-8", "{\"name\":\"kestrel\",\"tags\":[1,2]}"),
                ExtractMode.MARKDOWN);

        assertEquals(FetchOutcome.EXTRACTOR_JSON, extraction.extractor());
        assertTrue(extraction.text().contains("\"name\" : \"kestrel\""), extraction.text());
        assertTrue(extraction.text().contains("\n"));
    }

    @Test
    void shouldReturnRawWhenDeclaredJsonIsBroken() {
        ContentExtractor.Extraction extraction = extractor.extract(page("application/json", "{broken"),
                ExtractMode.MARKDOWN);

        assertEquals(FetchOutcome.EXTRACTOR_RAW, extraction.extractor());
        assertEquals("{broken", extraction.text());
    }

    @Test
    void shouldPassThroughOtherContent() {
        ContentExtractor.Extraction extraction = extractor.extract(page("text/plain", "just text"),
                ExtractMode.MARKDOWN);

        assertEquals(FetchOutcome.EXTRACTOR_RAW, extraction.extractor());
        assertEquals("just text", extraction.text());
    }
}
