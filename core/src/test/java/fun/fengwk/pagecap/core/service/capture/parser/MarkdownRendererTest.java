package fun.fengwk.pagecap.core.service.capture.parser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class MarkdownRendererTest {

    private final MarkdownRenderer markdownRenderer = new MarkdownRenderer();

    @Test
    public void shouldRenderParagraphContentOnly() {
        Element main = Jsoup.parse("<html><body><main><p>Hello</p></main></body></html>").selectFirst("main");

        assertThat(markdownRenderer.render(main)).isEqualTo("Hello");
    }

    @Test
    public void shouldPreserveLinksImagesAndEmphasis() {
        String html = """
            <h1>Title</h1>
            <p>content <a href="https://a.com">link</a> with <strong>bold</strong> and <em>soft</em></p>
            <p><img src="https://example.com/hero.png" alt="hero"></p>
            """;

        String result = markdownRenderer.render(html);

        assertThat(result).contains("# Title");
        assertThat(result).contains("[link](https://a.com)");
        assertThat(result).contains("**bold**");
        assertThat(result).contains("soft");
        assertThat(result).doesNotContain("<em>");
        assertThat(result).contains("![hero](https://example.com/hero.png)");
    }

    @Test
    public void shouldClampDeepHeadings() {
        String html = "<h2>Second</h2><h5>Fifth</h5><h6>Sixth</h6>";

        String result = markdownRenderer.render(html);

        assertThat(result).contains("## Second");
        assertThat(result).contains("### Fifth");
        assertThat(result).contains("### Sixth");
        assertThat(result).doesNotContain("####");
    }

    @Test
    public void shouldHonorConfiguredHeadingCap() {
        MarkdownRenderer renderer = new MarkdownRenderer(new MarkdownPostProcessor(), 1);

        String result = renderer.render("<h1>One</h1><h3>Three</h3>");

        assertThat(result).contains("# One");
        assertThat(result).contains("# Three");
        assertThat(result).doesNotContain("##");
    }

    @Test
    public void shouldNotModifyInputTree() {
        Element body = Jsoup.parse("<html><body><h6>Deep</h6></body></html>").body();

        markdownRenderer.render(body);

        assertThat(body.select("h6")).hasSize(1);
    }

    @Test
    public void shouldRenderIdenticalTreesIdentically() {
        String html = """
            <h2>Title</h2>
            <ul><li>one</li><li>two</li></ul>
            <p>text <a href="https://a.com">link</a></p>
            """;

        String first = markdownRenderer.render(Jsoup.parse(html).body());
        String second = markdownRenderer.render(Jsoup.parse(html).body());

        assertThat(first).isEqualTo(second);
    }

    @Test
    public void shouldNeverEmitThreeConsecutiveNewlines() {
        String html = """
            <p>first</p>
            <div><br><br><br></div>
            <p>&nbsp;</p>
            <div></div>
            <p>second</p>
            <pre><code>a


            b</code></pre>
            """;

        String result = markdownRenderer.render(html);

        assertThat(result).doesNotContain("\n\n\n");
        assertThat(result).startsWith("first");
        assertThat(result).contains("second");
    }

    @Test
    public void shouldReturnEmptyForBlankInput() {
        assertThat(markdownRenderer.render((String) null)).isEmpty();
        assertThat(markdownRenderer.render((Element) null)).isEmpty();
        assertThat(markdownRenderer.render(" ")).isEmpty();
    }

}
