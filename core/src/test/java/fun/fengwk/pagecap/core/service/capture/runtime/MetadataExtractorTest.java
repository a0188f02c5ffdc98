package fun.fengwk.pagecap.core.service.capture.runtime;

import fun.fengwk.pagecap.core.service.browser.ElementNotFoundException;
import fun.fengwk.pagecap.core.service.browser.PageElement;
import fun.fengwk.pagecap.core.service.browser.RenderedPageHandle;
import fun.fengwk.pagecap.core.service.capture.model.PageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class MetadataExtractorTest {

    private static final String AUTHOR_SELECTOR = "meta[name=\"author\"]";
    private static final String DESCRIPTION_SELECTOR = "meta[name=\"description\"]";
    private static final String KEYWORDS_SELECTOR = "meta[name=\"keywords\"]";

    private final MetadataExtractor metadataExtractor = new MetadataExtractor();

    private RenderedPageHandle handle;

    @BeforeEach
    void setUp() {
        handle = mock(RenderedPageHandle.class);
        when(handle.currentUrl()).thenReturn("https://example.com/final");
        doThrow(new ElementNotFoundException("any")).when(handle).findElement(anyString());
    }

    @Test
    public void shouldExtractAllFields() {
        when(handle.executeScript(MetadataExtractor.TITLE_SCRIPT)).thenReturn("Example");
        stubAttribute(DESCRIPTION_SELECTOR, "content", "A page");
        stubAttribute(AUTHOR_SELECTOR, "content", "Ada");
        stubAttribute(KEYWORDS_SELECTOR, "content", "a, b");
        stubAttribute("html", "lang", "en");

        PageMetadata metadata = metadataExtractor.extract(handle);

        assertThat(metadata.getTitle()).isEqualTo("Example");
        assertThat(metadata.getDescription()).isEqualTo("A page");
        assertThat(metadata.getAuthor()).isEqualTo("Ada");
        assertThat(metadata.getKeywords()).isEqualTo("a, b");
        assertThat(metadata.getLanguageCode()).isEqualTo("en");
        assertThat(metadata.getCanonicalUrl()).isEqualTo("https://example.com/final");
    }

    @Test
    public void shouldNullOnlyMissingFields() {
        when(handle.executeScript(MetadataExtractor.TITLE_SCRIPT)).thenReturn("Example");
        stubAttribute(AUTHOR_SELECTOR, "content", "Ada");
        stubAttribute("html", "lang", "en");

        PageMetadata metadata = metadataExtractor.extract(handle);

        assertThat(metadata.getTitle()).isEqualTo("Example");
        assertThat(metadata.getAuthor()).isEqualTo("Ada");
        assertThat(metadata.getLanguageCode()).isEqualTo("en");
        assertThat(metadata.getDescription()).isNull();
        assertThat(metadata.getKeywords()).isNull();
        assertThat(metadata.getCanonicalUrl()).isEqualTo("https://example.com/final");
    }

    @Test
    public void shouldNullFieldWhenAttributeAbsent() {
        PageElement html = mock(PageElement.class);
        doReturn(html).when(handle).findElement("html");
        when(handle.attribute(html, "lang")).thenReturn(Optional.empty());

        assertThat(metadataExtractor.extract(handle).getLanguageCode()).isNull();
    }

    @Test
    public void shouldNullFieldWhenValueBlank() {
        when(handle.executeScript(MetadataExtractor.TITLE_SCRIPT)).thenReturn("   ");
        stubAttribute(KEYWORDS_SELECTOR, "content", "");

        PageMetadata metadata = metadataExtractor.extract(handle);

        assertThat(metadata.getTitle()).isNull();
        assertThat(metadata.getKeywords()).isNull();
    }

    @Test
    public void shouldNeverThrowWhenEveryLookupFails() {
        when(handle.executeScript(MetadataExtractor.TITLE_SCRIPT)).thenThrow(new IllegalStateException("page crashed"));

        PageMetadata metadata = metadataExtractor.extract(handle);

        assertThat(metadata.getTitle()).isNull();
        assertThat(metadata.getDescription()).isNull();
        assertThat(metadata.getAuthor()).isNull();
        assertThat(metadata.getKeywords()).isNull();
        assertThat(metadata.getLanguageCode()).isNull();
        assertThat(metadata.getCanonicalUrl()).isEqualTo("https://example.com/final");
    }

    @Test
    public void shouldIsolateAttributeReadFailure() {
        PageElement author = mock(PageElement.class);
        doReturn(author).when(handle).findElement(AUTHOR_SELECTOR);
        when(handle.attribute(author, "content")).thenThrow(new IllegalStateException("stale element"));
        stubAttribute(DESCRIPTION_SELECTOR, "content", "A page");

        PageMetadata metadata = metadataExtractor.extract(handle);

        assertThat(metadata.getAuthor()).isNull();
        assertThat(metadata.getDescription()).isEqualTo("A page");
    }

    private void stubAttribute(String selector, String attributeName, String value) {
        PageElement element = mock(PageElement.class);
        doReturn(element).when(handle).findElement(selector);
        when(handle.attribute(element, attributeName)).thenReturn(Optional.ofNullable(value));
    }

}
