package fun.fengwk.pagecap.core.service.capture.runtime;

import fun.fengwk.pagecap.core.service.browser.PageElement;
import fun.fengwk.pagecap.core.service.browser.RenderedPageHandle;
import fun.fengwk.pagecap.core.service.capture.model.PageMetadata;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Reads document level metadata from a live page.
 *
 * <p>Every field is looked up on its own. A missing tag or attribute, or any failure while reading it, only
 * nulls that field. The canonical url is the page's current url.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class MetadataExtractor {

    static final String TITLE_SCRIPT = "document.title";

    public PageMetadata extract(RenderedPageHandle handle) {
        return PageMetadata.builder()
            .title(lookup("title", () -> asString(handle.executeScript(TITLE_SCRIPT))))
            .description(lookup("description", () -> metaContent(handle, "description")))
            .author(lookup("author", () -> metaContent(handle, "author")))
            .keywords(lookup("keywords", () -> metaContent(handle, "keywords")))
            .languageCode(lookup("languageCode", () -> attribute(handle, "html", "lang")))
            .canonicalUrl(handle.currentUrl())
            .build();
    }

    private String lookup(String field, Supplier<String> supplier) {
        try {
            return StringUtils.trimToNull(supplier.get());
        } catch (RuntimeException ex) {
            log.debug("metadata field unavailable, field={}, error={}", field, ex.getMessage());
            return null;
        }
    }

    private String metaContent(RenderedPageHandle handle, String name) {
        return attribute(handle, "meta[name=\"" + name + "\"]", "content");
    }

    private String attribute(RenderedPageHandle handle, String selector, String attributeName) {
        PageElement element = handle.findElement(selector);
        return handle.attribute(element, attributeName).orElse(null);
    }

    private String asString(Object value) {
        return value == null ? null : value.toString();
    }

}
