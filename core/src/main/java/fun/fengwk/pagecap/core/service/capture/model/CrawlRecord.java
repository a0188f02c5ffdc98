package fun.fengwk.pagecap.core.service.capture.model;

import lombok.Builder;
import lombok.Value;

/**
 * Normalized capture of a single page.
 *
 * @author fengwk
 */
@Value
@Builder
public class CrawlRecord {

    String url;
    CrawlInfo crawl;
    PageMetadata metadata;

    /**
     * Location of the stored screenshot, null when capture failed or is disabled.
     */
    String screenshotUrl;

    String text;

    /**
     * Cleaned main content html.
     */
    String html;

    String markdown;

}
