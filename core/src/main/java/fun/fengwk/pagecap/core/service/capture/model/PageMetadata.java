package fun.fengwk.pagecap.core.service.capture.model;

import lombok.Builder;
import lombok.Value;

/**
 * Document level metadata. Every field but {@code canonicalUrl} may be null on its own.
 *
 * @author fengwk
 */
@Value
@Builder
public class PageMetadata {

    String title;
    String description;
    String author;
    String keywords;
    String languageCode;
    String canonicalUrl;

}
