package fun.fengwk.pagecap.core.service.capture.model;

import lombok.Builder;
import lombok.Value;

/**
 * @author fengwk
 */
@Value
@Builder
public class CrawlInfo {

    String loadedUrl;

    /**
     * UTC time of extraction, e.g. 2024-01-01T12:00:00.000Z.
     */
    String loadedTime;

    String referrerUrl;
    int depth;

}
