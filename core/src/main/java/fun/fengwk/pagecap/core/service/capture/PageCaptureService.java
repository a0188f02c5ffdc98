package fun.fengwk.pagecap.core.service.capture;

import fun.fengwk.pagecap.core.service.capture.model.CaptureRequest;
import fun.fengwk.pagecap.core.service.capture.model.CrawlRecord;

/**
 * Capture service entry.
 *
 * @author fengwk
 */
public interface PageCaptureService {

    /**
     * Capture one page.
     *
     * @throws IllegalArgumentException if the request is invalid
     * @throws CaptureException if the page cannot be loaded or has no content
     */
    CrawlRecord capture(CaptureRequest request);

}
