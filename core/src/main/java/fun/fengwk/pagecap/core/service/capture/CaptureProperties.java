package fun.fengwk.pagecap.core.service.capture;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Capture pipeline configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "pagecap.capture")
public class CaptureProperties {

    /**
     * Max time spent scrolling for lazily loaded content.
     */
    private long scrollTimeoutMs = 10000;

    /**
     * Pause between scrolling to the bottom and reading the page height.
     */
    private long scrollSettleIntervalMs = 1000;

    /**
     * Deepest heading level kept in markdown, deeper headings are clamped to it.
     */
    private int headingLevelCap = 3;

    /**
     * Remove noise elements from the live page before reading its source.
     */
    private boolean liveDomCleanupEnabled = true;

    /**
     * Drop embedded base64/data images from the content.
     */
    private boolean removeBase64Images = true;

    private boolean screenshotEnabled = true;

    /**
     * Directory screenshots are written to.
     */
    private String screenshotDir = "screenshots";

}
