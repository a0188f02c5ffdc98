package fun.fengwk.pagecap.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Browser runtime configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "pagecap.browser")
public class BrowserProperties {

    /**
     * Browser engine: chromium, firefox or webkit.
     */
    private String browserType = "chromium";

    /**
     * Whether the browser runs in headless mode.
     */
    private boolean headless = true;

    /**
     * Page navigate timeout in milliseconds.
     */
    private int navigateTimeoutMs = 30000;

    /**
     * Optional fixed user agent for browser context.
     */
    private String userAgent = "";

    /**
     * Optional locale for browser context.
     */
    private String locale = "";

    private int viewportWidth = 1366;

    private int viewportHeight = 768;

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String channel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of();

    /**
     * Capture the whole scrollable page instead of the viewport.
     */
    private boolean fullPageScreenshot = false;

}
