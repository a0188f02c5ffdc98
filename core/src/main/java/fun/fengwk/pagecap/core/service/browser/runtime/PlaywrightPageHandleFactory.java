package fun.fengwk.pagecap.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import fun.fengwk.pagecap.core.service.browser.BrowserProperties;
import fun.fengwk.pagecap.core.service.browser.RenderedPageHandle;
import fun.fengwk.pagecap.core.service.browser.RenderedPageHandleFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.Locale;

/**
 * Launches one Playwright browser per handle.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightPageHandleFactory implements RenderedPageHandleFactory {

    private final BrowserProperties browserProperties;

    @Override
    public RenderedPageHandle open() {
        Playwright playwright = Playwright.create();
        try {
            Browser browser = resolveBrowserType(playwright).launch(buildLaunchOptions());
            BrowserContext browserContext = browser.newContext(buildContextOptions());
            Page page = browserContext.newPage();
            log.debug("page handle opened, browserType={}, headless={}",
                browserProperties.getBrowserType(), browserProperties.isHeadless());
            return new PlaywrightPageHandle(
                playwright,
                browser,
                browserContext,
                page,
                browserProperties.getNavigateTimeoutMs(),
                browserProperties.isFullPageScreenshot()
            );
        } catch (RuntimeException ex) {
            // Closing playwright tears down everything launched from it.
            try {
                playwright.close();
            } catch (RuntimeException closeEx) {
                ex.addSuppressed(closeEx);
            }
            throw ex;
        }
    }

    BrowserType resolveBrowserType(Playwright playwright) {
        String browserType = StringUtils.defaultIfBlank(browserProperties.getBrowserType(), "chromium")
            .trim()
            .toLowerCase(Locale.ROOT);
        switch (browserType) {
            case "chromium":
                return playwright.chromium();
            case "firefox":
                return playwright.firefox();
            case "webkit":
                return playwright.webkit();
            default:
                throw new IllegalArgumentException("unsupported browserType: " + browserProperties.getBrowserType());
        }
    }

    private BrowserType.LaunchOptions buildLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());
        if (StringUtils.isNotBlank(browserProperties.getChannel())) {
            options.setChannel(browserProperties.getChannel().trim());
        }
        if (StringUtils.isNotBlank(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath().trim()));
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        return options;
    }

    private Browser.NewContextOptions buildContextOptions() {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
            .setViewportSize(browserProperties.getViewportWidth(), browserProperties.getViewportHeight());
        if (StringUtils.isNotBlank(browserProperties.getUserAgent())) {
            options.setUserAgent(browserProperties.getUserAgent().trim());
        }
        if (StringUtils.isNotBlank(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale().trim());
        }
        return options;
    }

}
