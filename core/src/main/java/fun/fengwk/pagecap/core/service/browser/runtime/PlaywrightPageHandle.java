package fun.fengwk.pagecap.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.pagecap.core.service.browser.ElementNotFoundException;
import fun.fengwk.pagecap.core.service.browser.PageElement;
import fun.fengwk.pagecap.core.service.browser.PageLoadException;
import fun.fengwk.pagecap.core.service.browser.RenderedPageHandle;
import fun.fengwk.pagecap.core.service.browser.ScreenshotCaptureException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Page handle backed by a dedicated Playwright browser.
 *
 * <p>The handle owns the whole Playwright stack it was opened with. Close is idempotent and releases
 * resources in strict order: page, context, browser, playwright.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightPageHandle implements RenderedPageHandle {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext browserContext;
    private final Page page;
    private final int navigateTimeoutMs;
    private final boolean fullPageScreenshot;
    private volatile boolean closed = false;

    public PlaywrightPageHandle(
        Playwright playwright,
        Browser browser,
        BrowserContext browserContext,
        Page page,
        int navigateTimeoutMs,
        boolean fullPageScreenshot
    ) {
        this.playwright = playwright;
        this.browser = browser;
        this.browserContext = browserContext;
        this.page = page;
        this.navigateTimeoutMs = navigateTimeoutMs;
        this.fullPageScreenshot = fullPageScreenshot;
    }

    @Override
    public String load(String url) {
        ensureOpen();
        try {
            page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.LOAD)
                .setTimeout((double) navigateTimeoutMs)
            );
            return page.url();
        } catch (PlaywrightException ex) {
            throw new PageLoadException("failed to load " + url + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public String currentUrl() {
        ensureOpen();
        return page.url();
    }

    @Override
    public Object executeScript(String script) {
        ensureOpen();
        return page.evaluate(script);
    }

    @Override
    public PageElement findElement(String selector) {
        ensureOpen();
        ElementHandle elementHandle = page.querySelector(selector);
        if (elementHandle == null) {
            throw new ElementNotFoundException(selector);
        }
        return new PlaywrightPageElement(elementHandle);
    }

    @Override
    public List<PageElement> findElements(String selector) {
        ensureOpen();
        List<ElementHandle> elementHandles = page.querySelectorAll(selector);
        if (elementHandles == null || elementHandles.isEmpty()) {
            return List.of();
        }
        List<PageElement> elements = new ArrayList<>(elementHandles.size());
        for (ElementHandle elementHandle : elementHandles) {
            elements.add(new PlaywrightPageElement(elementHandle));
        }
        return elements;
    }

    @Override
    public Optional<String> attribute(PageElement element, String name) {
        return Optional.ofNullable(unwrap(element).getAttribute(name));
    }

    @Override
    public String text(PageElement element) {
        String text = unwrap(element).innerText();
        return text == null ? "" : text;
    }

    @Override
    public String pageSource() {
        ensureOpen();
        return page.content();
    }

    @Override
    public byte[] screenshot() {
        ensureOpen();
        try {
            return page.screenshot(new Page.ScreenshotOptions().setFullPage(fullPageScreenshot));
        } catch (PlaywrightException ex) {
            throw new ScreenshotCaptureException("failed to capture screenshot: " + ex.getMessage(), ex);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        closeQuietly("page", page);
        closeQuietly("browser context", browserContext);
        closeQuietly("browser", browser);
        closeQuietly("playwright", playwright);
    }

    private void closeQuietly(String resourceName, AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("{} already closed, skip close", resourceName);
            } else {
                log.warn("failed to close {}", resourceName, ex);
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("page handle is closed");
        }
    }

    private ElementHandle unwrap(PageElement element) {
        if (!(element instanceof PlaywrightPageElement playwrightElement)) {
            throw new IllegalArgumentException("element does not belong to a playwright page");
        }
        return playwrightElement.elementHandle();
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
