package fun.fengwk.pagecap.core.service.browser;

import java.util.List;
import java.util.Optional;

/**
 * Live connection to one rendered page.
 *
 * <p>The capture pipeline only talks to the rendering engine through this interface. A handle is owned by a
 * single capture run and released with {@link #close()}.
 *
 * @author fengwk
 */
public interface RenderedPageHandle extends AutoCloseable {

    /**
     * Navigate to the url and wait until the page is loaded.
     *
     * @param url target url
     * @return the url the page ended up on
     * @throws PageLoadException if navigation fails
     */
    String load(String url);

    String currentUrl();

    /**
     * Evaluate a javascript expression in the page and return its value.
     */
    Object executeScript(String script);

    /**
     * Find the first element matching the css selector.
     *
     * @throws ElementNotFoundException if nothing matches
     */
    PageElement findElement(String selector);

    List<PageElement> findElements(String selector);

    Optional<String> attribute(PageElement element, String name);

    String text(PageElement element);

    String pageSource();

    /**
     * Capture a png screenshot.
     *
     * @throws ScreenshotCaptureException if capture fails
     */
    byte[] screenshot();

    /**
     * Release the page and the engine resources behind it. Calling it more than once has no effect.
     */
    @Override
    void close();

}
