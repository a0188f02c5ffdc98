package fun.fengwk.pagecap.core.service.browser.runtime;

import com.microsoft.playwright.ElementHandle;
import fun.fengwk.pagecap.core.service.browser.PageElement;

/**
 * Playwright element reference.
 *
 * @author fengwk
 */
record PlaywrightPageElement(ElementHandle elementHandle) implements PageElement {

}
