package fun.fengwk.pagecap.core.service.browser;

/**
 * Thrown when no element matches a selector.
 *
 * @author fengwk
 */
public class ElementNotFoundException extends RuntimeException {

    private final String selector;

    public ElementNotFoundException(String selector) {
        super("element not found: " + selector);
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }

}
