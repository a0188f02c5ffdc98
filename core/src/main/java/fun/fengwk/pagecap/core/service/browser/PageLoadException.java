package fun.fengwk.pagecap.core.service.browser;

/**
 * Thrown when the page cannot be loaded.
 *
 * @author fengwk
 */
public class PageLoadException extends RuntimeException {

    public PageLoadException(String message) {
        super(message);
    }

    public PageLoadException(String message, Throwable cause) {
        super(message, cause);
    }

}
