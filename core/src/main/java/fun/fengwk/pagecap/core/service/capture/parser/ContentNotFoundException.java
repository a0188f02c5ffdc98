package fun.fengwk.pagecap.core.service.capture.parser;

/**
 * Thrown when no content subtree can be located in a document.
 *
 * @author fengwk
 */
public class ContentNotFoundException extends RuntimeException {

    public ContentNotFoundException(String message) {
        super(message);
    }

}
