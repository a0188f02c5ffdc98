package fun.fengwk.pagecap.core.service.browser;

/**
 * Thrown when a screenshot cannot be captured.
 *
 * @author fengwk
 */
public class ScreenshotCaptureException extends RuntimeException {

    public ScreenshotCaptureException(String message, Throwable cause) {
        super(message, cause);
    }

}
