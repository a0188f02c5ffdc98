package fun.fengwk.pagecap.core.service.capture;

/**
 * Run-fatal capture failure. No record is produced for the url.
 *
 * @author fengwk
 */
public class CaptureException extends RuntimeException {

    private final CaptureStage stage;

    public CaptureException(CaptureStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public CaptureStage getStage() {
        return stage;
    }

}
