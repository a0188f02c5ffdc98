package fun.fengwk.pagecap.core.service.capture;

/**
 * Pipeline stages that can abort a capture run.
 *
 * @author fengwk
 */
public enum CaptureStage {

    /**
     * Opening the page handle or navigating to the target url.
     */
    LOAD("load"),

    /**
     * Reading the page source or locating its content subtree.
     */
    CONTENT_ISOLATION("content-isolation");

    private final String value;

    CaptureStage(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

}
