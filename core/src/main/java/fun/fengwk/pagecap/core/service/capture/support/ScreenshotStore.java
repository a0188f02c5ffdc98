package fun.fengwk.pagecap.core.service.capture.support;

/**
 * Stores screenshot bytes and hands back a reference to them.
 *
 * @author fengwk
 */
public interface ScreenshotStore {

    /**
     * @param png screenshot bytes
     * @param url page the screenshot belongs to
     * @return reference recorded as the screenshot url
     */
    String save(byte[] png, String url);

}
