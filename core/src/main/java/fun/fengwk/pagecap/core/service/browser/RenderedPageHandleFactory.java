package fun.fengwk.pagecap.core.service.browser;

/**
 * Opens a fresh page handle for one capture run.
 *
 * @author fengwk
 */
public interface RenderedPageHandleFactory {

    RenderedPageHandle open();

}
