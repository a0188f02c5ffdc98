package fun.fengwk.pagecap.core.service.browser;

/**
 * Opaque reference to an element of a live page, only meaningful to the handle that produced it.
 *
 * @author fengwk
 */
public interface PageElement {

}
