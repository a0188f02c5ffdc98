package fun.fengwk.pagecap.core.service.capture.parser;

/**
 * One main content selection strategy: the first element matching {@code cssQuery} in document order.
 *
 * @author fengwk
 */
public record ContentSelector(String name, String cssQuery) {

}
