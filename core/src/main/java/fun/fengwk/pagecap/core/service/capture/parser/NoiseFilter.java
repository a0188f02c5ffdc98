package fun.fengwk.pagecap.core.service.capture.parser;

import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes boilerplate elements from an html tree.
 *
 * <p>The filter works on a copy: the tree passed in is never modified and the root of the copy is never
 * removed. A matched element is removed with its whole subtree, unless it wraps a content landmark.
 *
 * @author fengwk
 */
@Component
public class NoiseFilter {

    private final List<NoiseRule> rules;

    public NoiseFilter() {
        this(NoiseRules.DEFAULT);
    }

    public NoiseFilter(List<NoiseRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<NoiseRule> getRules() {
        return rules;
    }

    public Element filter(Element root) {
        Element copy = root.clone();
        for (NoiseRule rule : rules) {
            List<Element> matched = new ArrayList<>();
            for (Element element : copy.getAllElements()) {
                if (element != copy && rule.matches(element) && !wrapsContentLandmark(element)) {
                    matched.add(element);
                }
            }
            for (Element element : matched) {
                // Skip descendants of an element removed earlier in this pass.
                if (isAttached(element, copy)) {
                    element.remove();
                }
            }
        }
        return copy;
    }

    private boolean wrapsContentLandmark(Element element) {
        for (Element landmark : element.select(NoiseRules.CONTENT_LANDMARKS)) {
            if (landmark != element) {
                return true;
            }
        }
        return false;
    }

    private boolean isAttached(Element element, Element root) {
        Element current = element.parent();
        while (current != null) {
            if (current == root) {
                return true;
            }
            current = current.parent();
        }
        return false;
    }

}
