package fun.fengwk.pagecap.core.service.capture.parser;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Structural pattern for boilerplate elements.
 *
 * <p>An element matches when its tag name is one of {@code tagNames}, or when the lower-cased value of one of
 * {@code attributeNames} either has a token (split on whitespace, '-' and '_') in {@code tokens} or contains one
 * of {@code substrings}.
 *
 * @author fengwk
 */
public record NoiseRule(
    String name,
    List<String> tagNames,
    List<String> attributeNames,
    List<String> tokens,
    List<String> substrings
) {

    /**
     * Token separator, kept in sync with the live page script.
     */
    static final Pattern TOKEN_SEPARATOR = Pattern.compile("[\\s_-]+");

    public NoiseRule {
        tagNames = List.copyOf(tagNames);
        attributeNames = List.copyOf(attributeNames);
        tokens = List.copyOf(tokens);
        substrings = List.copyOf(substrings);
    }

    public static NoiseRule tags(String name, String... tagNames) {
        return new NoiseRule(name, List.of(tagNames), List.of(), List.of(), List.of());
    }

    public static NoiseRule attributes(String name, List<String> attributeNames, List<String> tokens,
                                       List<String> substrings) {
        return new NoiseRule(name, List.of(), attributeNames, tokens, substrings);
    }

    public boolean matches(Element element) {
        if (tagNames.contains(element.normalName())) {
            return true;
        }
        for (String attributeName : attributeNames) {
            String value = element.attr(attributeName).toLowerCase(Locale.ROOT);
            if (value.isEmpty()) {
                continue;
            }
            for (String token : TOKEN_SEPARATOR.split(value)) {
                if (tokens.contains(token)) {
                    return true;
                }
            }
            for (String substring : substrings) {
                if (value.contains(substring)) {
                    return true;
                }
            }
        }
        return false;
    }

}
