package fun.fengwk.pagecap.core.service.capture.parser;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Post-process markdown output.
 *
 * @author fengwk
 */
@Component
public class MarkdownPostProcessor {

    public String process(String markdown) {
        if (StringUtils.isBlank(markdown)) {
            return "";
        }
        String normalized = markdown.replace("\r\n", "\n")
            .replace('\r', '\n')
            .replace("\uFEFF", "")
            .replace("\u200B", "")
            .replace("\u2060", "");
        normalized = removeEmptyLinks(normalized);
        StringBuilder builder = new StringBuilder();
        boolean previousBlank = true;
        for (String line : normalized.split("\n", -1)) {
            String trimmedLine = StringUtils.stripEnd(line, null);
            if (trimmedLine.isBlank()) {
                if (!previousBlank) {
                    builder.append("\n");
                }
                previousBlank = true;
                continue;
            }
            builder.append(trimmedLine).append("\n");
            previousBlank = false;
        }
        return builder.toString().trim();
    }

    private String removeEmptyLinks(String input) {
        StringBuilder builder = new StringBuilder();
        boolean inCodeBlock = false;
        String[] lines = input.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (isFenceLine(line)) {
                inCodeBlock = !inCodeBlock;
            } else if (!inCodeBlock) {
                line = line.replaceAll("[\\t ]*(?<!\\!)\\[\\s*\\]\\([^)]*\\)[\\t ]*", " ")
                    .replaceAll("(?<=\\S) {2,}", " ");
            }
            if (i > 0) {
                builder.append("\n");
            }
            builder.append(line);
        }
        return builder.toString();
    }

    private boolean isFenceLine(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("```") || trimmed.startsWith("~~~");
    }

}
