package fun.fengwk.pagecap.core.service.capture.parser;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import fun.fengwk.pagecap.core.service.capture.CaptureProperties;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Html to markdown renderer.
 *
 * <p>Headings deeper than the configured cap are rendered at the cap level.
 *
 * @author fengwk
 */
@Component
public class MarkdownRenderer {

    public static final int DEFAULT_HEADING_LEVEL_CAP = 3;

    private static final int MAX_HEADING_LEVEL = 6;

    private final FlexmarkHtmlConverter converter;
    private final MarkdownPostProcessor markdownPostProcessor;
    private final int headingLevelCap;

    public MarkdownRenderer() {
        this(new MarkdownPostProcessor(), DEFAULT_HEADING_LEVEL_CAP);
    }

    @Autowired
    public MarkdownRenderer(MarkdownPostProcessor markdownPostProcessor, CaptureProperties captureProperties) {
        this(markdownPostProcessor, captureProperties.getHeadingLevelCap());
    }

    public MarkdownRenderer(MarkdownPostProcessor markdownPostProcessor, int headingLevelCap) {
        MutableDataSet options = new MutableDataSet();
        options.set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false);
        options.set(FlexmarkHtmlConverter.UNORDERED_LIST_DELIMITER, '*');
        options.set(FlexmarkHtmlConverter.LIST_ITEM_INDENT, 4);
        options.set(FlexmarkHtmlConverter.LIST_CONTENT_INDENT, true);
        options.set(FlexmarkHtmlConverter.DIV_AS_PARAGRAPH, true);
        this.converter = FlexmarkHtmlConverter.builder(options).build();
        this.markdownPostProcessor = markdownPostProcessor;
        this.headingLevelCap = Math.max(1, Math.min(MAX_HEADING_LEVEL, headingLevelCap));
    }

    public int getHeadingLevelCap() {
        return headingLevelCap;
    }

    /**
     * Render the content of {@code root}. The element itself is left untouched.
     */
    public String render(Element root) {
        if (root == null) {
            return "";
        }
        Element copy = root.clone();
        clampHeadings(copy);
        return convert(copy.html());
    }

    public String render(String html) {
        if (StringUtils.isBlank(html)) {
            return "";
        }
        return render(Jsoup.parseBodyFragment(html).body());
    }

    private String convert(String html) {
        if (StringUtils.isBlank(html)) {
            return "";
        }
        return markdownPostProcessor.process(converter.convert(html));
    }

    private void clampHeadings(Element root) {
        for (int level = headingLevelCap + 1; level <= MAX_HEADING_LEVEL; level++) {
            for (Element heading : root.getElementsByTag("h" + level)) {
                heading.tagName("h" + headingLevelCap);
            }
        }
    }

}
