package fun.fengwk.pagecap.core.service.capture.parser;

import fun.fengwk.pagecap.core.service.capture.CaptureProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Locates the main content subtree of an html document.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ContentIsolator {

    public static final List<ContentSelector> DEFAULT_SELECTORS = List.of(
        new ContentSelector("main", "main, [role=main]"),
        new ContentSelector("article", "article, [role=article]"),
        new ContentSelector("body", "body")
    );

    private final List<ContentSelector> selectors;
    private final boolean removeBase64Images;

    public ContentIsolator() {
        this(DEFAULT_SELECTORS, true);
    }

    @Autowired
    public ContentIsolator(CaptureProperties captureProperties) {
        this(DEFAULT_SELECTORS, captureProperties.isRemoveBase64Images());
    }

    public ContentIsolator(List<ContentSelector> selectors, boolean removeBase64Images) {
        this.selectors = List.copyOf(selectors);
        this.removeBase64Images = removeBase64Images;
    }

    public Element isolate(String html) {
        return isolate(html, "");
    }

    /**
     * Parse the html and return its main content element, with urls resolved against {@code baseUrl}.
     *
     * @throws ContentNotFoundException if the document is blank or no selector matches
     */
    public Element isolate(String html, String baseUrl) {
        if (StringUtils.isBlank(html)) {
            throw new ContentNotFoundException("document is blank");
        }
        Document document = Jsoup.parse(html, StringUtils.defaultString(baseUrl));
        for (ContentSelector selector : selectors) {
            Element element = document.selectFirst(selector.cssQuery());
            if (element != null) {
                log.debug("content isolated, selector={}, baseUrl={}", selector.name(), baseUrl);
                normalize(element);
                return element;
            }
        }
        throw new ContentNotFoundException("no content element found");
    }

    private void normalize(Element root) {
        if (removeBase64Images) {
            root.select("img[src^=data:image], img[srcset*=data:image]").remove();
        }
        normalizeSrcset(root);
        normalizeUrls(root);
    }

    private void normalizeSrcset(Element root) {
        for (Element element : root.select("img[srcset]")) {
            List<SrcCandidate> candidates = parseSrcsetCandidates(element.attr("srcset"));
            if (candidates.isEmpty()) {
                continue;
            }
            boolean allX = candidates.stream().allMatch(SrcCandidate::isX);
            String src = element.attr("src");
            if (allX && StringUtils.isNotBlank(src)) {
                candidates.add(new SrcCandidate(src, 1, true));
            }
            candidates.sort(Comparator.comparingInt(SrcCandidate::size).reversed());
            element.attr("src", candidates.get(0).url());
            element.removeAttr("srcset");
        }
    }

    private List<SrcCandidate> parseSrcsetCandidates(String srcset) {
        List<SrcCandidate> candidates = new ArrayList<>();
        if (StringUtils.isBlank(srcset)) {
            return candidates;
        }
        for (String part : srcset.split(",")) {
            String[] tokens = part.trim().split("\\s+");
            if (tokens.length == 0 || StringUtils.isBlank(tokens[0])) {
                continue;
            }
            String sizeToken = tokens.length > 1 ? tokens[1] : "1x";
            candidates.add(new SrcCandidate(tokens[0], parseSize(sizeToken), sizeToken.endsWith("x")));
        }
        return candidates;
    }

    private int parseSize(String token) {
        String number = token.replaceAll("[^0-9]", "");
        if (number.isEmpty()) {
            return 1;
        }
        try {
            return Integer.parseInt(number);
        } catch (NumberFormatException ex) {
            return 1;
        }
    }

    private void normalizeUrls(Element root) {
        for (Element element : root.select("img[src]")) {
            String absolute = element.absUrl("src");
            if (StringUtils.isNotBlank(absolute)) {
                element.attr("src", absolute);
            }
        }
        for (Element element : root.select("a[href]")) {
            String absolute = element.absUrl("href");
            if (StringUtils.isNotBlank(absolute)) {
                element.attr("href", absolute);
            }
        }
    }

    private record SrcCandidate(String url, int size, boolean isX) {

    }

}
