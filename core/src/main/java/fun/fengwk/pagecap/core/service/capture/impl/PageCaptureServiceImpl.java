package fun.fengwk.pagecap.core.service.capture.impl;

import fun.fengwk.pagecap.core.service.browser.RenderedPageHandle;
import fun.fengwk.pagecap.core.service.browser.RenderedPageHandleFactory;
import fun.fengwk.pagecap.core.service.capture.CaptureException;
import fun.fengwk.pagecap.core.service.capture.CaptureProperties;
import fun.fengwk.pagecap.core.service.capture.CaptureStage;
import fun.fengwk.pagecap.core.service.capture.PageCaptureService;
import fun.fengwk.pagecap.core.service.capture.model.CaptureRequest;
import fun.fengwk.pagecap.core.service.capture.model.CrawlInfo;
import fun.fengwk.pagecap.core.service.capture.model.CrawlRecord;
import fun.fengwk.pagecap.core.service.capture.model.PageMetadata;
import fun.fengwk.pagecap.core.service.capture.parser.ContentIsolator;
import fun.fengwk.pagecap.core.service.capture.parser.ContentNotFoundException;
import fun.fengwk.pagecap.core.service.capture.parser.MarkdownRenderer;
import fun.fengwk.pagecap.core.service.capture.parser.NoiseFilter;
import fun.fengwk.pagecap.core.service.capture.runtime.LiveDomNoiseCleaner;
import fun.fengwk.pagecap.core.service.capture.runtime.MetadataExtractor;
import fun.fengwk.pagecap.core.service.capture.runtime.ScrollStabilizer;
import fun.fengwk.pagecap.core.service.capture.runtime.StabilizationResult;
import fun.fengwk.pagecap.core.service.capture.support.ScreenshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Capture pipeline: load, stabilize, extract metadata, isolate content, clean the live page and the isolated
 * content, render, screenshot.
 *
 * <p>Only a load failure or a page without content aborts the run. Every other step falls back to an empty
 * or null value for its own field. The page handle is closed exactly once whatever the outcome.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageCaptureServiceImpl implements PageCaptureService {

    static final long MAX_SCROLL_TIMEOUT_MS = 120000;

    private static final DateTimeFormatter LOADED_TIME_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final RenderedPageHandleFactory renderedPageHandleFactory;
    private final CaptureProperties captureProperties;
    private final ScrollStabilizer scrollStabilizer;
    private final MetadataExtractor metadataExtractor;
    private final LiveDomNoiseCleaner liveDomNoiseCleaner;
    private final ContentIsolator contentIsolator;
    private final NoiseFilter noiseFilter;
    private final MarkdownRenderer markdownRenderer;
    private final ScreenshotStore screenshotStore;

    @Override
    public CrawlRecord capture(CaptureRequest request) {
        validateRequest(request);
        String url = request.getUrl();
        long startAt = System.currentTimeMillis();
        log.info("capture started, url={}", url);

        RenderedPageHandle handle = openHandle(url);
        try (handle) {
            CrawlRecord record = doCapture(handle, request);
            log.info("capture finished, url={}, elapsedMs={}", url, System.currentTimeMillis() - startAt);
            return record;
        } catch (CaptureException ex) {
            log.warn("capture failed, url={}, stage={}, error={}", url, ex.getStage().getValue(), ex.getMessage());
            throw ex;
        }
    }

    private CrawlRecord doCapture(RenderedPageHandle handle, CaptureRequest request) {
        String url = request.getUrl();
        String loadedUrl;
        try {
            loadedUrl = handle.load(url);
        } catch (RuntimeException ex) {
            throw new CaptureException(CaptureStage.LOAD, "failed to load page: " + ex.getMessage(), ex);
        }

        StabilizationResult stabilization = scrollStabilizer.stabilize(handle, resolveScrollTimeout(request));
        log.debug("scroll stabilization done, url={}, result={}", url, stabilization);

        PageMetadata metadata = metadataExtractor.extract(handle);
        // Content is isolated from a snapshot taken before the live page is touched.
        Element content = isolateContent(handle, StringUtils.defaultIfBlank(loadedUrl, url));
        if (captureProperties.isLiveDomCleanupEnabled()) {
            liveDomNoiseCleaner.clean(handle);
        }

        Element cleaned = noiseFilter.filter(content);
        String markdown = markdownRenderer.render(cleaned);
        String html = serialize(cleaned);
        String text = readText(handle, cleaned);
        String screenshotUrl = captureScreenshot(handle, url);

        return CrawlRecord.builder()
            .url(url)
            .crawl(CrawlInfo.builder()
                .loadedUrl(loadedUrl)
                .loadedTime(LOADED_TIME_FORMATTER.format(Instant.now()))
                .referrerUrl(StringUtils.trimToNull(request.getReferrerUrl()))
                .depth(0)
                .build())
            .metadata(metadata)
            .screenshotUrl(screenshotUrl)
            .text(text)
            .html(html)
            .markdown(markdown)
            .build();
    }

    private RenderedPageHandle openHandle(String url) {
        try {
            return renderedPageHandleFactory.open();
        } catch (RuntimeException ex) {
            log.warn("capture failed, url={}, stage={}, error={}", url, CaptureStage.LOAD.getValue(), ex.getMessage());
            throw new CaptureException(CaptureStage.LOAD, "failed to open page handle: " + ex.getMessage(), ex);
        }
    }

    private Element isolateContent(RenderedPageHandle handle, String baseUrl) {
        String pageSource;
        try {
            pageSource = handle.pageSource();
        } catch (RuntimeException ex) {
            throw new CaptureException(CaptureStage.CONTENT_ISOLATION, "failed to read page source: " + ex.getMessage(), ex);
        }
        try {
            return contentIsolator.isolate(pageSource, baseUrl);
        } catch (ContentNotFoundException ex) {
            throw new CaptureException(CaptureStage.CONTENT_ISOLATION, ex.getMessage(), ex);
        }
    }

    private String serialize(Element cleaned) {
        // The isolated root is a wrapper, only its children are content.
        return cleaned.html();
    }

    private String readText(RenderedPageHandle handle, Element cleaned) {
        try {
            return StringUtils.trimToEmpty(handle.text(handle.findElement("body")));
        } catch (RuntimeException ex) {
            log.debug("read body text failed, fall back to cleaned content, error={}", ex.getMessage());
            return StringUtils.trimToEmpty(cleaned.text());
        }
    }

    private String captureScreenshot(RenderedPageHandle handle, String url) {
        if (!captureProperties.isScreenshotEnabled()) {
            return null;
        }
        try {
            return screenshotStore.save(handle.screenshot(), url);
        } catch (RuntimeException ex) {
            log.debug("screenshot unavailable, url={}, error={}", url, ex.getMessage());
            return null;
        }
    }

    private Duration resolveScrollTimeout(CaptureRequest request) {
        Long override = request.getScrollTimeoutMs();
        return Duration.ofMillis(override != null ? override : captureProperties.getScrollTimeoutMs());
    }

    private void validateRequest(CaptureRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        String normalizedUrl = request.getUrl();
        if (StringUtils.isBlank(normalizedUrl)) {
            throw new IllegalArgumentException("url is blank");
        }
        normalizedUrl = normalizedUrl.trim();
        request.setUrl(normalizedUrl);

        String lowerCaseUrl = normalizedUrl.toLowerCase(Locale.ROOT);
        if (!lowerCaseUrl.startsWith("http://") && !lowerCaseUrl.startsWith("https://")) {
            throw new IllegalArgumentException("unsupported url protocol");
        }
        Long scrollTimeoutMs = request.getScrollTimeoutMs();
        if (scrollTimeoutMs != null && (scrollTimeoutMs < 0 || scrollTimeoutMs > MAX_SCROLL_TIMEOUT_MS)) {
            throw new IllegalArgumentException("scrollTimeoutMs out of range");
        }
    }

}
