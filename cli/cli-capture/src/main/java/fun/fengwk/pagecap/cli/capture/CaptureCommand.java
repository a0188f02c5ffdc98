package fun.fengwk.pagecap.cli.capture;

import fun.fengwk.pagecap.core.service.capture.CaptureException;
import fun.fengwk.pagecap.core.service.capture.PageCaptureService;
import fun.fengwk.pagecap.core.service.capture.model.CaptureRequest;
import fun.fengwk.pagecap.core.service.capture.model.CrawlRecord;
import fun.fengwk.pagecap.core.service.capture.support.CrawlRecordWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Captures the page given by {@code --url} and writes it as json.
 *
 * <p>Options: {@code --url=<url>} (required), {@code --output=<file>}, {@code --referrer=<url>}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaptureCommand implements ApplicationRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private final PageCaptureService pageCaptureService;
    private final CrawlRecordWriter crawlRecordWriter;
    private final CliProperties cliProperties;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("url")) {
            log.info("no --url given, nothing to capture");
            return;
        }
        int exitCode = execute(
            firstOption(args, "url"),
            firstOption(args, "output"),
            firstOption(args, "referrer")
        );
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    int execute(String url, String output, String referrerUrl) {
        Path outputPath = Paths.get(StringUtils.defaultIfBlank(output, cliProperties.getOutputPath()));
        try {
            CrawlRecord record = pageCaptureService.capture(CaptureRequest.builder()
                .url(url)
                .referrerUrl(referrerUrl)
                .build());
            Path written = crawlRecordWriter.write(record, outputPath);
            log.info("result saved to {}", written);
            return EXIT_OK;
        } catch (IllegalArgumentException ex) {
            log.warn("capture request invalid, url={}, error={}", url, ex.getMessage());
            return EXIT_FAILED;
        } catch (CaptureException ex) {
            log.warn("capture aborted, url={}, stage={}, error={}", url, ex.getStage().getValue(), ex.getMessage());
            return EXIT_FAILED;
        }
    }

    private String firstOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

}
