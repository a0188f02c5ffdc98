package fun.fengwk.pagecap.core.service.capture.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.pagecap.core.service.capture.model.CrawlRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes crawl records as pretty printed json.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrawlRecordWriter {

    private final ObjectMapper objectMapper;

    public String toJson(CrawlRecord record) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to serialize crawl record", ex);
        }
    }

    public Path write(CrawlRecord record, Path output) {
        Path target = output.toAbsolutePath();
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(record), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write crawl record: " + target, ex);
        }
        log.info("crawl record written, url={}, path={}", record.getUrl(), target);
        return target;
    }

}
