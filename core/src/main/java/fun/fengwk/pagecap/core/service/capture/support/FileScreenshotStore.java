package fun.fengwk.pagecap.core.service.capture.support;

import fun.fengwk.pagecap.core.service.capture.CaptureProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.CRC32;

/**
 * Writes screenshots as png files under the configured directory.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileScreenshotStore implements ScreenshotStore {

    private final CaptureProperties captureProperties;

    @Override
    public String save(byte[] png, String url) {
        if (png == null || png.length == 0) {
            throw new IllegalArgumentException("screenshot is empty");
        }
        Path dir = Paths.get(StringUtils.defaultIfBlank(captureProperties.getScreenshotDir(), "."));
        Path target = dir.resolve("screenshot-" + Long.toHexString(checksum(url)) + ".png").toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, png);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write screenshot: " + target, ex);
        }
        log.debug("screenshot saved, url={}, path={}, bytes={}", url, target, png.length);
        return target.toString();
    }

    private long checksum(String url) {
        CRC32 crc32 = new CRC32();
        crc32.update(StringUtils.defaultString(url).getBytes(StandardCharsets.UTF_8));
        return crc32.getValue();
    }

}
