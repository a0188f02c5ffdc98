package fun.fengwk.pagecap.core.service.capture.runtime;

import fun.fengwk.pagecap.core.service.browser.RenderedPageHandle;
import fun.fengwk.pagecap.core.service.capture.CaptureProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Scrolls a page to the bottom until its height stops growing.
 *
 * <p>Each round scrolls, sleeps the settle interval and reads the document height. The wait ends when two
 * consecutive readings are equal or when the timeout has elapsed, so it returns within
 * {@code timeout + settleInterval}. It never fails: a script error or an interrupt ends the wait early.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ScrollStabilizer {

    public static final String SCROLL_SCRIPT =
        "window.scrollTo(0, Math.max(document.body ? document.body.scrollHeight : 0, "
            + "document.documentElement ? document.documentElement.scrollHeight : 0))";

    public static final String HEIGHT_SCRIPT =
        "Math.max(document.body ? document.body.scrollHeight : 0, "
            + "document.documentElement ? document.documentElement.scrollHeight : 0)";

    private final long settleIntervalMs;
    private final LongSupplier clock;
    private final Sleeper sleeper;

    @Autowired
    public ScrollStabilizer(CaptureProperties captureProperties) {
        this(captureProperties.getScrollSettleIntervalMs(), System::currentTimeMillis, Thread::sleep);
    }

    ScrollStabilizer(long settleIntervalMs, LongSupplier clock, Sleeper sleeper) {
        this.settleIntervalMs = Math.max(0, settleIntervalMs);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public StabilizationResult stabilize(RenderedPageHandle handle, Duration timeout) {
        long timeoutMs = Math.max(0, timeout.toMillis());
        long deadlineAt = clock.getAsLong() + timeoutMs;
        long lastHeight = -1L;
        int rounds = 0;

        while (true) {
            rounds++;
            long height;
            try {
                handle.executeScript(SCROLL_SCRIPT);
                sleeper.sleep(settleIntervalMs);
                height = readHeight(handle);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.debug("scroll stabilization interrupted, rounds={}", rounds);
                return StabilizationResult.TIMED_OUT;
            } catch (RuntimeException ex) {
                log.debug("scroll stabilization stopped, rounds={}, error={}", rounds, ex.getMessage());
                return StabilizationResult.TIMED_OUT;
            }

            if (height == lastHeight) {
                log.debug("page height stabilized, height={}, rounds={}", height, rounds);
                return StabilizationResult.STABILIZED;
            }
            lastHeight = height;

            if (clock.getAsLong() >= deadlineAt) {
                log.debug("scroll stabilization timeout, timeoutMs={}, rounds={}, lastHeight={}",
                    timeoutMs, rounds, lastHeight);
                return StabilizationResult.TIMED_OUT;
            }
        }
    }

    private long readHeight(RenderedPageHandle handle) {
        Object value = handle.executeScript(HEIGHT_SCRIPT);
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("unexpected page height: " + value);
    }

    @FunctionalInterface
    interface Sleeper {

        void sleep(long millis) throws InterruptedException;

    }

}
