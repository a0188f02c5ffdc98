package fun.fengwk.pagecap.core.service.capture.runtime;

import fun.fengwk.pagecap.core.service.browser.RenderedPageHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class ScrollStabilizerTest {

    private static final long SETTLE_MS = 1000;

    private final AtomicLong now = new AtomicLong(1_000_000L);

    private RenderedPageHandle handle;

    private ScrollStabilizer scrollStabilizer;

    @BeforeEach
    void setUp() {
        handle = mock(RenderedPageHandle.class);
        scrollStabilizer = new ScrollStabilizer(SETTLE_MS, now::get, now::addAndGet);
    }

    @AfterEach
    void tearDown() {
        // Clear a flag left by the interrupt test.
        Thread.interrupted();
    }

    @Test
    public void shouldStopAsSoonAsHeightRepeats() {
        when(handle.executeScript(ScrollStabilizer.HEIGHT_SCRIPT)).thenReturn(100, 100);
        long startAt = now.get();

        StabilizationResult result = scrollStabilizer.stabilize(handle, Duration.ofSeconds(30));

        assertThat(result).isEqualTo(StabilizationResult.STABILIZED);
        assertThat(now.get() - startAt).isEqualTo(2 * SETTLE_MS);
        verify(handle, times(2)).executeScript(ScrollStabilizer.SCROLL_SCRIPT);
        verify(handle, times(2)).executeScript(ScrollStabilizer.HEIGHT_SCRIPT);
    }

    @Test
    public void shouldKeepScrollingWhileHeightGrows() {
        when(handle.executeScript(ScrollStabilizer.HEIGHT_SCRIPT)).thenReturn(100, 200, 300, 300);

        StabilizationResult result = scrollStabilizer.stabilize(handle, Duration.ofSeconds(30));

        assertThat(result).isEqualTo(StabilizationResult.STABILIZED);
        verify(handle, times(4)).executeScript(ScrollStabilizer.HEIGHT_SCRIPT);
    }

    @Test
    public void shouldTimeOutWithinOneSettleIntervalWhenHeightNeverSettles() {
        AtomicLong height = new AtomicLong();
        when(handle.executeScript(ScrollStabilizer.HEIGHT_SCRIPT)).thenAnswer(invocation -> height.addAndGet(500));
        long startAt = now.get();

        StabilizationResult result = scrollStabilizer.stabilize(handle, Duration.ofMillis(4500));

        assertThat(result).isEqualTo(StabilizationResult.TIMED_OUT);
        assertThat(now.get() - startAt).isLessThanOrEqualTo(4500 + SETTLE_MS);
    }

    @Test
    public void shouldTreatNumericTypesAsSameHeight() {
        when(handle.executeScript(ScrollStabilizer.HEIGHT_SCRIPT)).thenReturn(100, 100.0D);

        assertThat(scrollStabilizer.stabilize(handle, Duration.ofSeconds(5))).isEqualTo(StabilizationResult.STABILIZED);
    }

    @Test
    public void shouldNotFailWhenScriptFails() {
        when(handle.executeScript(ScrollStabilizer.SCROLL_SCRIPT)).thenThrow(new IllegalStateException("detached"));

        StabilizationResult result = scrollStabilizer.stabilize(handle, Duration.ofSeconds(5));

        assertThat(result).isEqualTo(StabilizationResult.TIMED_OUT);
    }

    @Test
    public void shouldNotFailWhenHeightIsNotNumeric() {
        when(handle.executeScript(ScrollStabilizer.HEIGHT_SCRIPT)).thenReturn("unknown");

        assertThat(scrollStabilizer.stabilize(handle, Duration.ofSeconds(5))).isEqualTo(StabilizationResult.TIMED_OUT);
    }

    @Test
    public void shouldRestoreInterruptFlagWhenInterrupted() {
        ScrollStabilizer interrupted = new ScrollStabilizer(SETTLE_MS, now::get, millis -> {
            throw new InterruptedException("stop");
        });

        StabilizationResult result = interrupted.stabilize(handle, Duration.ofSeconds(5));

        assertThat(result).isEqualTo(StabilizationResult.TIMED_OUT);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

}
