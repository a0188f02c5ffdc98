package fun.fengwk.pagecap.core.service.capture.runtime;

/**
 * Outcome of a scroll stabilization wait. Callers treat both values the same way.
 *
 * @author fengwk
 */
public enum StabilizationResult {

    STABILIZED,

    TIMED_OUT

}
