package fun.fengwk.pagecap.core.service.capture.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Capture request model.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaptureRequest {

    private String url;

    /**
     * Page the url was reached from, if any.
     */
    private String referrerUrl;

    /**
     * Overrides the configured scroll timeout when set.
     */
    private Long scrollTimeoutMs;

}
