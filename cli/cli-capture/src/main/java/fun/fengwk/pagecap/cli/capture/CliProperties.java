package fun.fengwk.pagecap.cli.capture;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Command line defaults.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "pagecap.cli")
public class CliProperties {

    /**
     * Json file written when --output is not given.
     */
    private String outputPath = "result.json";

}
