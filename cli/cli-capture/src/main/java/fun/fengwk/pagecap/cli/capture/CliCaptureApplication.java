package fun.fengwk.pagecap.cli.capture;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.pagecap")
public class CliCaptureApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliCaptureApplication.class, args);
    }

}
