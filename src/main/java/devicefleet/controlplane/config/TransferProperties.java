package devicefleet.controlplane.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "control.transfer")
public class TransferProperties {

    /** Delay between the last release of a staged file and its deletion. */
    private Duration sharedTempGrace = Duration.ofSeconds(10);

    /** Only files below a directory with this name are reference-counted and deleted. */
    private String tempDirName = "_temp";

    private int deleteAttempts = 3;

    private Duration deleteRetryDelay = Duration.ofMillis(300);
}
