package devicefleet.controlplane.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "control.auth")
public class AuthProperties {

    /** HMAC key shared with controllers and devices (the control password hash). */
    private String sharedSecret = "";

    /** Accepted distance between a signed timestamp and the server clock. */
    private Duration clockSkew = Duration.ofSeconds(60);

    /** How long a consumed nonce stays blocked. */
    private Duration nonceTtl = Duration.ofSeconds(120);

    /** Interval of the background sweep that drops expired nonces. */
    private Duration nonceCleanupInterval = Duration.ofSeconds(30);

    /** Logs expected/received signatures on mismatch. Never enable in production. */
    private boolean debug = false;

    /** Paths under /api that are reachable without a signature. */
    private List<String> exemptPaths = new ArrayList<>(List.of(
        "/api/download-bind-script",
        "/api/ws",
        "/api/config",
        "/api/control/info"
    ));

    /** Path prefixes under /api protected by one-time transfer tokens instead of signatures. */
    private List<String> exemptPrefixes = new ArrayList<>(List.of(
        "/api/transfer/download/",
        "/api/transfer/upload/"
    ));
}
