package devicefleet.controlplane.config;

import java.nio.file.Path;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "control.scripts")
public class ScriptProperties {

    /** Directory holding deployable scripts. */
    private Path root = Path.of("data", "scripts");

    /** Files of this size or larger are not inlined and travel as staged transfers. */
    private long largeFileThreshold = 128 * 1024;

    private int cacheMaxEntries = 64;

    private int cacheTrimTo = 48;

    /** Checksums of large files kept for reuse; the oldest are dropped down to the trim size. */
    private int checksumCacheMaxEntries = 2048;

    private int checksumCacheTrimTo = 1536;

    /** How long a multi-device start waits for transfers; zero leaves timeouts to the caller. */
    private Duration startWaitTimeout = Duration.ofMinutes(6);
}
