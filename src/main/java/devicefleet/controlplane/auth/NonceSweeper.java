package devicefleet.controlplane.auth;

import devicefleet.controlplane.config.AuthProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired nonce records for the lifetime of the process.
 */
@Component
@Slf4j
public class NonceSweeper {

    private final NonceLedger ledger;
    private final long intervalMillis;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "nonce-sweeper");
        t.setDaemon(true);
        return t;
    });

    public NonceSweeper(NonceLedger ledger, AuthProperties properties) {
        this.ledger = ledger;
        this.intervalMillis = properties.getNonceCleanupInterval().toMillis();
    }

    @PostConstruct
    public void start() {
        scheduler.scheduleAtFixedRate(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Nonce sweep scheduled every {} ms", intervalMillis);
    }

    void sweep() {
        try {
            int removed = ledger.cleanupExpired();
            if (removed > 0) {
                log.debug("Nonce sweep removed {} expired entries", removed);
            }
        } catch (RuntimeException ex) {
            // an exception would cancel the fixed-rate task for good
            log.error("Nonce sweep failed: {}", ex.getMessage(), ex);
        }
    }

    @PreDestroy
    public void stop() {
        scheduler.shutdownNow();
        log.info("Nonce sweep stopped");
    }
}
