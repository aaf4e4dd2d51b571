package devicefleet.controlplane.auth;

import devicefleet.controlplane.config.AuthProperties;
import devicefleet.controlplane.util.LogSanitizer;
import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records consumed nonces per namespace so a signed request or message is accepted only once
 * inside the TTL window. Namespaces keep channels apart: the same nonce may be used once
 * over HTTP and once over the device channel.
 */
@Service
@Slf4j
public class NonceLedger {

    private static final int LARGE_LEDGER_WARN_THRESHOLD = 10_000;

    private final Clock clock;
    private final long ttlSeconds;

    private final Object lock = new Object();

    // namespace:nonce -> consumedAt (epoch seconds)
    private final Map<String, Long> consumed = new HashMap<>();

    public NonceLedger(AuthProperties properties, Clock clock) {
        this.clock = clock;
        this.ttlSeconds = properties.getNonceTtl().getSeconds();
    }

    /**
     * Accepts a nonce the first time it is seen in a namespace and rejects it afterwards
     * until the stored record is older than the TTL.
     *
     * @return true when the nonce was accepted (and is now consumed), false on replay or empty nonce
     */
    public boolean checkAndStore(String namespace, String nonce) {
        if (nonce == null || nonce.isEmpty()) {
            return false;
        }
        long now = clock.instant().getEpochSecond();
        long cutoff = now - ttlSeconds;
        String key = namespace + ":" + nonce;

        int size;
        synchronized (lock) {
            Long consumedAt = consumed.get(key);
            if (consumedAt != null && consumedAt >= cutoff) {
                log.warn("Nonce replay rejected: namespace={} nonce={}",
                    LogSanitizer.sanitize(namespace), LogSanitizer.maskIdentifier(nonce));
                return false;
            }
            consumed.put(key, now);
            size = consumed.size();
        }

        if (size > LARGE_LEDGER_WARN_THRESHOLD) {
            log.warn("Nonce ledger tracks {} entries; check the cleanup sweep and client nonce reuse", size);
        }
        return true;
    }

    /**
     * Removes every record consumed before {@code now - ttl}.
     *
     * @param nowEpochSeconds reference time
     * @return number of records removed
     */
    public int cleanupExpired(long nowEpochSeconds) {
        long cutoff = nowEpochSeconds - ttlSeconds;
        int removed = 0;
        synchronized (lock) {
            Iterator<Map.Entry<String, Long>> it = consumed.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue() < cutoff) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public int cleanupExpired() {
        return cleanupExpired(clock.instant().getEpochSecond());
    }

    public int size() {
        synchronized (lock) {
            return consumed.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            consumed.clear();
        }
        log.info("Nonce ledger cleared");
    }

    void recordAt(String namespace, String nonce, long consumedAtEpochSeconds) {
        synchronized (lock) {
            consumed.put(namespace + ":" + nonce, consumedAtEpochSeconds);
        }
    }
}
