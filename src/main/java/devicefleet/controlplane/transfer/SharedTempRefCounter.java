package devicefleet.controlplane.transfer;

import devicefleet.controlplane.config.TransferProperties;
import devicefleet.controlplane.util.LogSanitizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Reference counts a staged temporary file shared by several in-flight transfers.
 *
 * <p>When the last holder releases, deletion is deferred by a grace period. A register arriving
 * inside that window cancels the pending deletion, so consumers that start a moment after the
 * previous one finished still find the file.
 */
@Service
@Slf4j
public class SharedTempRefCounter {

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration grace;
    private final String tempDirName;
    private final int deleteAttempts;
    private final Duration deleteRetryDelay;

    private final Object lock = new Object();
    private final Map<String, SharedTempRef> refs = new HashMap<>();

    public SharedTempRefCounter(TransferProperties properties, TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.grace = properties.getSharedTempGrace();
        this.tempDirName = properties.getTempDirName();
        this.deleteAttempts = Math.max(1, properties.getDeleteAttempts());
        this.deleteRetryDelay = properties.getDeleteRetryDelay();
    }

    /**
     * Adds a holder for {@code sharedId}. The first register records the file path; later ones
     * only count. Any armed deletion for the ID is cancelled.
     */
    public void registerRef(String sharedId, Path filePath) {
        if (sharedId == null || sharedId.isBlank() || !isTempFile(filePath)) {
            return;
        }
        ScheduledFuture<?> cancelled = null;
        synchronized (lock) {
            SharedTempRef ref = refs.get(sharedId);
            if (ref == null) {
                refs.put(sharedId, new SharedTempRef(filePath));
                return;
            }
            ref.refCount++;
            ref.generation++;
            cancelled = ref.pendingDeletion;
            ref.pendingDeletion = null;
        }
        if (cancelled != null) {
            cancelled.cancel(false);
            log.debug("Pending deletion cancelled for shared temp {}", LogSanitizer.sanitize(sharedId));
        }
    }

    /**
     * Drops a holder. At zero holders the file is scheduled for deletion after the grace period.
     */
    public void releaseRef(String sharedId) {
        if (sharedId == null || sharedId.isBlank()) {
            return;
        }
        ScheduledFuture<?> superseded = null;
        synchronized (lock) {
            SharedTempRef ref = refs.get(sharedId);
            if (ref == null) {
                return;
            }
            ref.refCount--;
            if (ref.refCount > 0) {
                return;
            }
            ref.refCount = 0;
            ref.generation++;
            long generation = ref.generation;
            superseded = ref.pendingDeletion;
            ref.pendingDeletion = scheduler.schedule(
                () -> deleteIfUnused(sharedId, generation),
                clock.instant().plus(grace));
        }
        if (superseded != null) {
            superseded.cancel(false);
        }
    }

    public int refCount(String sharedId) {
        synchronized (lock) {
            SharedTempRef ref = refs.get(sharedId);
            return ref == null ? 0 : ref.refCount;
        }
    }

    public boolean isTracked(String sharedId) {
        synchronized (lock) {
            return refs.containsKey(sharedId);
        }
    }

    boolean isTempFile(Path filePath) {
        if (filePath == null) {
            return false;
        }
        Path normalized = filePath.normalize();
        Path parent = normalized.getParent();
        while (parent != null) {
            Path name = parent.getFileName();
            if (name != null && name.toString().equals(tempDirName)) {
                return true;
            }
            parent = parent.getParent();
        }
        return false;
    }

    private void deleteIfUnused(String sharedId, long generation) {
        Path path;
        synchronized (lock) {
            SharedTempRef ref = refs.get(sharedId);
            if (ref == null || ref.generation != generation || ref.refCount > 0) {
                return;
            }
            refs.remove(sharedId);
            path = ref.path;
        }
        deleteWithRetry(path, 1);
    }

    private void deleteWithRetry(Path path, int attempt) {
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Cleaned temp file: {}", path.getFileName());
            }
        } catch (IOException ex) {
            if (attempt >= deleteAttempts) {
                log.warn("Failed to clean temp file {} after {} attempts: {}", path, attempt, ex.getMessage());
                return;
            }
            log.debug("Temp file {} not deleted yet (attempt {}): {}", path.getFileName(), attempt, ex.getMessage());
            scheduler.schedule(() -> deleteWithRetry(path, attempt + 1), clock.instant().plus(deleteRetryDelay));
        }
    }

    private static final class SharedTempRef {
        private final Path path;
        private int refCount = 1;
        private long generation = 1;
        private ScheduledFuture<?> pendingDeletion;

        private SharedTempRef(Path path) {
            this.path = path;
        }
    }
}
