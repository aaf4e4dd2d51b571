package devicefleet.controlplane.script;

import devicefleet.controlplane.config.ScriptProperties;
import devicefleet.controlplane.event.ScriptStartTimedOutEvent;
import devicefleet.controlplane.util.LogSanitizer;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Tracks script starts addressed to several targets and turns the per-target reports into one
 * outcome: ready once every target succeeded, cancelled on the first failure.
 *
 * <p>One start may be outstanding per key; registering a key again replaces the previous start.
 * Duplicate targets in a registration count once. Finalized starts are removed, and reports
 * that arrive afterwards are ignored.
 *
 * <p>The optional wait timer does not decide anything on its own: when it fires with targets
 * still outstanding it reports a failure for one of them, exactly as a device would, and
 * publishes a {@link ScriptStartTimedOutEvent}.
 */
@Service
@Slf4j
public class PendingScriptStartCoordinator {

    static final String UNKNOWN_FAILURE = "unknown error";
    static final String TIMEOUT_REASON = "timed out waiting for device transfers";

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final Duration defaultWaitTimeout;

    private final Object lock = new Object();
    private final Map<String, PendingScriptStart> entries = new HashMap<>();
    private long sequence;

    public PendingScriptStartCoordinator(
        ScriptProperties properties,
        TaskScheduler scheduler,
        Clock clock,
        ApplicationEventPublisher eventPublisher
    ) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.defaultWaitTimeout = properties.getStartWaitTimeout();
    }

    public boolean register(String key, byte[] runPayload, boolean runPayloadPrepared, String runName,
                            Collection<String> targets) {
        return register(key, runPayload, runPayloadPrepared, runName, targets, defaultWaitTimeout);
    }

    /**
     * Registers (or replaces) the start for {@code key}.
     *
     * @param waitTimeout zero or negative disables the wait timer
     * @return false when the key is blank or no usable target was given
     */
    public boolean register(String key, byte[] runPayload, boolean runPayloadPrepared, String runName,
                            Collection<String> targets, Duration waitTimeout) {
        if (key == null || key.isBlank() || targets == null) {
            return false;
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String target : targets) {
            if (target != null && !target.isBlank()) {
                unique.add(target.trim());
            }
        }
        if (unique.isEmpty()) {
            return false;
        }

        PendingScriptStart entry = new PendingScriptStart(
            runPayload == null ? new byte[0] : runPayload.clone(),
            runPayloadPrepared,
            runName,
            unique);

        ScheduledFuture<?> replacedTimer = null;
        boolean replaced;
        synchronized (lock) {
            entry.generation = ++sequence;
            PendingScriptStart previous = entries.put(key, entry);
            replaced = previous != null;
            if (previous != null) {
                replacedTimer = previous.waitTimer;
            }
            if (waitTimeout != null && !waitTimeout.isZero() && !waitTimeout.isNegative()) {
                long generation = entry.generation;
                entry.waitTimer = scheduler.schedule(
                    () -> expire(key, generation),
                    clock.instant().plus(waitTimeout));
            }
        }
        if (replacedTimer != null) {
            replacedTimer.cancel(false);
        }
        if (replaced) {
            log.info("Pending script start {} replaced by a new registration", LogSanitizer.sanitize(key));
        }
        log.debug("Pending script start {} registered for {} targets", LogSanitizer.sanitize(key), unique.size());
        return true;
    }

    /**
     * Reports the outcome of one target.
     */
    public ScriptStartCompletion complete(String key, String targetId, boolean success, String reason) {
        return complete(key, targetId, success, reason, null);
    }

    /**
     * Force-removes the start for {@code key}. Safe to call for unknown keys.
     */
    public void clear(String key) {
        if (key == null) {
            return;
        }
        PendingScriptStart removed;
        synchronized (lock) {
            removed = entries.remove(key);
        }
        if (removed != null) {
            cancelTimer(removed.waitTimer);
        }
    }

    public boolean hasPending(String key) {
        synchronized (lock) {
            return key != null && entries.containsKey(key);
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public Set<String> outstandingTargets(String key) {
        synchronized (lock) {
            PendingScriptStart entry = key == null ? null : entries.get(key);
            return entry == null ? Set.of() : Set.copyOf(entry.remaining);
        }
    }

    void expire(String key, long generation) {
        String target;
        Set<String> outstanding;
        synchronized (lock) {
            PendingScriptStart entry = entries.get(key);
            if (entry == null || entry.generation != generation || entry.remaining.isEmpty()) {
                return;
            }
            outstanding = Set.copyOf(entry.remaining);
            target = entry.remaining.iterator().next();
        }

        ScriptStartCompletion completion = complete(key, target, false, TIMEOUT_REASON, generation);
        if (completion.isCancelled()) {
            log.warn("Script start {} timed out with {} targets outstanding",
                LogSanitizer.sanitize(key), outstanding.size());
            eventPublisher.publishEvent(new ScriptStartTimedOutEvent(this, key, outstanding, TIMEOUT_REASON));
        }
    }

    private ScriptStartCompletion complete(String key, String targetId, boolean success, String reason,
                                           Long expectedGeneration) {
        if (key == null || targetId == null) {
            return ScriptStartCompletion.notHandled();
        }

        String target = targetId.trim();
        PendingScriptStart finalized;
        ScriptStartCompletion result;
        synchronized (lock) {
            PendingScriptStart entry = entries.get(key);
            if (entry == null || !entry.remaining.contains(target)) {
                return ScriptStartCompletion.notHandled();
            }
            if (expectedGeneration != null && entry.generation != expectedGeneration) {
                return ScriptStartCompletion.notHandled();
            }

            if (!success) {
                entries.remove(key);
                finalized = entry;
                result = ScriptStartCompletion.cancelled(normalizeReason(reason));
            } else {
                entry.remaining.remove(target);
                if (!entry.remaining.isEmpty()) {
                    return ScriptStartCompletion.progressed();
                }
                entries.remove(key);
                finalized = entry;
                result = ScriptStartCompletion.ready(new ReadyScriptStart(
                    entry.runPayload.clone(),
                    entry.runPayloadPrepared,
                    entry.runName,
                    entry.targets));
            }
        }

        cancelTimer(finalized.waitTimer);
        if (result.isCancelled()) {
            log.info("Script start {} cancelled by target {}: {}", LogSanitizer.sanitize(key),
                LogSanitizer.maskIdentifier(target), LogSanitizer.sanitize(result.cancelMessage()));
        } else {
            log.info("Script start {} ready on {} targets", LogSanitizer.sanitize(key), finalized.targets.size());
        }
        return result;
    }

    private static String normalizeReason(String reason) {
        String trimmed = reason == null ? "" : reason.trim();
        return trimmed.isEmpty() ? UNKNOWN_FAILURE : trimmed;
    }

    private static void cancelTimer(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private static final class PendingScriptStart {
        private final byte[] runPayload;
        private final boolean runPayloadPrepared;
        private final String runName;
        private final Set<String> targets;
        private final Set<String> remaining;
        private long generation;
        private ScheduledFuture<?> waitTimer;

        private PendingScriptStart(byte[] runPayload, boolean runPayloadPrepared, String runName,
                                   Set<String> targets) {
            this.runPayload = runPayload;
            this.runPayloadPrepared = runPayloadPrepared;
            this.runName = runName;
            this.targets = Set.copyOf(targets);
            this.remaining = new LinkedHashSet<>(targets);
        }
    }
}
