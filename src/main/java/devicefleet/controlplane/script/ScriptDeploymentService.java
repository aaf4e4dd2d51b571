package devicefleet.controlplane.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import devicefleet.controlplane.event.ScriptStartTimedOutEvent;
import devicefleet.controlplane.transfer.SharedTempRefCounter;
import devicefleet.controlplane.util.LogSanitizer;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Pushes a script to several devices and starts it once every device has received it.
 *
 * <p>Flow: resolve the script, take its encoded package from the cache, register one pending
 * start for all devices, then push the package to each device. Devices acknowledge the transfer;
 * when all succeeded the run command goes to every device, and the first failure (or an offline
 * device, or the wait timeout) cancels the start for all of them. A staged file shared by the
 * deployment holds one reference per device until that device is done with it.
 *
 * <p>A device takes part in one start at a time; devices still busy with an earlier start are
 * skipped and reported on the ticket.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScriptDeploymentService {

    static final String RUN_MESSAGE_TYPE = "script/run";
    static final String OFFLINE_REASON = "device offline";
    static final String BUSY_REASON = "previous script start not finished, retry later";

    private final ScriptPathResolver pathResolver;
    private final ScriptPackageCache packageCache;
    private final PendingScriptStartCoordinator coordinator;
    private final SharedTempRefCounter tempRefs;
    private final ScriptStartGuard startGuard;
    private final DeviceGateway deviceGateway;
    private final ObjectMapper objectMapper;

    // deploymentId -> devices still holding a reference on the staged file
    private final Map<String, Set<String>> stagedHolders = new ConcurrentHashMap<>();
    // deploymentId -> devices claimed in the start guard
    private final Map<String, Set<String>> claimedDevices = new ConcurrentHashMap<>();
    // deploymentId -> deviceId -> large files the device has not reported yet, for path-only reports
    private final Map<String, Map<String, Set<String>>> pendingFetches = new ConcurrentHashMap<>();

    /**
     * @param stagedFile optional staged artifact shared by all devices of the deployment
     */
    public DeploymentTicket deploy(String scriptName, Collection<String> deviceIds, Path stagedFile) {
        ScriptTarget target = pathResolver.resolve(scriptName);
        Set<String> devices = uniqueDevices(deviceIds);
        if (devices.isEmpty()) {
            throw new IllegalArgumentException("at least one device is required");
        }

        List<ScriptFile> files = packageCache.collect(
            target.path(), target.normalizedName(), target.directory(), target.piled());

        String deploymentId = UUID.randomUUID().toString();
        Set<String> accepted = new LinkedHashSet<>();
        Set<String> busy = new LinkedHashSet<>();
        for (String device : devices) {
            if (startGuard.tryAcquire(device, deploymentId)) {
                accepted.add(device);
            } else {
                busy.add(device);
                deviceGateway.notifyControllers(deploymentId, BUSY_REASON + " (" + device + ")");
            }
        }
        if (!busy.isEmpty()) {
            log.info("Skipping {} busy devices for {}", busy.size(), deploymentId);
        }
        if (accepted.isEmpty()) {
            return new DeploymentTicket(deploymentId, target.runName(), files.size(), Set.of(), Set.of(), busy);
        }
        claimedDevices.put(deploymentId, accepted);
        trackFetches(deploymentId, accepted, files);

        byte[] runPayload = buildRunPayload(target.runName());
        boolean runPayloadPrepared = runPayload.length > 0;

        if (stagedFile != null) {
            Set<String> holders = ConcurrentHashMap.newKeySet();
            holders.addAll(accepted);
            stagedHolders.put(deploymentId, holders);
            accepted.forEach(device -> tempRefs.registerRef(deploymentId, stagedFile));
        }

        coordinator.register(deploymentId, runPayload, runPayloadPrepared, target.runName(), accepted);
        log.info("Deploying {} ({} files) to {} devices as {}", LogSanitizer.sanitize(target.normalizedName()),
            files.size(), accepted.size(), deploymentId);

        Set<String> offline = new LinkedHashSet<>();
        for (String device : accepted) {
            if (!coordinator.hasPending(deploymentId)) {
                break;
            }
            if (!deviceGateway.pushPackage(device, deploymentId, files, stagedFile)) {
                offline.add(device);
                handleCompletion(deploymentId, device,
                    coordinator.complete(deploymentId, device, false, OFFLINE_REASON));
            }
        }

        return new DeploymentTicket(deploymentId, target.runName(), files.size(), Set.copyOf(accepted), offline, busy);
    }

    /**
     * Handles a transfer acknowledgement message body from a device.
     *
     * @return whether the acknowledgement belonged to an open deployment
     */
    public boolean onTransferAcknowledged(String deviceId, Object body) {
        Optional<TransferAcknowledgement> parsed = TransferAcknowledgement.fromBody(body);
        if (parsed.isEmpty() || deviceId == null) {
            return false;
        }
        TransferAcknowledgement ack = parsed.get();
        if (ack.isPathOnly()) {
            return onPathOnlyAcknowledged(deviceId, ack);
        }
        ScriptStartCompletion completion = coordinator.complete(
            ack.deploymentId(), deviceId, ack.success(), ack.error());
        releaseStagedRef(ack.deploymentId(), deviceId);
        handleCompletion(ack.deploymentId(), deviceId, completion);
        return completion.handled();
    }

    /**
     * Reports from agents that only name the fetched file. The deployment is the one currently
     * holding the device, and the device is complete once all its large files were reported.
     */
    private boolean onPathOnlyAcknowledged(String deviceId, TransferAcknowledgement ack) {
        Optional<String> current = startGuard.currentDeployment(deviceId);
        if (current.isEmpty()) {
            return false;
        }
        String deploymentId = current.get();
        Map<String, Set<String>> byDevice = pendingFetches.get(deploymentId);
        Set<String> remaining = byDevice == null ? null : byDevice.get(deviceId);
        String targetPath = ScriptPackageCache.normalize(ack.targetPath());
        if (remaining == null || !remaining.remove(targetPath)) {
            return false;
        }
        if (ack.success() && !remaining.isEmpty()) {
            return true;
        }
        String reason = ack.success() ? "" : describeFailure(ack.error(), targetPath);
        ScriptStartCompletion completion = coordinator.complete(deploymentId, deviceId, ack.success(), reason);
        releaseStagedRef(deploymentId, deviceId);
        handleCompletion(deploymentId, deviceId, completion);
        return completion.handled();
    }

    /**
     * Abandons a deployment without notifying devices.
     */
    public void cancel(String deploymentId) {
        coordinator.clear(deploymentId);
        releaseAllStagedRefs(deploymentId);
        releaseDevices(deploymentId);
    }

    @EventListener(ScriptStartTimedOutEvent.class)
    public void onScriptStartTimedOut(ScriptStartTimedOutEvent event) {
        releaseAllStagedRefs(event.getDeploymentId());
        releaseDevices(event.getDeploymentId());
        deviceGateway.notifyControllers(event.getDeploymentId(), "script start cancelled: " + event.getReason());
    }

    private void handleCompletion(String deploymentId, String deviceId, ScriptStartCompletion completion) {
        if (!completion.handled()) {
            return;
        }
        if (completion.isCancelled()) {
            releaseAllStagedRefs(deploymentId);
            releaseDevices(deploymentId);
            log.warn("Deployment {} cancelled by device {}: {}", deploymentId,
                LogSanitizer.maskIdentifier(deviceId), LogSanitizer.sanitize(completion.cancelMessage()));
            deviceGateway.notifyControllers(deploymentId, "script start cancelled: " + completion.cancelMessage());
            return;
        }
        if (completion.isReady()) {
            ReadyScriptStart ready = completion.ready();
            for (String device : ready.targets()) {
                deviceGateway.runScript(device, ready);
            }
            releaseDevices(deploymentId);
            deviceGateway.notifyControllers(deploymentId, "transfers complete, script started");
        }
    }

    private byte[] buildRunPayload(String runName) {
        try {
            return objectMapper.writeValueAsBytes(Map.of(
                "type", RUN_MESSAGE_TYPE,
                "body", Map.of("name", runName)));
        } catch (JsonProcessingException ex) {
            log.warn("Could not prepare run payload for {}: {}", LogSanitizer.sanitize(runName), ex.getMessage());
            return new byte[0];
        }
    }

    private void releaseStagedRef(String deploymentId, String deviceId) {
        Set<String> holders = stagedHolders.get(deploymentId);
        if (holders != null && holders.remove(deviceId)) {
            tempRefs.releaseRef(deploymentId);
            stagedHolders.computeIfPresent(deploymentId, (id, remaining) -> remaining.isEmpty() ? null : remaining);
        }
    }

    private void releaseAllStagedRefs(String deploymentId) {
        Set<String> holders = stagedHolders.remove(deploymentId);
        if (holders == null) {
            return;
        }
        for (String device : holders) {
            if (holders.remove(device)) {
                tempRefs.releaseRef(deploymentId);
            }
        }
    }

    private void trackFetches(String deploymentId, Set<String> devices, List<ScriptFile> files) {
        List<String> largeFiles = files.stream()
            .filter(file -> !file.isInline())
            .map(ScriptFile::normalizedPath)
            .toList();
        if (largeFiles.isEmpty()) {
            return;
        }
        Map<String, Set<String>> byDevice = new ConcurrentHashMap<>();
        for (String device : devices) {
            Set<String> remaining = ConcurrentHashMap.newKeySet();
            remaining.addAll(largeFiles);
            byDevice.put(device, remaining);
        }
        pendingFetches.put(deploymentId, byDevice);
    }

    private void releaseDevices(String deploymentId) {
        pendingFetches.remove(deploymentId);
        Set<String> claimed = claimedDevices.remove(deploymentId);
        if (claimed != null) {
            claimed.forEach(device -> startGuard.release(device, deploymentId));
        }
    }

    private static String describeFailure(String error, String targetPath) {
        String trimmed = error == null ? "" : error.trim();
        if (trimmed.isEmpty()) {
            trimmed = PendingScriptStartCoordinator.UNKNOWN_FAILURE;
        }
        return trimmed + " (" + targetPath + ")";
    }

    private static Set<String> uniqueDevices(Collection<String> deviceIds) {
        Set<String> devices = new LinkedHashSet<>();
        if (deviceIds == null) {
            return devices;
        }
        for (String id : deviceIds) {
            if (id != null && !id.isBlank()) {
                devices.add(id.trim());
            }
        }
        return devices;
    }
}
