package devicefleet.controlplane.script;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Allows one script start in flight per device. A device stays claimed by its deployment
 * until the run command was sent or the start was cancelled, timed out or abandoned.
 */
@Component
public class ScriptStartGuard {

    // deviceId -> deploymentId holding the device
    private final Map<String, String> inFlight = new ConcurrentHashMap<>();

    /**
     * @return false when the device is blank or already claimed by another start
     */
    public boolean tryAcquire(String deviceId, String deploymentId) {
        if (deviceId == null || deviceId.isBlank() || deploymentId == null) {
            return false;
        }
        return inFlight.putIfAbsent(deviceId, deploymentId) == null;
    }

    /**
     * Frees the device if {@code deploymentId} still holds it.
     */
    public void release(String deviceId, String deploymentId) {
        if (deviceId == null || deploymentId == null) {
            return;
        }
        inFlight.remove(deviceId, deploymentId);
    }

    public Optional<String> currentDeployment(String deviceId) {
        return deviceId == null ? Optional.empty() : Optional.ofNullable(inFlight.get(deviceId));
    }

    public boolean isBusy(String deviceId) {
        return deviceId != null && inFlight.containsKey(deviceId);
    }
}
