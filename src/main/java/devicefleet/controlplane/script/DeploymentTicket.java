package devicefleet.controlplane.script;

import java.util.Set;

/**
 * Result of starting a deployment.
 *
 * @param deploymentId   key of the pending start; devices echo it in their acknowledgements
 * @param runName        script the devices will run
 * @param fileCount      number of files in the package
 * @param targets        unique devices the start was registered for
 * @param offlineDevices devices the package could not be pushed to
 * @param busyDevices    devices skipped because an earlier start on them has not finished
 */
public record DeploymentTicket(
    String deploymentId,
    String runName,
    int fileCount,
    Set<String> targets,
    Set<String> offlineDevices,
    Set<String> busyDevices
) {

    public boolean cancelled() {
        return !offlineDevices.isEmpty();
    }

    /**
     * Every requested device was busy, so nothing was pushed.
     */
    public boolean refused() {
        return targets.isEmpty();
    }
}
