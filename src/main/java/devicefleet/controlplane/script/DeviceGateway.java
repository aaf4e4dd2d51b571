package devicefleet.controlplane.script;

import java.nio.file.Path;
import java.util.List;

/**
 * Outbound side of the device channel used by script deployments. Implementations own the
 * device connections; device acknowledgements come back through
 * {@link ScriptDeploymentService#onTransferAcknowledged(String, Object)}.
 */
public interface DeviceGateway {

    /**
     * Sends a script package to a device. Inline files are written directly; large files
     * are fetched by the device from {@code stagedFile} or their source path.
     *
     * @return false when the device is not connected
     */
    boolean pushPackage(String deviceId, String deploymentId, List<ScriptFile> files, Path stagedFile);

    void runScript(String deviceId, ReadyScriptStart start);

    /**
     * Shows a status line for a deployment on every connected controller.
     */
    void notifyControllers(String deploymentId, String message);
}
