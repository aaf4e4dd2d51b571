package devicefleet.controlplane.script;

import devicefleet.controlplane.util.LogSanitizer;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Gateway used when no device transport is wired in; every device counts as offline.
 */
@Slf4j
public class NoopDeviceGateway implements DeviceGateway {

    @Override
    public boolean pushPackage(String deviceId, String deploymentId, List<ScriptFile> files, Path stagedFile) {
        log.info("Package push suppressed (no device transport). device={} files={}",
            LogSanitizer.maskIdentifier(deviceId), files.size());
        return false;
    }

    @Override
    public void runScript(String deviceId, ReadyScriptStart start) {
        log.info("Run command suppressed (no device transport). device={} script={}",
            LogSanitizer.maskIdentifier(deviceId), LogSanitizer.sanitize(start.runName()));
    }

    @Override
    public void notifyControllers(String deploymentId, String message) {
        log.info("Deployment {}: {}", LogSanitizer.sanitize(deploymentId), LogSanitizer.sanitize(message));
    }
}
