package devicefleet.controlplane.exception;

/**
 * Exception thrown when a script package cannot be read from disk.
 */
public class ScriptPackageException extends RuntimeException {

    private final String scriptPath;

    public ScriptPackageException(String scriptPath, String message, Throwable cause) {
        super(message, cause);
        this.scriptPath = scriptPath;
    }

    public String getScriptPath() {
        return scriptPath;
    }
}
