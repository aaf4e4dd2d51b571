package devicefleet.controlplane.exception;

/**
 * Thrown when a requested script name is blank, escapes the scripts directory,
 * or does not name a deployable script.
 */
public class InvalidScriptPathException extends IllegalArgumentException {

    public InvalidScriptPathException(String message) {
        super(message);
    }
}
