package devicefleet.controlplane.script;

/**
 * Outcome of reporting one target to {@link PendingScriptStartCoordinator#complete}.
 *
 * <p>{@code handled == false} means the report was ignored (unknown start, unknown or already
 * reported target, or a start that was already finalized). Callers stop waiting on a start once
 * they see a ready or cancelled completion.
 */
public record ScriptStartCompletion(ReadyScriptStart ready, String cancelMessage, boolean handled) {

    private static final ScriptStartCompletion NOT_HANDLED = new ScriptStartCompletion(null, "", false);
    private static final ScriptStartCompletion PROGRESSED = new ScriptStartCompletion(null, "", true);

    public static ScriptStartCompletion notHandled() {
        return NOT_HANDLED;
    }

    public static ScriptStartCompletion progressed() {
        return PROGRESSED;
    }

    public static ScriptStartCompletion ready(ReadyScriptStart ready) {
        return new ScriptStartCompletion(ready, "", true);
    }

    public static ScriptStartCompletion cancelled(String message) {
        return new ScriptStartCompletion(null, message, true);
    }

    public boolean isReady() {
        return ready != null;
    }

    public boolean isCancelled() {
        return handled && ready == null && !cancelMessage.isEmpty();
    }
}
