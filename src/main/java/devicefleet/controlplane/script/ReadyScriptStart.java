package devicefleet.controlplane.script;

import java.util.Set;

/**
 * Run command of a script start whose targets all reported success.
 *
 * @param runPayload         pre-serialized run message, sent verbatim when {@code runPayloadPrepared}
 * @param runPayloadPrepared whether {@code runPayload} is usable as is
 * @param runName            script name for a plain run command
 * @param targets            every target registered for the start
 */
public record ReadyScriptStart(
    byte[] runPayload,
    boolean runPayloadPrepared,
    String runName,
    Set<String> targets
) {
}
