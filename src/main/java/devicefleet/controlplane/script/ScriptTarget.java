package devicefleet.controlplane.script;

import java.nio.file.Path;

/**
 * A deployable script resolved inside the scripts directory.
 *
 * @param path           absolute location on the server
 * @param normalizedName name relative to the scripts directory with '/' separators
 * @param directory      whether the script is a directory package
 * @param piled          directory package already laid out as the device expects
 * @param runName        name passed to the device's run command
 */
public record ScriptTarget(
    Path path,
    String normalizedName,
    boolean directory,
    boolean piled,
    String runName
) {
}
