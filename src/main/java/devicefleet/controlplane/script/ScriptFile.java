package devicefleet.controlplane.script;

import java.nio.file.Path;

/**
 * One file of an encoded script package.
 *
 * @param path           target path on the device
 * @param normalizedPath target path with '/' separators
 * @param sourcePath     file on the server
 * @param data           base64 content; empty for large files that travel as staged transfers
 * @param md5            hex MD5 of a large file for transfer verification; empty for inline files
 * @param size           file size in bytes
 * @param mainJson       whether this is a package descriptor ({@code main.json})
 */
public record ScriptFile(
    String path,
    String normalizedPath,
    Path sourcePath,
    String data,
    String md5,
    long size,
    boolean mainJson
) {

    public boolean isInline() {
        return data != null && !data.isEmpty();
    }
}
