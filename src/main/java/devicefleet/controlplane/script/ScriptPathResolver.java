package devicefleet.controlplane.script;

import devicefleet.controlplane.config.ScriptProperties;
import devicefleet.controlplane.exception.InvalidScriptPathException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps a client supplied script name to a deployable script under the scripts directory.
 *
 * <p>Deployable scripts are {@code .lua}/{@code .xxt} files, {@code .xpp} directories, and
 * piled directories carrying {@code lua/scripts/main.lua} or {@code lua/scripts/main.xxt}.
 */
@Component
public class ScriptPathResolver {

    private static final String[] PILED_MAIN_FILES = {"main.lua", "main.xxt"};

    private final Path scriptsRoot;

    public ScriptPathResolver(ScriptProperties properties) {
        this.scriptsRoot = properties.getRoot().toAbsolutePath().normalize();
    }

    public ScriptTarget resolve(String rawName) {
        String name = sanitize(rawName);
        Path path = scriptsRoot.resolve(name).normalize();
        if (!path.startsWith(scriptsRoot) || path.equals(scriptsRoot)) {
            throw new InvalidScriptPathException("invalid script name");
        }
        if (!Files.exists(path)) {
            throw new InvalidScriptPathException("script not found");
        }

        boolean directory = Files.isDirectory(path);
        String fileName = path.getFileName().toString();
        String extension = extensionOf(fileName);
        if (!directory) {
            if (extension.equals(".lua") || extension.equals(".xxt")) {
                return new ScriptTarget(path, name, false, false, name);
            }
            throw new InvalidScriptPathException("not a selectable script");
        }
        if (extension.equals(".xpp")) {
            return new ScriptTarget(path, name, true, false, name);
        }
        for (String main : PILED_MAIN_FILES) {
            if (Files.isRegularFile(path.resolve("lua").resolve("scripts").resolve(main))) {
                return new ScriptTarget(path, name, true, true, main);
            }
        }
        throw new InvalidScriptPathException("not a selectable script");
    }

    /**
     * Trims and normalizes separators; rejects blank names, absolute paths and parent references.
     */
    static String sanitize(String rawName) {
        String name = rawName == null ? "" : rawName.trim();
        if (name.isEmpty()) {
            throw new InvalidScriptPathException("script name is required");
        }
        name = ScriptPackageCache.normalize(name);
        if (name.startsWith("/") || name.matches("^[A-Za-z]:.*")) {
            throw new InvalidScriptPathException("invalid script name");
        }
        StringBuilder clean = new StringBuilder();
        for (String segment : name.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new InvalidScriptPathException("invalid script name");
            }
            if (clean.length() > 0) {
                clean.append('/');
            }
            clean.append(segment);
        }
        if (clean.length() == 0) {
            throw new InvalidScriptPathException("invalid script name");
        }
        return clean.toString();
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
