package devicefleet.controlplane.script;

import devicefleet.controlplane.config.ScriptProperties;
import devicefleet.controlplane.exception.ScriptPackageException;
import devicefleet.controlplane.util.LogSanitizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Caches encoded script packages so repeated deployments of an unchanged script skip
 * reading and base64-encoding its files.
 *
 * <p>An entry is valid while its fingerprint (relative path, size and modification time of
 * every file) matches the disk. Any change rebuilds the whole package. Files are read outside
 * the lock and the finished entry is swapped in under the write lock, so concurrent rebuilds
 * of the same key may race but every stored fingerprint belongs to the file list stored with it.
 */
@Service
@Slf4j
public class ScriptPackageCache {

    static final String DEVICE_SCRIPT_DIR = "lua/scripts/";

    private final FileChecksumCache checksums;
    private final long largeFileThreshold;
    private final int maxEntries;
    private final int trimTo;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    // insertion ordered so trimming drops the oldest packages first
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();

    public ScriptPackageCache(ScriptProperties properties, FileChecksumCache checksums) {
        this.checksums = checksums;
        this.largeFileThreshold = properties.getLargeFileThreshold();
        this.maxEntries = properties.getCacheMaxEntries();
        this.trimTo = properties.getCacheTrimTo();
    }

    /**
     * Returns the encoded files of a script, from cache when nothing changed on disk.
     *
     * @param scriptRoot file or directory holding the script
     * @param scriptName name the script is deployed under
     * @param directory  whether {@code scriptRoot} is a directory package
     * @param piled      directory packages that already carry the device layout
     * @return files in deterministic depth-first lexical order
     * @throws ScriptPackageException when the script cannot be listed or read; the cached entry is kept
     */
    public List<ScriptFile> collect(Path scriptRoot, String scriptName, boolean directory, boolean piled) {
        String fingerprint;
        try {
            fingerprint = fingerprint(scriptRoot, directory);
        } catch (IOException | UncheckedIOException ex) {
            throw readFailure(scriptRoot, ex);
        }

        String key = cacheKey(scriptRoot, scriptName, directory, piled);
        lock.readLock().lock();
        CacheEntry cached;
        try {
            cached = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (cached != null && cached.fingerprint().equals(fingerprint)) {
            return cached.files();
        }

        List<ScriptFile> files;
        try {
            files = build(scriptRoot, scriptName, directory, piled);
        } catch (IOException | UncheckedIOException ex) {
            throw readFailure(scriptRoot, ex);
        }

        lock.writeLock().lock();
        try {
            entries.remove(key);
            trimLocked();
            entries.put(key, new CacheEntry(fingerprint, files));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Script package rebuilt: {} ({} files)", LogSanitizer.sanitize(scriptName), files.size());
        return files;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Hash of path, size and modification time of every file, without reading contents.
     */
    String fingerprint(Path scriptRoot, boolean directory) throws IOException {
        MessageDigest digest = newSha256();
        if (!directory) {
            BasicFileAttributes attrs = Files.readAttributes(scriptRoot, BasicFileAttributes.class);
            writePart(digest, "file");
            writePart(digest, Long.toString(attrs.size()));
            writePart(digest, Long.toString(attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS)));
            return HexFormat.of().formatHex(digest.digest());
        }
        walk(scriptRoot, (path, attrs) -> {
            writePart(digest, relativePath(scriptRoot, path));
            writePart(digest, Long.toString(attrs.size()));
            writePart(digest, Long.toString(attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS)));
        });
        return HexFormat.of().formatHex(digest.digest());
    }

    private List<ScriptFile> build(Path scriptRoot, String scriptName, boolean directory, boolean piled)
        throws IOException {
        List<ScriptFile> files = new ArrayList<>();
        if (!directory) {
            long size = Files.size(scriptRoot);
            files.add(toScriptFile(DEVICE_SCRIPT_DIR + scriptName, scriptRoot, size));
            return List.copyOf(files);
        }
        walk(scriptRoot, (path, attrs) -> {
            String relative = relativePath(scriptRoot, path);
            String target = piled ? relative : DEVICE_SCRIPT_DIR + scriptName + "/" + relative;
            files.add(toScriptFile(target, path, attrs.size()));
        });
        return List.copyOf(files);
    }

    private ScriptFile toScriptFile(String targetPath, Path source, long size) throws IOException {
        String normalized = normalize(targetPath);
        String data = "";
        String md5 = "";
        if (size < largeFileThreshold) {
            data = Base64.getEncoder().encodeToString(Files.readAllBytes(source));
        } else {
            md5 = checksums.md5Hex(source);
        }
        return new ScriptFile(targetPath, normalized, source, data, md5, size, isMainJson(normalized));
    }

    /**
     * Visits regular files below {@code root} depth first in lexical order. Directory symlinks
     * are skipped; file symlinks are visited with the attributes of their target.
     */
    static void walk(Path root, FileVisitor visitor) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Script root is not a directory: " + root);
        }
        walkDirectory(root, visitor);
    }

    private static void walkDirectory(Path dir, FileVisitor visitor) throws IOException {
        List<Path> children;
        try (Stream<Path> listing = Files.list(dir)) {
            children = listing
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .toList();
        }
        for (Path child : children) {
            BasicFileAttributes linkAttrs = Files.readAttributes(
                child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (linkAttrs.isSymbolicLink()) {
                BasicFileAttributes resolved = Files.readAttributes(child, BasicFileAttributes.class);
                if (resolved.isDirectory()) {
                    continue;
                }
                visitor.visit(child, resolved);
                continue;
            }
            if (linkAttrs.isDirectory()) {
                walkDirectory(child, visitor);
                continue;
            }
            visitor.visit(child, linkAttrs);
        }
    }

    static boolean isMainJson(String normalizedPath) {
        return normalizedPath.equals(DEVICE_SCRIPT_DIR + "main.json") || normalizedPath.endsWith("/main.json");
    }

    static String normalize(String path) {
        return path.replace('\\', '/');
    }

    private static String relativePath(Path root, Path path) {
        return normalize(root.relativize(path).toString());
    }

    private static String cacheKey(Path scriptRoot, String scriptName, boolean directory, boolean piled) {
        return scriptRoot + "|" + scriptName + "|" + directory + "|" + piled;
    }

    private void trimLocked() {
        if (entries.size() < maxEntries) {
            return;
        }
        int toRemove = Math.max(1, entries.size() - trimTo);
        Iterator<String> it = entries.keySet().iterator();
        while (toRemove > 0 && it.hasNext()) {
            it.next();
            it.remove();
            toRemove--;
        }
    }

    private static void writePart(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static ScriptPackageException readFailure(Path scriptRoot, Exception cause) {
        log.warn("Failed to read script package {}: {}", scriptRoot, cause.getMessage());
        return new ScriptPackageException(scriptRoot.toString(),
            "Failed to read script package: " + cause.getMessage(), cause);
    }

    @FunctionalInterface
    interface FileVisitor {
        void visit(Path path, BasicFileAttributes attrs) throws IOException;
    }

    private record CacheEntry(String fingerprint, List<ScriptFile> files) {
    }
}
