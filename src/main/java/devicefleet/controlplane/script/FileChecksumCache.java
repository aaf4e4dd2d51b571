package devicefleet.controlplane.script;

import devicefleet.controlplane.config.ScriptProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * MD5 checksums of files too large to inline, so a device can verify a staged transfer.
 * A checksum is reused while the file keeps its size and modification time.
 */
@Component
@Slf4j
public class FileChecksumCache {

    private final int maxEntries;
    private final int trimTo;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Path, Checksum> checksums = new LinkedHashMap<>();

    public FileChecksumCache(ScriptProperties properties) {
        this.maxEntries = properties.getChecksumCacheMaxEntries();
        this.trimTo = properties.getChecksumCacheTrimTo();
    }

    public String md5Hex(Path file) throws IOException {
        Path key = file.toAbsolutePath().normalize();
        BasicFileAttributes attrs = Files.readAttributes(key, BasicFileAttributes.class);
        long size = attrs.size();
        long modifiedNanos = attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS);

        lock.readLock().lock();
        Checksum cached;
        try {
            cached = checksums.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (cached != null && cached.size() == size && cached.modifiedNanos() == modifiedNanos) {
            return cached.md5();
        }

        String md5;
        try (InputStream in = Files.newInputStream(key)) {
            md5 = DigestUtils.md5DigestAsHex(in);
        }

        lock.writeLock().lock();
        try {
            checksums.remove(key);
            trimLocked();
            checksums.put(key, new Checksum(size, modifiedNanos, md5));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Checksum computed for {} ({} bytes)", key.getFileName(), size);
        return md5;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return checksums.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void trimLocked() {
        if (checksums.size() < maxEntries) {
            return;
        }
        int toRemove = Math.max(1, checksums.size() - trimTo);
        Iterator<Path> it = checksums.keySet().iterator();
        while (toRemove > 0 && it.hasNext()) {
            it.next();
            it.remove();
            toRemove--;
        }
    }

    private record Checksum(long size, long modifiedNanos, String md5) {
    }
}
