package org.iceforge.tiercache.local;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.tiercache.cache.CacheCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Local, authoritative tier. Objects live in one flat directory:
 * <pre>
 *   {dir}/a-{actionId}   index entry (JSON)
 *   {dir}/o-{outputId}   blob bytes
 * </pre>
 * Blob and index are each written with temp-file-plus-rename, as two separate atomic
 * steps. A crash in between leaves an orphan blob, which is harmless because only the
 * index defines whether an action is cached.
 * <p>
 * There is no lock: concurrent puts of the same output id write identical bytes, so
 * whichever rename lands last still leaves correct content.
 */
public class DiskContentStore {
    private static final Logger log = LoggerFactory.getLogger(DiskContentStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path dir;
    private final CacheCounters counters = new CacheCounters();
    private volatile boolean started;

    public DiskContentStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir").toAbsolutePath().normalize();
    }

    public void start() {
        log.info("Starting disk tier: dir={}", dir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ContentStoreException("Failed to create cache directory: " + dir, e);
        }
        started = true;
    }

    /**
     * Looks up the index entry for {@code actionId}.
     * <p>
     * A missing index is a plain miss, as is a key that cannot name a file in the cache
     * directory (such as one containing a path separator). A malformed index, or one whose output id is not
     * hex, is counted as an error but still reported as a miss: local corruption only
     * means "not cached".
     *
     * @throws ContentStoreException if the index exists but cannot be read
     */
    public Optional<LocalEntry> get(String actionId) {
        ensureStarted("get");
        counters.recordGet();
        log.debug("disk get actionId={}", actionId);

        Path index;
        try {
            index = indexPath(actionId);
        } catch (IllegalArgumentException e) {
            // no flat index file can exist for this key, so it was never written
            log.debug("actionId={} maps outside the cache directory, treating as miss", actionId);
            counters.recordMiss();
            return Optional.empty();
        }
        byte[] raw;
        try {
            raw = Files.readAllBytes(index);
        } catch (NoSuchFileException e) {
            counters.recordMiss();
            return Optional.empty();
        } catch (IOException e) {
            counters.recordGetError();
            throw new ContentStoreException("Failed to read index entry: " + index, e);
        }

        IndexEntry entry;
        try {
            entry = MAPPER.readValue(raw, IndexEntry.class);
        } catch (IOException e) {
            log.error("Corrupted index entry for actionId={}, treating as miss", actionId, e);
            counters.recordGetError();
            return Optional.empty();
        }
        if (entry == null || !isHex(entry.outputId())) {
            log.warn("Index entry for actionId={} has an invalid output id, treating as miss", actionId);
            counters.recordGetError();
            return Optional.empty();
        }

        counters.recordHit();
        return Optional.of(new LocalEntry(entry.outputId(), blobPath(entry.outputId())));
    }

    /**
     * Stores {@code size} bytes from {@code body} under {@code outputId} and points
     * {@code actionId} at it.
     *
     * @return path of the blob file
     * @throws ContentStoreException on any I/O failure, or if the body length differs from {@code size}
     */
    public Path put(String actionId, String outputId, long size, InputStream body) {
        ensureStarted("put");
        counters.recordPut();
        log.debug("disk put actionId={} outputId={} size={}", actionId, outputId, size);

        if (!isHex(outputId)) {
            counters.recordPutError();
            throw new IllegalArgumentException("outputId must be hex: " + outputId);
        }
        Path blob = blobPath(outputId);
        Path index = indexPath(actionId);
        long startNanos = System.nanoTime();
        try {
            if (size == 0) {
                // empty blobs are common and need no temp file
                Files.newOutputStream(blob,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE).close();
            } else {
                writeAtomic(blob, body, size);
            }

            byte[] json = MAPPER.writeValueAsBytes(new IndexEntry(
                    IndexEntry.CURRENT_VERSION, outputId, size, unixNanos(Instant.now())));
            writeAtomic(index, new ByteArrayInputStream(json), json.length);
        } catch (IOException e) {
            counters.recordPutError();
            throw new ContentStoreException("Disk put failed: actionId=" + actionId + " outputId=" + outputId, e);
        }
        counters.recordPutTransfer(size, Duration.ofNanos(System.nanoTime() - startNanos));
        return blob;
    }

    public void close() {
        ensureStarted("close");
        started = false;
        log.info("Closed disk tier: dir={}", dir);
    }

    public boolean isStarted() {
        return started;
    }

    public Path directory() {
        return dir;
    }

    public CacheCounters counters() {
        return counters;
    }

    Path indexPath(String actionId) {
        return fileInDir("a-" + actionId);
    }

    Path blobPath(String outputId) {
        return fileInDir("o-" + outputId);
    }

    private Path fileInDir(String name) {
        Path p = dir.resolve(name).normalize();
        if (!dir.equals(p.getParent())) {
            throw new IllegalArgumentException("Illegal cache key (path traversal): " + name);
        }
        return p;
    }

    private void ensureStarted(String op) {
        if (!started) {
            throw new IllegalStateException("Disk tier not started, cannot " + op + ": " + dir);
        }
    }

    /**
     * Streams {@code in} to a temp file beside {@code dest}, checks the byte count and
     * renames it into place. The temp file is removed on any failure.
     */
    private static void writeAtomic(Path dest, InputStream in, long expectedSize) throws IOException {
        Path tmp = Files.createTempFile(dest.getParent(), dest.getFileName() + ".", ".tmp");
        boolean moved = false;
        try {
            long written = Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            if (written != expectedSize) {
                throw new IOException("Wrote " + written + " bytes, expected " + expectedSize + " for " + dest);
            }
            Files.move(tmp, dest, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(tmp);
            }
        }
    }

    public static boolean isHex(String s) {
        if (s == null || s.isEmpty() || s.length() % 2 != 0) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!hex) {
                return false;
            }
        }
        return true;
    }

    private static long unixNanos(Instant t) {
        return t.getEpochSecond() * 1_000_000_000L + t.getNano();
    }
}
