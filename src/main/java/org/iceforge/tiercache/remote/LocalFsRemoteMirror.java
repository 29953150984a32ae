package org.iceforge.tiercache.remote;

import org.iceforge.tiercache.cache.CacheCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Local filesystem implementation of {@link RemoteMirror}.
 *
 * <p>Intended for dev / integration-test mode so the cache can run without any S3
 * dependency. Paths are mapped as:
 * <pre>
 *   {baseDir}/{bucket}/{prefix}/{actionId}        object body
 *   {baseDir}/{bucket}/{prefix}/{actionId}.meta   user metadata (properties)
 * </pre>
 * A put stages body and sidecar as temp files, removes the old sidecar, then renames
 * body and sidecar into place. A failed put leaves the previous object untouched; an
 * interrupted swap leaves a body without metadata, which reads as an error.
 */
public class LocalFsRemoteMirror implements RemoteMirror {
    private static final Logger log = LoggerFactory.getLogger(LocalFsRemoteMirror.class);

    private static final String META_PREFIX = "meta.";

    private final Path base;
    private final String bucket;
    private final String prefix;
    private final CacheCounters counters = new CacheCounters();

    public LocalFsRemoteMirror(Path baseDir, String bucket, String prefix) {
        this.base = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        try {
            Files.createDirectories(base);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create localBaseDir=" + base, e);
        }
        log.info("Using LOCAL remote store: baseDir={} bucket={} prefix={}", base, bucket, prefix);
    }

    @Override
    public void put(String actionId, String outputId, long size, InputStream body) {
        counters.recordPut();
        Path dst = pathFor(actionId);
        log.debug("local remote put {} outputId={} size={}", dst, outputId, size);

        long start = System.nanoTime();
        Path bodyTmp = null;
        Path metaTmp = null;
        try {
            Files.createDirectories(dst.getParent());

            // both files are staged before either replaces a live one
            bodyTmp = Files.createTempFile(dst.getParent(), "tiercache-", ".tmp");
            InputStream src = size == 0 ? InputStream.nullInputStream() : body;
            long written = Files.copy(src, bodyTmp, StandardCopyOption.REPLACE_EXISTING);
            if (written != size) {
                throw new IOException("Wrote " + written + " bytes, expected " + size);
            }

            Properties meta = new Properties();
            meta.setProperty(META_PREFIX + OUTPUT_ID_METADATA_KEY, outputId);
            metaTmp = Files.createTempFile(dst.getParent(), "tiercache-", ".tmp");
            try (OutputStream out = Files.newOutputStream(metaTmp)) {
                meta.store(out, "tiercache local object metadata");
            }

            Path metaPath = metaPathFor(dst);
            Files.deleteIfExists(metaPath);
            Files.move(bodyTmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            bodyTmp = null;
            Files.move(metaTmp, metaPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            metaTmp = null;
        } catch (IOException e) {
            counters.recordPutError();
            throw new RemoteAccessException("Local put failed for " + dst, e);
        } finally {
            deleteQuietly(bodyTmp);
            deleteQuietly(metaTmp);
        }
        counters.recordPutTransfer(size, Duration.ofNanos(System.nanoTime() - start));
    }

    @Override
    public Optional<RemoteObject> get(String actionId) {
        counters.recordGet();
        Path p = pathFor(actionId);
        log.debug("local remote get {}", p);

        long start = System.nanoTime();
        InputStream in;
        long size;
        try {
            size = Files.size(p);
            in = Files.newInputStream(p);
        } catch (NoSuchFileException e) {
            counters.recordMiss();
            return Optional.empty();
        } catch (IOException e) {
            counters.recordGetError();
            throw new RemoteAccessException("Local get failed for " + p, e);
        }

        String outputId = readOutputId(p);
        if (outputId == null || outputId.isBlank()) {
            try {
                in.close();
            } catch (IOException e) {
                log.debug("Failed to close {}", p, e);
            }
            counters.recordGetError();
            throw new RemoteAccessException("Local object has no " + OUTPUT_ID_METADATA_KEY + " metadata: " + p);
        }
        counters.recordGetTransfer(size, Duration.ofNanos(System.nanoTime() - start));
        counters.recordHit();
        return Optional.of(new RemoteObject(outputId, size, in));
    }

    @Override
    public String prefix() {
        return prefix;
    }

    @Override
    public CacheCounters counters() {
        return counters;
    }

    Path pathFor(String actionId) {
        Path root = base.resolve(bucket).resolve(prefix).normalize();
        Path p = root.resolve(actionId).normalize();
        // like S3 keys, action ids may contain '/', but must stay under the prefix
        if (p.equals(root) || !p.startsWith(root)) {
            throw new IllegalArgumentException("Illegal key (path traversal): bucket=" + bucket
                    + " key=" + prefix + "/" + actionId);
        }
        return p;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}", tmp, e);
        }
    }

    private static Path metaPathFor(Path p) {
        return p.resolveSibling(p.getFileName().toString() + ".meta");
    }

    private String readOutputId(Path p) {
        Path meta = metaPathFor(p);
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(meta)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Unreadable metadata sidecar {}", meta, e);
            return null;
        }
        return props.getProperty(META_PREFIX + OUTPUT_ID_METADATA_KEY);
    }
}
