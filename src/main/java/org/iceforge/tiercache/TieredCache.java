package org.iceforge.tiercache;

import org.iceforge.tiercache.cache.CacheMetrics;
import org.iceforge.tiercache.local.ContentStoreException;
import org.iceforge.tiercache.local.DiskContentStore;
import org.iceforge.tiercache.local.LocalEntry;
import org.iceforge.tiercache.remote.RemoteAccessException;
import org.iceforge.tiercache.remote.RemoteMirror;
import org.iceforge.tiercache.remote.RemoteObject;
import org.iceforge.tiercache.replication.ReplicationPipeline;
import org.iceforge.tiercache.replication.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Disk tier in front of a remote mirror.
 * <ul>
 *   <li>{@link #put}: synchronous disk write, then queued for asynchronous remote upload (write-behind).</li>
 *   <li>{@link #get}: disk first; on miss, remote, and a remote hit is copied to disk before returning (read-through).</li>
 * </ul>
 * {@link #start} must succeed before anything else is called. It probes the remote tier
 * with a put and a get of a reserved key and refuses to start if either fails.
 * <p>
 * Callers are not serialized. A local entry whose replication was dropped never heals
 * through {@link #get}, since the local hit short-circuits the remote tier.
 */
public class TieredCache {
    private static final Logger logger = LoggerFactory.getLogger(TieredCache.class);

    static final String PROBE_ACTION_ID = "_probe";

    private final DiskContentStore disk;
    private final RemoteMirror remote;
    private final ReplicationPipeline pipeline;
    private volatile boolean started;

    public TieredCache(DiskContentStore disk, RemoteMirror remote, int queueLength, int workers) {
        this(disk, remote, new ReplicationPipeline(remote, queueLength, workers));
    }

    TieredCache(DiskContentStore disk, RemoteMirror remote, ReplicationPipeline pipeline) {
        this.disk = Objects.requireNonNull(disk, "disk");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    /**
     * Starts the disk tier, probes the remote tier, then starts the replication workers.
     *
     * @throws CacheStartupException if the disk tier cannot start or the probe fails
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Tiered cache already started");
        }
        try {
            disk.start();
        } catch (ContentStoreException e) {
            throw new CacheStartupException("Local cache start failed", e);
        }

        try {
            probeRemote();
        } catch (CacheStartupException e) {
            disk.close();
            throw e;
        }

        pipeline.start();
        started = true;
        logger.info("Tiered cache started: dir={} remotePrefix={}", disk.directory(), remote.prefix());
    }

    /**
     * @return the hit, or empty on a miss in both tiers
     * @throws RemoteAccessException if the disk tier missed and the remote read failed
     * @throws ContentStoreException if a remote hit could not be written to disk
     */
    public Optional<CacheHit> get(String actionId) {
        ensureStarted("get");
        logger.debug("get actionId={}", actionId);

        Optional<LocalEntry> local;
        try {
            local = disk.get(actionId);
        } catch (ContentStoreException e) {
            logger.warn("Disk lookup failed for actionId={}, trying remote: {}", actionId, e.getMessage());
            local = Optional.empty();
        }
        if (local.isPresent()) {
            return Optional.of(new CacheHit(local.get().outputId(), local.get().blobPath()));
        }

        Optional<RemoteObject> found = remote.get(actionId);
        if (found.isEmpty()) {
            return Optional.empty();
        }

        RemoteObject obj = found.get();
        try {
            if (!DiskContentStore.isHex(obj.outputId())) {
                remote.counters().recordRejectedHit();
                throw new RemoteAccessException("Remote object for actionId=" + actionId
                        + " has a non-hex output id: " + obj.outputId());
            }
            Path diskPath = disk.put(actionId, obj.outputId(), obj.size(), obj.body());
            return Optional.of(new CacheHit(obj.outputId(), diskPath));
        } finally {
            closeBody(obj, actionId);
        }
    }

    /**
     * Writes to disk, queues the remote upload and returns the disk path. Blocks while
     * the replication queue is full; never waits for the upload itself.
     *
     * @throws ContentStoreException if the disk write fails
     */
    public Path put(String actionId, String outputId, long size, InputStream body) {
        ensureStarted("put");
        logger.debug("put actionId={} outputId={} size={}", actionId, outputId, size);

        InputStream in = size == 0 ? InputStream.nullInputStream() : body;
        Path diskPath = disk.put(actionId, outputId, size, in);
        pipeline.submit(new WorkItem(actionId, outputId, size, diskPath));
        return diskPath;
    }

    /**
     * Closes the disk tier, then waits until every queued upload has been attempted.
     */
    public synchronized void close() {
        ensureStarted("close");
        started = false;
        logger.debug("close");
        try {
            disk.close();
        } finally {
            pipeline.close();
        }
    }

    /**
     * Stops replication workers without draining. Queued uploads are abandoned; a
     * concurrent or later {@link #close} returns once the workers have stopped.
     */
    public void cancel() {
        pipeline.cancel();
    }

    public boolean isStarted() {
        return started;
    }

    public CacheMetrics diskMetrics() {
        return disk.counters();
    }

    public CacheMetrics remoteMetrics() {
        return remote.counters();
    }

    public ReplicationPipeline.Stats replicationStats() {
        return pipeline.stats();
    }

    private void probeRemote() {
        String probeValue = remote.prefix() + "/" + PROBE_ACTION_ID;
        byte[] bytes = probeValue.getBytes(StandardCharsets.UTF_8);
        logger.debug("Probing remote tier with key {}", probeValue);

        try {
            remote.put(PROBE_ACTION_ID, probeValue, bytes.length, new ByteArrayInputStream(bytes));
        } catch (RemoteAccessException e) {
            throw new CacheStartupException("Remote cache probe put failed", e);
        }

        Optional<RemoteObject> found;
        try {
            found = remote.get(PROBE_ACTION_ID);
        } catch (RemoteAccessException e) {
            throw new CacheStartupException("Remote cache probe get failed", e);
        }
        if (found.isEmpty()) {
            throw new CacheStartupException("Remote cache probe get found nothing at " + probeValue);
        }
        RemoteObject obj = found.get();
        closeBody(obj, PROBE_ACTION_ID);
        if (obj.size() != bytes.length) {
            throw new CacheStartupException("Remote cache probe get size mismatch: expected "
                    + bytes.length + ", got " + obj.size());
        }
        logger.debug("Probe success");
    }

    private void ensureStarted(String op) {
        if (!started) {
            throw new IllegalStateException("Tiered cache not started, cannot " + op);
        }
    }

    private static void closeBody(RemoteObject obj, String actionId) {
        try {
            obj.close();
        } catch (IOException e) {
            logger.debug("Failed to close remote body for actionId={}", actionId, e);
        }
    }
}
