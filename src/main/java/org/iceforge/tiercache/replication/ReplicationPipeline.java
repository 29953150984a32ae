package org.iceforge.tiercache.replication;

import org.iceforge.tiercache.remote.RemoteAccessException;
import org.iceforge.tiercache.remote.RemoteMirror;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Write-behind bridge from the disk tier to a {@link RemoteMirror}.
 * <p>
 * Producers {@link #submit} items into one bounded queue; a fixed pool of workers takes
 * them and uploads the blob from disk. Each item goes to exactly one worker and is
 * discarded after one attempt, whatever the outcome. Workers race for items, so remote
 * completion order is unrelated to submission order.
 * <p>
 * Backpressure: {@link #submit} blocks while the queue is full. A queue length of 0 is a
 * hand-off: the producer waits until a worker takes the item.
 * <p>
 * Shutdown: {@link #close} seals the queue and waits until every queued and in-flight
 * item has been processed. {@link #cancel} stops the workers mid-loop and abandons
 * whatever is still queued; it also cuts short a {@code close} that is waiting.
 */
public class ReplicationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ReplicationPipeline.class);

    private static final WorkItem END_OF_QUEUE = new WorkItem("", "", 0, null);
    private static final long OFFER_WAIT_MS = 100;

    private final RemoteMirror remote;
    private final int workers;
    private final BlockingQueue<WorkItem> queue;
    // producers share the read side; close takes the write side before sealing the queue
    private final ReadWriteLock admission = new ReentrantReadWriteLock();

    private final LongAdder enqueued = new LongAdder();
    private final LongAdder replicated = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder abandoned = new LongAdder();

    private volatile ExecutorService pool;
    private volatile boolean closed;
    private volatile boolean cancelled;

    public ReplicationPipeline(RemoteMirror remote, int queueLength, int workers) {
        this.remote = Objects.requireNonNull(remote, "remote");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, was " + workers);
        }
        if (queueLength < 0) {
            throw new IllegalArgumentException("queueLength must be >= 0, was " + queueLength);
        }
        this.workers = workers;
        this.queue = queueLength == 0 ? new SynchronousQueue<>() : new ArrayBlockingQueue<>(queueLength);
    }

    public synchronized void start() {
        if (pool != null) {
            throw new IllegalStateException("Replication pipeline already started");
        }
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService p = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "tiercache-replicator-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workers; i++) {
            int workerId = i;
            p.execute(() -> workerLoop(workerId));
        }
        pool = p;
        logger.info("Started replication pipeline: workers={} queue={}", workers, describeQueue());
    }

    /**
     * Hands {@code item} to the workers, blocking while the queue is full. Returns
     * without enqueuing if the pipeline is cancelled meanwhile, or if the calling thread
     * is interrupted; replication is best-effort and the item is counted as abandoned.
     *
     * @throws IllegalStateException if the pipeline is not started or already closed
     */
    public void submit(WorkItem item) {
        Objects.requireNonNull(item, "item");
        admission.readLock().lock();
        try {
            if (pool == null || closed) {
                throw new IllegalStateException("Replication pipeline is not accepting work");
            }
            if (!offerUntilCancelled(item)) {
                abandoned.increment();
                logger.warn("Replication cancelled, not queuing actionId={} outputId={}",
                        item.actionId(), item.outputId());
                return;
            }
            enqueued.increment();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandoned.increment();
            logger.warn("Interrupted while queuing actionId={} outputId={}, item dropped",
                    item.actionId(), item.outputId());
        } finally {
            admission.readLock().unlock();
        }
    }

    /**
     * Seals the queue and blocks until all queued and in-flight items are processed,
     * or until {@link #cancel} fires. Calling it again is a no-op.
     */
    public void close() {
        admission.writeLock().lock();
        try {
            if (pool == null) {
                throw new IllegalStateException("Replication pipeline not started");
            }
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            admission.writeLock().unlock();
        }

        logger.debug("Waiting for replication workers to finish: queued={}", queue.size());
        try {
            // one marker per worker, behind everything already queued
            for (int i = 0; i < workers; i++) {
                if (!offerUntilCancelled(END_OF_QUEUE)) {
                    break;
                }
            }
            ExecutorService p = pool;
            p.shutdown();
            while (!p.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.debug("Still draining replication queue: queued={}", queue.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while draining replication queue, cancelling workers");
            cancel();
        }
        if (cancelled) {
            abandonQueued();
        }
        logger.info("Replication pipeline closed: {}", stats());
    }

    /**
     * External cancellation: interrupts the workers, which stop without finishing the
     * queue. Items left in the queue are abandoned.
     */
    public void cancel() {
        cancelled = true;
        ExecutorService p = pool;
        if (p != null) {
            p.shutdownNow();
        }
        logger.info("Replication pipeline cancelled: queued={}", queue.size());
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Stats stats() {
        return new Stats(enqueued.sum(), replicated.sum(), failed.sum(), abandoned.sum());
    }

    private void workerLoop(int workerId) {
        while (!cancelled) {
            WorkItem item;
            try {
                item = queue.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                logger.debug("Replication worker {} stopped by cancellation", workerId);
                return;
            }
            if (item == END_OF_QUEUE) {
                logger.debug("Replication worker {} done, queue closed", workerId);
                return;
            }
            replicate(item);
        }
        logger.debug("Replication worker {} stopped by cancellation", workerId);
    }

    private void replicate(WorkItem item) {
        logger.debug("remote put actionId={} outputId={} size={} diskPath={}",
                item.actionId(), item.outputId(), item.size(), item.diskPath());
        InputStream body;
        if (item.size() == 0) {
            body = InputStream.nullInputStream();
        } else {
            try {
                body = Files.newInputStream(item.diskPath());
            } catch (IOException e) {
                failed.increment();
                logger.error("Cannot open {} for remote put, dropping actionId={}", item.diskPath(), item.actionId(), e);
                return;
            }
        }

        try (InputStream in = body) {
            remote.put(item.actionId(), item.outputId(), item.size(), in);
            replicated.increment();
        } catch (RemoteAccessException e) {
            failed.increment();
            logger.warn("Remote put failed, dropping actionId={} outputId={}: {}",
                    item.actionId(), item.outputId(), e.getMessage());
            logger.debug("Remote put failure detail", e);
        } catch (IOException e) {
            logger.debug("Failed to close {}", item.diskPath(), e);
        } catch (RuntimeException e) {
            failed.increment();
            logger.error("Unexpected failure replicating actionId={} outputId={}",
                    item.actionId(), item.outputId(), e);
        }
    }

    private boolean offerUntilCancelled(WorkItem item) throws InterruptedException {
        while (!cancelled) {
            if (queue.offer(item, OFFER_WAIT_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private void abandonQueued() {
        int n = 0;
        WorkItem item;
        while ((item = queue.poll()) != null) {
            if (item != END_OF_QUEUE) {
                n++;
            }
        }
        if (n > 0) {
            abandoned.add(n);
            logger.warn("Abandoned {} queued replication items after cancellation", n);
        }
    }

    private String describeQueue() {
        return queue instanceof SynchronousQueue ? "hand-off" : "bounded(" + queue.remainingCapacity() + ")";
    }

    public record Stats(long enqueued, long replicated, long failed, long abandoned) {}
}
