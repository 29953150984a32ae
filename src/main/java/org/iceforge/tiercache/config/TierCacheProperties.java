package org.iceforge.tiercache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Configuration for both cache tiers and the replication pipeline.
 * <p>
 * Defaults match a single-worker, hand-off queue setup writing to S3.
 */
@ConfigurationProperties(prefix = "tiercache")
public class TierCacheProperties {

    private Local local = new Local();
    private Remote remote = new Remote();
    private Replication replication = new Replication();
    private Metrics metrics = new Metrics();

    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }

    public Remote getRemote() { return remote; }
    public void setRemote(Remote remote) { this.remote = remote; }

    public Replication getReplication() { return replication; }
    public void setReplication(Replication replication) { this.replication = replication; }

    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }

    public static class Local {
        /** Directory of the disk tier. */
        private String dir = Path.of(System.getProperty("user.home"), ".cache", "tiercache").toString();

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
    }

    public static class Remote {
        /** "s3" or "local". */
        private String store = "s3";

        /** Bucket holding remote objects. Required for the s3 store. */
        private String bucket;

        /** Key prefix inside the bucket. */
        private String prefix = "go-cache";

        /** Root directory for the local store. */
        private String localBaseDir = Path.of(System.getProperty("java.io.tmpdir"), "tiercache-remote").toString();

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public String getLocalBaseDir() { return localBaseDir; }
        public void setLocalBaseDir(String localBaseDir) { this.localBaseDir = localBaseDir; }
    }

    public static class Replication {
        /** Queue capacity; 0 means every put waits for a worker to take its item. */
        private int queueLength = 0;

        /** Number of upload workers, at least 1. */
        private int workers = 1;

        public int getQueueLength() { return queueLength; }
        public void setQueueLength(int queueLength) { this.queueLength = queueLength; }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
    }

    public static class Metrics {
        /** File to write remote-tier counters to as CSV on shutdown; blank disables it. */
        private String csv = "";

        /** Log disk and remote summaries on shutdown. */
        private boolean logSummary = true;

        public String getCsv() { return csv; }
        public void setCsv(String csv) { this.csv = csv; }

        public boolean isLogSummary() { return logSummary; }
        public void setLogSummary(boolean logSummary) { this.logSummary = logSummary; }
    }
}
