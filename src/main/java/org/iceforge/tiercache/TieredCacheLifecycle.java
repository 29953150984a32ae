package org.iceforge.tiercache;

import org.iceforge.tiercache.config.TierCacheProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Starts the {@link TieredCache} with the application context and closes it on shutdown.
 * A failed remote probe fails the context start. After close, disk and remote summaries
 * are logged and the remote counters are written to {@code tiercache.metrics.csv} if set.
 */
@Component
public class TieredCacheLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TieredCacheLifecycle.class);

    private final TieredCache cache;
    private final TierCacheProperties props;
    private volatile boolean running;
    private volatile long startedAtNanos;

    public TieredCacheLifecycle(TieredCache cache, TierCacheProperties props) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public void start() {
        startedAtNanos = System.nanoTime();
        cache.start();
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        if (!cache.isStarted()) {
            return;
        }
        cache.close();
        report();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    void report() {
        if (props.getMetrics().isLogSummary()) {
            log.info("disk stats:\n{}", cache.diskMetrics().summary());
            log.info("remote stats:\n{}", cache.remoteMetrics().summary());
            log.info("replication: {}", cache.replicationStats());
            log.info("total time: {}s", Duration.ofNanos(System.nanoTime() - startedAtNanos).toSeconds());
        }

        String csv = props.getMetrics().getCsv();
        if (csv == null || csv.isBlank()) {
            return;
        }
        Path out = Path.of(csv);
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            cache.remoteMetrics().writeCsv(w, true);
        } catch (IOException e) {
            log.error("Failed to write metrics CSV {}", out, e);
        }
    }
}
