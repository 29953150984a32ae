package org.iceforge.tiercache.cache;

import java.time.Duration;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe aggregate counters for one cache tier.
 * <p>
 * Sums and counts only; no percentiles or histograms. Each tier owns its own
 * instance, so disk and remote numbers never mix.
 */
public class CacheCounters implements CacheMetrics {
    private final LongAdder gets = new LongAdder();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder getErrors = new LongAdder();
    private final LongAdder puts = new LongAdder();
    private final LongAdder putErrors = new LongAdder();
    private final LongAdder totalGetBytes = new LongAdder();
    private final LongAdder totalGetNanos = new LongAdder();
    private final LongAdder totalPutBytes = new LongAdder();
    private final LongAdder totalPutNanos = new LongAdder();

    public void recordGet() { gets.increment(); }
    public void recordHit() { hits.increment(); }
    public void recordMiss() { misses.increment(); }
    public void recordGetError() { getErrors.increment(); }
    public void recordPut() { puts.increment(); }
    public void recordPutError() { putErrors.increment(); }

    /**
     * Turns an already recorded hit into a get error, for a read the tier served but
     * whose content the caller then found unusable.
     */
    public void recordRejectedHit() {
        hits.decrement();
        getErrors.increment();
    }

    public void recordGetTransfer(long bytes, Duration elapsed) {
        totalGetBytes.add(bytes);
        totalGetNanos.add(elapsed.toNanos());
    }

    public void recordPutTransfer(long bytes, Duration elapsed) {
        totalPutBytes.add(bytes);
        totalPutNanos.add(elapsed.toNanos());
    }

    @Override public long gets() { return gets.sum(); }
    @Override public long hits() { return hits.sum(); }
    @Override public long misses() { return misses.sum(); }
    @Override public long getErrors() { return getErrors.sum(); }
    @Override public long puts() { return puts.sum(); }
    @Override public long putErrors() { return putErrors.sum(); }
    @Override public long totalGetBytes() { return totalGetBytes.sum(); }
    @Override public Duration totalGetDuration() { return Duration.ofNanos(totalGetNanos.sum()); }
    @Override public long totalPutBytes() { return totalPutBytes.sum(); }
    @Override public Duration totalPutDuration() { return Duration.ofNanos(totalPutNanos.sum()); }
}
