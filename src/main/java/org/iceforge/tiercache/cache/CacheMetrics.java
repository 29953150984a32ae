package org.iceforge.tiercache.cache;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Read-only view of one tier's counters, with the two renderings used for reporting.
 */
public interface CacheMetrics {

    List<String> CSV_COLUMNS = List.of(
            "gets", "hits", "misses", "puts", "getErrors", "putErrors",
            "totalGetBytes", "totalGetDur", "totalPutBytes", "totalPutDur");

    long gets();
    long hits();
    long misses();
    long getErrors();
    long puts();
    long putErrors();
    long totalGetBytes();
    Duration totalGetDuration();
    long totalPutBytes();
    Duration totalPutDuration();

    /**
     * Two lines, gets then puts, e.g.
     * <pre>
     * 12 gets: 9 hits, 3 misses, 0 errors, 1.4s total dur; total 3.20 MB; avg 2.29 MB/s
     * 4 puts: 0 errors, 0.3s total dur; total 0.80 MB; avg 2.67 MB/s
     * </pre>
     */
    default String summary() {
        StringBuilder getsLine = new StringBuilder(String.format(Locale.ROOT,
                "%d gets: %d hits, %d misses, %d errors, %s total dur",
                gets(), hits(), misses(), getErrors(), roundedSeconds(totalGetDuration())));
        appendThroughput(getsLine, totalGetBytes(), totalGetDuration());

        StringBuilder putsLine = new StringBuilder(String.format(Locale.ROOT,
                "%d puts: %d errors, %s total dur",
                puts(), putErrors(), roundedSeconds(totalPutDuration())));
        appendThroughput(putsLine, totalPutBytes(), totalPutDuration());

        return getsLine + "\n" + putsLine;
    }

    /**
     * Writes one CSV row, optionally preceded by the header row, in the fixed
     * {@link #CSV_COLUMNS} order. Durations are rendered as {@code HH:mm:ss.SSS}.
     */
    default void writeCsv(Appendable out, boolean header) throws IOException {
        if (header) {
            out.append(String.join(",", CSV_COLUMNS)).append('\n');
        }
        out.append(String.join(",", List.of(
                Long.toString(gets()),
                Long.toString(hits()),
                Long.toString(misses()),
                Long.toString(puts()),
                Long.toString(getErrors()),
                Long.toString(putErrors()),
                Long.toString(totalGetBytes()),
                csvDuration(totalGetDuration()),
                Long.toString(totalPutBytes()),
                csvDuration(totalPutDuration())
        ))).append('\n');
    }

    static String csvDuration(Duration d) {
        // wraps after 24h, like a wall-clock rendering
        return DateTimeFormatter.ofPattern("HH:mm:ss.SSS").format(LocalTime.MIDNIGHT.plus(d));
    }

    private static String roundedSeconds(Duration d) {
        double tenths = Math.round(d.toMillis() / 100.0) / 10.0;
        return String.format(Locale.ROOT, "%.1fs", tenths);
    }

    private static void appendThroughput(StringBuilder line, long bytes, Duration elapsed) {
        if (bytes <= 0) {
            return;
        }
        double mb = bytes / 1_000_000.0;
        line.append(String.format(Locale.ROOT, "; total %.2f MB", mb));
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        if (seconds > 0) {
            line.append(String.format(Locale.ROOT, "; avg %.2f MB/s", mb / seconds));
        }
    }
}
