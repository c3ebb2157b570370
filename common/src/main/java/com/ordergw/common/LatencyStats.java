package com.ordergw.common;

import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Thread-safe latency tracking using an HdrHistogram Recorder.
 * Record nanos from any thread; report percentiles periodically from one thread.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Recorder recorder;
    private final String name;
    private Histogram interval;

    public LatencyStats(String name) {
        this.name = name;
        // max 10 seconds, 3 sig figs
        this.recorder = new Recorder(10_000_000_000L, 3);
    }

    public void record(long latencyNanos) {
        recorder.recordValue(Math.min(Math.max(latencyNanos, 0), 10_000_000_000L));
    }

    /**
     * Swaps the interval histogram and logs it.
     * @return number of samples in the reported interval
     */
    public synchronized long logAndReset() {
        interval = interval == null ? recorder.getIntervalHistogram() : recorder.getIntervalHistogram(interval);
        long total = interval.getTotalCount();
        if (total == 0) return 0;
        log.info("[metrics] {} count={} p50={}ms p99={}ms max={}ms",
                name, total,
                millis(interval.getValueAtPercentile(50)),
                millis(interval.getValueAtPercentile(99)),
                millis(interval.getMaxValue()));
        return total;
    }

    static String millis(long nanos) {
        return String.format(Locale.ROOT, "%.2f", nanos / 1_000_000.0);
    }
}
