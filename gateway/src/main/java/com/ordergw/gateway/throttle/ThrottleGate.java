package com.ordergw.gateway.throttle;

import org.agrona.concurrent.EpochClock;

/**
 * Per-interval send cap.
 *
 * Intervals are aligned to the clock: interval index = epochMillis / intervalMillis.
 * The counter resets the first time any call observes a new index, so it is reset
 * exactly once per elapsed interval and never exceeds the cap in between.
 * All state is guarded by this object's monitor; no call blocks.
 */
public final class ThrottleGate {

    public static final long ONE_SECOND_MILLIS = 1_000L;

    private final int cap;
    private final long intervalMillis;
    private final EpochClock clock;

    private long intervalIndex;
    private int  sentInInterval;

    public ThrottleGate(int cap, EpochClock clock) {
        this(cap, ONE_SECOND_MILLIS, clock);
    }

    public ThrottleGate(int cap, long intervalMillis, EpochClock clock) {
        if (cap <= 0) throw new IllegalArgumentException("Throttle cap must be positive: " + cap);
        if (intervalMillis <= 0) throw new IllegalArgumentException("Throttle interval must be positive: " + intervalMillis);
        this.cap            = cap;
        this.intervalMillis = intervalMillis;
        this.clock          = clock;
        this.intervalIndex  = clock.time() / intervalMillis;
    }

    /**
     * Takes one send slot in the current interval.
     * @return true if a slot was available; false leaves the state untouched
     */
    public synchronized boolean tryAdmit() {
        roll();
        if (sentInInterval >= cap) return false;
        sentInInterval++;
        return true;
    }

    public synchronized int remaining() {
        roll();
        return cap - sentInInterval;
    }

    public synchronized int sentInCurrentInterval() {
        roll();
        return sentInInterval;
    }

    public long millisUntilNextInterval() {
        return intervalMillis - (clock.time() % intervalMillis);
    }

    public int cap() {
        return cap;
    }

    private void roll() {
        long index = clock.time() / intervalMillis;
        if (index != intervalIndex) {
            intervalIndex  = index;
            sentInInterval = 0;
        }
    }
}
