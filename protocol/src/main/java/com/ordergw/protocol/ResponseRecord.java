package com.ordergw.protocol;

/**
 * One exchange response for one sent order.
 *
 * @param orderId         gateway order id
 * @param verdict         exchange verdict
 * @param latencyNanos    response time minus send time
 * @param timestampMillis epoch millis at which the response was recorded
 */
public record ResponseRecord(long orderId, Verdict verdict, long latencyNanos, long timestampMillis) {

    public double latencyMillis() {
        return latencyNanos / 1_000_000.0;
    }
}
