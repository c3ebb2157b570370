package com.ordergw.protocol;

/**
 * Fixed-point price convention: price * PRICE_SCALE stored as a long.
 */
public final class Prices {

    public static final long PRICE_SCALE = 1_000_000L;

    private Prices() {}

    public static long toScaled(double price) {
        return Math.round(price * PRICE_SCALE);
    }

    public static double toDecimal(long scaledPrice) {
        return scaledPrice / (double) PRICE_SCALE;
    }
}
