package com.ordergw.protocol;

public enum Side {
    BUY('B'), SELL('S');

    public final char code;
    Side(char code) { this.code = code; }

    public static Side fromCode(char code) {
        return switch (code) {
            case 'B' -> BUY;
            case 'S' -> SELL;
            default -> throw new IllegalArgumentException("Unknown side code: " + code);
        };
    }
}
