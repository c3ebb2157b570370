package com.ordergw.protocol;

/**
 * Trading session phase. Moves forward only:
 *   BEFORE_OPEN -> OPEN -> CLOSED
 * (or BEFORE_OPEN -> CLOSED when the gateway starts after the close time).
 */
public enum SessionPhase {
    BEFORE_OPEN,
    OPEN,
    CLOSED
}
