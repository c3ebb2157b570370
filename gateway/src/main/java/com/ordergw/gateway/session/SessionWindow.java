package com.ordergw.gateway.session;

import com.ordergw.protocol.SessionPhase;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Immutable open/close time-of-day pair for a single trading session.
 * The window does not wrap past midnight: close must be after open.
 */
public final class SessionWindow {

    private final LocalTime openTime;
    private final LocalTime closeTime;
    private final ZoneId zone;

    public SessionWindow(LocalTime openTime, LocalTime closeTime, ZoneId zone) {
        if (!closeTime.isAfter(openTime)) {
            throw new IllegalArgumentException("Session close " + closeTime + " must be after open " + openTime);
        }
        this.openTime  = openTime;
        this.closeTime = closeTime;
        this.zone      = zone;
    }

    /** Phase the clock says we should be in at the given time-of-day: [open, close) is OPEN. */
    public SessionPhase phaseAt(LocalTime now) {
        if (now.isBefore(openTime)) return SessionPhase.BEFORE_OPEN;
        if (now.isBefore(closeTime)) return SessionPhase.OPEN;
        return SessionPhase.CLOSED;
    }

    public LocalTime openTime()  { return openTime; }
    public LocalTime closeTime() { return closeTime; }
    public ZoneId zone()         { return zone; }

    @Override
    public String toString() {
        return openTime + "-" + closeTime + " " + zone;
    }
}
