package com.ordergw.gateway.session;

import java.time.LocalTime;

/**
 * Receives session transition events. Called on the session poller thread.
 */
public interface SessionListener {

    void onLogon(String username, LocalTime at);

    void onLogout(String username, LocalTime at);
}
