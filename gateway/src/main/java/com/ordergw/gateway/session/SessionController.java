package com.ordergw.gateway.session;

import com.ordergw.protocol.SessionPhase;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tracks the wall clock against a {@link SessionWindow} and drives the session phase.
 *
 * One session per run: BEFORE_OPEN -> OPEN (logon) -> CLOSED (logout). Once CLOSED
 * the controller never reopens. If the first poll already falls after the close time
 * the controller goes straight to CLOSED without logon or logout.
 *
 * Thread safety: transitions happen under this object's monitor; the phase is
 * published through a volatile field so admission checks never take the lock.
 * Transition instants are only as precise as the poll interval.
 */
public final class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionWindow window;
    private final String username;
    private final EpochClock clock;
    private final Duration pollInterval;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    // Released once the phase leaves BEFORE_OPEN, whichever way it goes
    private final CountDownLatch settled = new CountDownLatch(1);

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile SessionPhase phase = SessionPhase.BEFORE_OPEN;

    public SessionController(SessionWindow window, String username, EpochClock clock, Duration pollInterval) {
        this.window       = window;
        this.username     = username;
        this.clock        = clock;
        this.pollInterval = pollInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-clock");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public SessionPhase currentPhase() {
        return phase;
    }

    public boolean isOpen() {
        return phase == SessionPhase.OPEN;
    }

    /**
     * Polls once synchronously so the phase is correct on return, then keeps
     * polling on the session-clock thread.
     */
    public synchronized void start() {
        if (pollTask != null) {
            log.warn("Session controller already running");
            return;
        }
        log.info("Session controller starting: window={} poll={}ms", window, pollInterval.toMillis());
        poll();
        pollTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                poll();
            } catch (Exception e) {
                log.error("Session poll failed", e);
            }
        }, pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Session controller stopped in phase {}", phase);
    }

    /**
     * One transition check against the clock.
     * @return the phase after the check
     */
    public synchronized SessionPhase poll() {
        LocalTime now = LocalTime.ofInstant(Instant.ofEpochMilli(clock.time()), window.zone());
        SessionPhase target = window.phaseAt(now);

        switch (phase) {
            case BEFORE_OPEN -> {
                if (target == SessionPhase.OPEN) {
                    phase = SessionPhase.OPEN;
                    settled.countDown();
                    fireLogon(now);
                } else if (target == SessionPhase.CLOSED) {
                    phase = SessionPhase.CLOSED;
                    settled.countDown();
                    log.warn("Session window {} already over at {}; gateway stays closed", window, now);
                }
            }
            case OPEN -> {
                if (target == SessionPhase.CLOSED) {
                    phase = SessionPhase.CLOSED;
                    fireLogout(now);
                }
            }
            case CLOSED -> { }
        }
        return phase;
    }

    /**
     * Blocks until the session opens, the window passes without opening, or the
     * timeout elapses.
     * @return true if the session is OPEN on return
     */
    public boolean awaitOpen(Duration timeout) throws InterruptedException {
        settled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return phase == SessionPhase.OPEN;
    }

    private void fireLogon(LocalTime at) {
        log.info("[LOGON] {} at {}", username, at);
        for (SessionListener l : listeners) {
            try {
                l.onLogon(username, at);
            } catch (Exception e) {
                log.error("Session listener failed on logon", e);
            }
        }
    }

    private void fireLogout(LocalTime at) {
        log.info("[LOGOUT] {} at {}", username, at);
        for (SessionListener l : listeners) {
            try {
                l.onLogout(username, at);
            } catch (Exception e) {
                log.error("Session listener failed on logout", e);
            }
        }
    }
}
