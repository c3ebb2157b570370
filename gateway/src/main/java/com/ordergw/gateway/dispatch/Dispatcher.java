package com.ordergw.gateway.dispatch;

import com.ordergw.common.LatencyStats;
import com.ordergw.gateway.order.Order;
import com.ordergw.gateway.queue.PendingQueue;
import com.ordergw.gateway.throttle.ThrottleGate;
import com.ordergw.protocol.OrderStatus;
import com.ordergw.protocol.Prices;
import com.ordergw.protocol.RejectReason;
import com.ordergw.protocol.ResponseRecord;
import com.ordergw.protocol.Verdict;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.NanoClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Moves admitted orders to the {@link Sender}, always through the {@link ThrottleGate}.
 *
 * Two entry points:
 *   submit(order) - immediate path on the caller thread; sends if the gate admits,
 *                   otherwise parks the order in the {@link PendingQueue}
 *   tick()        - run every tick on the dispatcher thread; drains the queue head
 *                   while the gate keeps admitting
 *
 * Every sent order gets exactly one {@link ResponseRecord}: the sender's verdict,
 * or REJECT if the sender failed.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ThrottleGate gate;
    private final PendingQueue queue;
    private final Sender sender;
    private final ResponseRecorder recorder;
    private final EpochClock epochClock;
    private final NanoClock nanoClock;
    private final LatencyStats latencyStats = new LatencyStats("exchange-rtt");

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private ScheduledFuture<?> metricsTask;

    public Dispatcher(ThrottleGate gate, PendingQueue queue, Sender sender, ResponseRecorder recorder,
                      EpochClock epochClock, NanoClock nanoClock) {
        this.gate       = gate;
        this.queue      = queue;
        this.sender     = sender;
        this.recorder   = recorder;
        this.epochClock = epochClock;
        this.nanoClock  = nanoClock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dispatcher");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start(Duration tickInterval, Duration metricsInterval) {
        if (tickTask != null) {
            log.warn("Dispatcher already running");
            return;
        }
        tickTask = scheduler.scheduleAtFixedRate(this::safeTick,
                tickInterval.toMillis(), tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        metricsTask = scheduler.scheduleAtFixedRate(latencyStats::logAndReset,
                metricsInterval.toMillis(), metricsInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Dispatcher started: cap={}/s tick={}ms", gate.cap(), tickInterval.toMillis());
    }

    public synchronized void stop() {
        if (tickTask != null) tickTask.cancel(false);
        if (metricsTask != null) metricsTask.cancel(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        latencyStats.logAndReset();
        int left = queue.size();
        if (left > 0) {
            log.warn("Dispatcher stopped with {} orders still queued; they are dropped", left);
        } else {
            log.info("Dispatcher stopped");
        }
    }

    /**
     * Immediate path for a validated order.
     * @return SENT if the gate had capacity, QUEUED if not, REJECTED if the id is
     *         already queued
     */
    public OrderStatus submit(Order order) {
        switch (queue.admitOrEnqueue(order, gate)) {
            case ADMITTED -> {
                send(order);
                return OrderStatus.SENT;
            }
            case QUEUED -> {
                log.info("Order {} queued due to throttle (queue depth {})", order.orderId, queue.size());
                return OrderStatus.QUEUED;
            }
            default -> {
                order.reject(RejectReason.DUPLICATE_ORDER_ID);
                log.warn("Order {} rejected: {}", order.orderId, RejectReason.DUPLICATE_ORDER_ID.text);
                return OrderStatus.REJECTED;
            }
        }
    }

    /**
     * Drains the queue through the gate and sends what was admitted.
     * @return number of orders sent
     */
    public int tick() {
        List<Order> drained = queue.drainAdmissible(gate);
        for (Order order : drained) {
            send(order);
        }
        return drained.size();
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            // an exception escaping here would cancel the periodic task
            log.error("Dispatcher tick failed", e);
        }
    }

    private void send(Order order) {
        order.status = OrderStatus.SENT;
        long sentAt = nanoClock.nanoTime();
        CompletableFuture<Verdict> response;
        try {
            response = sender.send(order);
            if (response == null) {
                response = CompletableFuture.failedFuture(new IllegalStateException("Sender returned no response future"));
            }
        } catch (RuntimeException e) {
            response = CompletableFuture.failedFuture(e);
        }
        log.info("Order {} sent to exchange: price={} qty={}", order.orderId, Prices.toDecimal(order.price), order.qty);
        response.whenComplete((verdict, error) -> onResponse(order, sentAt, verdict, error));
    }

    private void onResponse(Order order, long sentAt, Verdict verdict, Throwable error) {
        long latencyNanos = nanoClock.nanoTime() - sentAt;
        Verdict recorded = verdict;
        if (error != null) {
            log.error("Send failed for order {}, recording REJECT", order.orderId, error);
            recorded = Verdict.REJECT;
        } else if (recorded == null) {
            log.warn("Empty verdict for order {}, recording REJECT", order.orderId);
            recorded = Verdict.REJECT;
        }

        latencyStats.record(latencyNanos);
        ResponseRecord record = new ResponseRecord(order.orderId, recorded, latencyNanos, epochClock.time());
        try {
            recorder.record(record);
        } catch (RuntimeException e) {
            log.error("Failed to record response for order {}", order.orderId, e);
            return;
        }
        log.info("Response for {}: {}, latency {} ms", order.orderId, recorded,
                String.format(Locale.ROOT, "%.2f", record.latencyMillis()));
    }
}
