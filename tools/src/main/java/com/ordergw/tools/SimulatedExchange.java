package com.ordergw.tools;

import com.ordergw.gateway.dispatch.Sender;
import com.ordergw.gateway.order.Order;
import com.ordergw.protocol.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * In-process stand-in for the exchange. Each order is answered after a fixed
 * round-trip delay on the exchange's own thread; the verdict is REJECT when the
 * reject predicate matches, ACCEPT otherwise.
 *
 * Keeps a copy of every order as it was received, so callers can check what
 * actually went out (e.g. the amended price of a modified order).
 */
public final class SimulatedExchange implements Sender, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExchange.class);

    /** Order fields as seen by the exchange at send time. */
    public record Received(long orderId, int symbolId, long price, long qty) {}

    private final Duration roundTrip;
    private final Predicate<Order> rejectWhen;
    private final Queue<Received> received = new ConcurrentLinkedQueue<>();
    private final ScheduledExecutorService responder;

    public SimulatedExchange(Duration roundTrip) {
        this(roundTrip, order -> false);
    }

    public SimulatedExchange(Duration roundTrip, Predicate<Order> rejectWhen) {
        this.roundTrip  = roundTrip;
        this.rejectWhen = rejectWhen;
        this.responder = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "exchange-sim");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Verdict> send(Order order) {
        received.add(new Received(order.orderId, order.symbolId, order.price, order.qty));
        Verdict verdict = rejectWhen.test(order) ? Verdict.REJECT : Verdict.ACCEPT;
        CompletableFuture<Verdict> response = new CompletableFuture<>();
        try {
            responder.schedule(() -> response.complete(verdict), roundTrip.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            response.completeExceptionally(e);
        }
        return response;
    }

    public List<Received> received() {
        return new ArrayList<>(received);
    }

    public int receivedCount() {
        return received.size();
    }

    /** Waits for responses already scheduled, then stops the exchange thread. */
    @Override
    public void close() {
        responder.shutdown();
        try {
            if (!responder.awaitTermination(roundTrip.toMillis() + 1_000, TimeUnit.MILLISECONDS)) {
                log.warn("Exchange simulator did not answer all orders before shutdown");
                responder.shutdownNow();
            }
        } catch (InterruptedException e) {
            responder.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
