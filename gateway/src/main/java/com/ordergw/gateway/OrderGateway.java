package com.ordergw.gateway;

import com.ordergw.common.GatewayConfig;
import com.ordergw.gateway.dispatch.Dispatcher;
import com.ordergw.gateway.dispatch.ResponseRecorder;
import com.ordergw.gateway.dispatch.Sender;
import com.ordergw.gateway.order.Order;
import com.ordergw.gateway.queue.PendingQueue;
import com.ordergw.gateway.session.SessionController;
import com.ordergw.gateway.session.SessionListener;
import com.ordergw.gateway.session.SessionWindow;
import com.ordergw.gateway.throttle.ThrottleGate;
import com.ordergw.protocol.OrderRequest;
import com.ordergw.protocol.OrderStatus;
import com.ordergw.protocol.RejectReason;
import com.ordergw.protocol.RequestType;
import com.ordergw.protocol.SessionPhase;
import com.ordergw.protocol.Side;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;
import org.agrona.concurrent.SystemNanoClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client-facing entry point of the gateway.
 *
 * new order: session check -> validation -> {@link Dispatcher} (send now or queue)
 * modify / cancel: applied to the {@link PendingQueue} only; anything no longer
 * queued is reported as ignored. A modify to a non-positive qty or price is
 * refused and leaves the queued order as it was.
 *
 * No new order reaches the sender without passing the session check here and
 * the throttle gate in the dispatcher.
 */
public final class OrderGateway implements SessionListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrderGateway.class);

    private final SessionController session;
    private final PendingQueue queue;
    private final Dispatcher dispatcher;
    private final EpochClock clock;
    private final Duration tickInterval;
    private final Duration metricsInterval;

    // Gateway-assigned order ids
    private final AtomicLong orderIdGen = new AtomicLong(1);

    public OrderGateway(SessionController session, PendingQueue queue, Dispatcher dispatcher, EpochClock clock,
                        Duration tickInterval, Duration metricsInterval) {
        this.session         = session;
        this.queue           = queue;
        this.dispatcher      = dispatcher;
        this.clock           = clock;
        this.tickInterval    = tickInterval;
        this.metricsInterval = metricsInterval;
        session.addListener(this);
    }

    /**
     * Wires a gateway on the system clocks from validated configuration.
     */
    public static OrderGateway create(GatewayConfig cfg, Sender sender, ResponseRecorder recorder) {
        cfg.validate();
        EpochClock clock = new SystemEpochClock();
        SessionWindow window = new SessionWindow(cfg.openTime, cfg.closeTime, cfg.zone());
        SessionController session = new SessionController(window, cfg.username, clock,
                Duration.ofMillis(cfg.sessionPollMillis));
        ThrottleGate gate = new ThrottleGate(cfg.maxOrdersPerSecond, clock);
        PendingQueue queue = new PendingQueue();
        Dispatcher dispatcher = new Dispatcher(gate, queue, sender, recorder, clock, new SystemNanoClock());
        return new OrderGateway(session, queue, dispatcher, clock,
                Duration.ofMillis(cfg.dispatchTickMillis), Duration.ofSeconds(cfg.metricsIntervalSecs));
    }

    public void start() {
        session.start();
        dispatcher.start(tickInterval, metricsInterval);
    }

    @Override
    public void close() {
        dispatcher.stop();
        session.stop();
    }

    public boolean awaitOpen(Duration timeout) throws InterruptedException {
        return session.awaitOpen(timeout);
    }

    public SessionPhase phase() {
        return session.currentPhase();
    }

    public int queuedCount() {
        return queue.size();
    }

    // ---- Requests ----

    public RequestResult onRequest(OrderRequest request) {
        return switch (request.type()) {
            case NEW    -> {
                Order order = fromRequest(request);
                yield toResult(order, admit(order));
            }
            case MODIFY -> modifyOrder(request.orderId(), request.price(), request.qty());
            case CANCEL -> cancelOrder(request.orderId());
        };
    }

    /** New order with a gateway-assigned id. */
    public Order newOrder(int symbolId, Side side, long price, long qty) {
        Order order = new Order(orderIdGen.getAndIncrement(), symbolId, side, price, qty, clock.time());
        admit(order);
        return order;
    }

    /** New order with the caller's id. */
    public Order newOrder(OrderRequest request) {
        Order order = fromRequest(request);
        admit(order);
        return order;
    }

    public RequestResult modifyOrder(long orderId, long price, long qty) {
        RejectReason invalid = qty <= 0 ? RejectReason.INVALID_QTY
                : price <= 0 ? RejectReason.INVALID_PRICE
                : null;
        if (invalid != null) {
            log.warn("Modify request for {} rejected: {}", orderId, invalid.text);
            return new RequestResult(RequestType.MODIFY, orderId, false, null,
                    "Modify request for " + orderId + " rejected: " + invalid.text + ".");
        }
        if (!queue.modify(orderId, price, qty)) {
            RequestResult ignored = RequestResult.ignored(RequestType.MODIFY, orderId);
            log.warn(ignored.message());
            return ignored;
        }
        log.info("Order {} modified in queue: price={} qty={}", orderId, price, qty);
        return new RequestResult(RequestType.MODIFY, orderId, true, OrderStatus.MODIFIED,
                "Order " + orderId + " modified in queue.");
    }

    public RequestResult cancelOrder(long orderId) {
        if (!queue.cancel(orderId)) {
            RequestResult ignored = RequestResult.ignored(RequestType.CANCEL, orderId);
            log.warn(ignored.message());
            return ignored;
        }
        log.info("Order {} cancelled from queue", orderId);
        return new RequestResult(RequestType.CANCEL, orderId, true, OrderStatus.CANCELLED,
                "Order " + orderId + " cancelled from queue.");
    }

    private Order fromRequest(OrderRequest request) {
        return new Order(request.orderId(), request.symbolId(), request.side(),
                request.price(), request.qty(), clock.time());
    }

    /**
     * @return the status decided at admission: REJECTED, SENT or QUEUED. The order's
     *         own status may already have moved on when this returns.
     */
    private OrderStatus admit(Order order) {
        if (session.currentPhase() != SessionPhase.OPEN) {
            return reject(order, RejectReason.OUTSIDE_SESSION_WINDOW);
        }
        if (order.side == null) {
            return reject(order, RejectReason.INVALID_SIDE);
        }
        if (order.qty <= 0) {
            return reject(order, RejectReason.INVALID_QTY);
        }
        if (order.price <= 0) {
            return reject(order, RejectReason.INVALID_PRICE);
        }
        // duplicate id is checked by the dispatcher, atomically with the enqueue
        return dispatcher.submit(order);
    }

    private OrderStatus reject(Order order, RejectReason reason) {
        order.reject(reason);
        log.warn("Order {} rejected: {}", order.orderId, reason.text);
        return OrderStatus.REJECTED;
    }

    private static RequestResult toResult(Order order, OrderStatus admitted) {
        return switch (admitted) {
            case REJECTED -> new RequestResult(RequestType.NEW, order.orderId, false, OrderStatus.REJECTED,
                    "Order " + order.orderId + " rejected: " + order.rejectReason.text + ".");
            case QUEUED -> new RequestResult(RequestType.NEW, order.orderId, true, OrderStatus.QUEUED,
                    "Order " + order.orderId + " queued due to throttle.");
            default -> new RequestResult(RequestType.NEW, order.orderId, true, OrderStatus.SENT,
                    "Order " + order.orderId + " sent to exchange.");
        };
    }

    // ---- Session events ----

    @Override
    public void onLogon(String username, LocalTime at) {
        log.info("Gateway open for orders as {}", username);
    }

    @Override
    public void onLogout(String username, LocalTime at) {
        int backlog = queue.size();
        if (backlog > 0) {
            log.info("Gateway closed to new orders as {}; {} queued orders keep draining", username, backlog);
        } else {
            log.info("Gateway closed to new orders as {}", username);
        }
    }
}
