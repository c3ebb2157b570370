package com.ordergw.tools;

import com.ordergw.common.GatewayConfig;
import com.ordergw.gateway.OrderGateway;
import com.ordergw.gateway.RequestResult;
import com.ordergw.gateway.recorder.FileResponseRecorder;
import com.ordergw.protocol.OrderRequest;
import com.ordergw.protocol.Prices;
import com.ordergw.protocol.SessionPhase;
import com.ordergw.protocol.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Replays sample order traffic against an in-process gateway wired to a
 * {@link SimulatedExchange} and a file response log.
 *
 * The session window is moved to [now + 2s, now + 12s) so a full logon/logout
 * cycle fits in one run.
 *
 * Usage:
 *   java -cp tools.jar com.ordergw.tools.TrafficSimulator [config-path]
 */
public final class TrafficSimulator {

    private static final Logger log = LoggerFactory.getLogger(TrafficSimulator.class);

    private static final int OPEN_DELAY_SECS  = 2;
    private static final int WINDOW_SECS      = 10;

    private final OrderGateway gateway;
    private final GatewayConfig cfg;
    private final List<RequestResult> results = new ArrayList<>();

    public TrafficSimulator(OrderGateway gateway, GatewayConfig cfg) {
        this.gateway = gateway;
        this.cfg     = cfg;
    }

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        GatewayConfig cfg = GatewayConfig.load(configPath);

        LocalTime now = LocalTime.now(cfg.zone());
        if (!windowFitsBeforeMidnight(now)) {
            log.error("Simulated session window would cross midnight at {}; run again after 00:00", now);
            return;
        }
        cfg.openTime  = now.plusSeconds(OPEN_DELAY_SECS);
        cfg.closeTime = now.plusSeconds(OPEN_DELAY_SECS + WINDOW_SECS);
        cfg.validate();
        log.info("Starting traffic simulator: {}", cfg);

        FileResponseRecorder recorder = new FileResponseRecorder(Paths.get(cfg.responseLogPath), cfg.zone());
        SimulatedExchange exchange = new SimulatedExchange(Duration.ofMillis(cfg.exchangeLatencyMillis));
        TrafficSimulator sim;
        // closed in reverse: gateway, then exchange (answers what is in flight), then the log
        try (recorder; exchange; OrderGateway gateway = OrderGateway.create(cfg, exchange, recorder)) {
            gateway.start();
            sim = new TrafficSimulator(gateway, cfg);
            sim.run();
            // let the queue drain and responses arrive
            Thread.sleep(2_000);
        }
        sim.printStats(exchange, recorder);
    }

    public void run() throws InterruptedException {
        log.info("Waiting for logon window...");
        if (!gateway.awaitOpen(Duration.ofSeconds(OPEN_DELAY_SECS + 5))) {
            log.error("Session never opened (phase {}), nothing to simulate", gateway.phase());
            return;
        }

        log.info("Sending orders...");
        burstWithPauses();
        amendQueuedOrders();
        burst(2000, 2, Side.SELL, 200.0, 20, 10);
        amendSameOrderRepeatedly();
        invalidOrders();

        log.info("Waiting for logout window...");
        while (gateway.phase() != SessionPhase.CLOSED) {
            Thread.sleep(100);
        }
        submit(OrderRequest.newOrder(3000, 1, Side.SELL, px(300.0), 1));
        // rejected orders never reach the queue
        submit(OrderRequest.cancel(3000));
    }

    // -----------------------------------------------------------------------
    // Scenarios
    // -----------------------------------------------------------------------

    /** Five orders 100ms apart: more than the cap, so some queue. */
    private void burstWithPauses() throws InterruptedException {
        for (int i = 0; i < 5; i++) {
            submit(OrderRequest.newOrder(1000 + i, 1, Side.BUY, px(100.0 + i), 10 + i));
            Thread.sleep(100);
        }
    }

    private void amendQueuedOrders() {
        submit(OrderRequest.modify(1001, px(105.5), 99));
        submit(OrderRequest.cancel(1002));
        // never existed
        submit(OrderRequest.modify(9999, px(111.1), 1));
        submit(OrderRequest.cancel(8888));
        // last modify wins
        submit(OrderRequest.modify(1003, px(120.0), 50));
        submit(OrderRequest.modify(1003, px(130.0), 60));
    }

    private void burst(long firstId, int symbolId, Side side, double basePrice, long baseQty, int count) {
        for (int i = 0; i < count; i++) {
            submit(OrderRequest.newOrder(firstId + i, symbolId, side, px(basePrice + i), baseQty + i));
        }
    }

    /** Fill the interval first so 5000 is queued, then amend it until cancelled. */
    private void amendSameOrderRepeatedly() {
        burst(5001, 4, Side.SELL, 51.0, 6, cfg.maxOrdersPerSecond);
        submit(OrderRequest.newOrder(5000, 4, Side.SELL, px(50.0), 5));
        submit(OrderRequest.modify(5000, px(60.0), 7));
        submit(OrderRequest.modify(5000, px(70.0), 8));
        submit(OrderRequest.cancel(5000));
        submit(OrderRequest.modify(5000, px(80.0), 9));
        submit(OrderRequest.cancel(5000));
    }

    private void invalidOrders() {
        // duplicate ids: the second is rejected only while the first is still queued
        submit(OrderRequest.newOrder(6000, 5, Side.BUY, px(100.0), 10));
        submit(OrderRequest.newOrder(6000, 5, Side.SELL, px(200.0), 20));

        try {
            submit(OrderRequest.newOrder(7000, 6, Side.fromCode('X'), px(100.0), 10));
        } catch (IllegalArgumentException e) {
            log.warn("Order 7000 not submitted: {}", e.getMessage());
        }

        submit(OrderRequest.newOrder(8000, 7, Side.BUY, px(100.0), 0));
        submit(OrderRequest.newOrder(8001, 7, Side.BUY, px(100.0), -5));
        submit(OrderRequest.newOrder(8002, 7, Side.BUY, px(0.0), 10));
        submit(OrderRequest.newOrder(8003, 7, Side.BUY, px(-10.0), 10));
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private void submit(OrderRequest request) {
        RequestResult result = gateway.onRequest(request);
        results.add(result);
        System.out.println(result.message());
    }

    /** The simulated window starts and ends on the same day as {@code now}. */
    static boolean windowFitsBeforeMidnight(LocalTime now) {
        return !now.isAfter(LocalTime.MAX.minusSeconds(OPEN_DELAY_SECS + WINDOW_SECS));
    }

    private static long px(double price) {
        return Prices.toScaled(price);
    }

    private void printStats(SimulatedExchange exchange, FileResponseRecorder recorder) {
        long applied = results.stream().filter(RequestResult::applied).count();
        System.out.printf("%n=== Traffic Simulator Results ===%n");
        System.out.printf("Requests:        %d%n", results.size());
        System.out.printf("Applied:         %d%n", applied);
        System.out.printf("Rejected/ignored:%d%n", results.size() - applied);
        System.out.printf("Sent to exchange:%d%n", exchange.receivedCount());
        System.out.printf("Responses logged:%d -> %s%n", recorder.written(), cfg.responseLogPath);
    }
}
