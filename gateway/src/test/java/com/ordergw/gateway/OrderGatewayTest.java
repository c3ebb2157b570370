package com.ordergw.gateway;

import com.ordergw.gateway.dispatch.Dispatcher;
import com.ordergw.gateway.order.Order;
import com.ordergw.gateway.queue.PendingQueue;
import com.ordergw.gateway.session.SessionController;
import com.ordergw.gateway.session.SessionWindow;
import com.ordergw.gateway.throttle.ThrottleGate;
import com.ordergw.protocol.OrderRequest;
import com.ordergw.protocol.OrderStatus;
import com.ordergw.protocol.RejectReason;
import com.ordergw.protocol.RequestType;
import com.ordergw.protocol.ResponseRecord;
import com.ordergw.protocol.SessionPhase;
import com.ordergw.protocol.Side;
import com.ordergw.protocol.Verdict;
import org.agrona.concurrent.CachedEpochClock;
import org.agrona.concurrent.SystemNanoClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.ordergw.protocol.Prices.PRICE_SCALE;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour of the gateway with a hand-driven clock: session polls and
 * dispatcher ticks are invoked directly instead of from the background threads.
 */
class OrderGatewayTest {

    private static final int CAP = 3;

    private CachedEpochClock clock;
    private SessionController session;
    private PendingQueue queue;
    private Dispatcher dispatcher;
    private OrderGateway gateway;

    // Exchange side: a copy of each order as it was sent
    record Sent(long orderId, long price, long qty) {}

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final List<ResponseRecord> records = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new CachedEpochClock();
        setTime(LocalTime.of(9, 0));

        SessionWindow window = new SessionWindow(LocalTime.of(9, 15), LocalTime.of(15, 30), ZoneOffset.UTC);
        session = new SessionController(window, "trader", clock, Duration.ofMillis(500));
        queue = new PendingQueue();
        ThrottleGate gate = new ThrottleGate(CAP, clock);
        dispatcher = new Dispatcher(gate, queue, order -> {
            sent.add(new Sent(order.orderId, order.price, order.qty));
            return CompletableFuture.completedFuture(Verdict.ACCEPT);
        }, records::add, clock, new SystemNanoClock());
        gateway = new OrderGateway(session, queue, dispatcher, clock, Duration.ofMillis(10), Duration.ofSeconds(5));
        session.poll();
    }

    // -----------------------------------------------------------------------
    // Session admission
    // -----------------------------------------------------------------------

    @Test
    void testRejectedBeforeOpen() {
        Order o = gateway.newOrder(1, Side.BUY, 100 * PRICE_SCALE, 10);

        assertEquals(OrderStatus.REJECTED, o.status);
        assertEquals(RejectReason.OUTSIDE_SESSION_WINDOW, o.rejectReason);
        assertEquals("Not in allowed time window", o.rejectReason.text);
        assertTrue(queue.isEmpty(), "Rejected orders are never queued");
        assertTrue(sent.isEmpty());
        assertTrue(records.isEmpty());
    }

    @Test
    void testRejectedAfterClose() {
        open();
        setTime(LocalTime.of(15, 30, 1));
        assertEquals(SessionPhase.CLOSED, session.poll());

        RequestResult result = gateway.onRequest(OrderRequest.newOrder(3000, 1, Side.SELL, 300 * PRICE_SCALE, 1));

        assertFalse(result.applied());
        assertEquals(OrderStatus.REJECTED, result.status());
        assertEquals("Order 3000 rejected: Not in allowed time window.", result.message());
        assertTrue(sent.isEmpty());
        assertTrue(records.isEmpty());
        assertTrue(queue.isEmpty());
    }

    @Test
    void testSentWhileOpenWithCapacity() {
        open();
        Order o = gateway.newOrder(1, Side.BUY, 100 * PRICE_SCALE, 10);

        assertEquals(OrderStatus.SENT, o.status);
        assertEquals(1, sent.size());
        assertEquals(1, records.size(), "Exactly one response record");
        assertEquals(o.orderId, records.get(0).orderId());
    }

    @Test
    void testGatewayAssignsIncreasingIds() {
        open();
        Order a = gateway.newOrder(1, Side.BUY, 100 * PRICE_SCALE, 10);
        Order b = gateway.newOrder(1, Side.SELL, 100 * PRICE_SCALE, 10);

        assertTrue(b.orderId > a.orderId);
    }

    // -----------------------------------------------------------------------
    // Throttle and queue
    // -----------------------------------------------------------------------

    @Test
    void testFiveOrdersCapThree() {
        open();
        List<RequestResult> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            results.add(gateway.onRequest(OrderRequest.newOrder(1000 + i, 1, Side.BUY, (100 + i) * PRICE_SCALE, 10 + i)));
        }

        for (int i = 0; i < 3; i++) assertEquals(OrderStatus.SENT, results.get(i).status());
        assertEquals(OrderStatus.QUEUED, results.get(3).status());
        assertEquals(OrderStatus.QUEUED, results.get(4).status());
        assertEquals("Order 1004 queued due to throttle.", results.get(4).message());
        assertEquals(2, gateway.queuedCount());
        assertEquals(3, sent.size());
    }

    @Test
    void testModifiedQueuedOrderSentWithNewValues() {
        open();
        fillInterval();
        gateway.onRequest(OrderRequest.newOrder(1001, 1, Side.BUY, 101 * PRICE_SCALE, 11));

        RequestResult mod = gateway.modifyOrder(1001, 1055 * PRICE_SCALE / 10, 99);
        assertTrue(mod.applied());
        assertEquals(OrderStatus.MODIFIED, mod.status());

        nextSecond();
        dispatcher.tick();

        Sent last = sent.get(sent.size() - 1);
        assertEquals(1001, last.orderId());
        assertEquals(1055 * PRICE_SCALE / 10, last.price());
        assertEquals(99, last.qty());
    }

    @Test
    void testLastOfSeveralModifiesWins() {
        open();
        fillInterval();
        gateway.onRequest(OrderRequest.newOrder(1003, 1, Side.BUY, 103 * PRICE_SCALE, 13));
        gateway.onRequest(OrderRequest.modify(1003, 120 * PRICE_SCALE, 50));
        gateway.onRequest(OrderRequest.modify(1003, 130 * PRICE_SCALE, 60));

        nextSecond();
        dispatcher.tick();

        assertEquals(new Sent(1003, 130 * PRICE_SCALE, 60), sent.get(sent.size() - 1));
    }

    @Test
    void testCancelledQueuedOrderNeverSent() {
        open();
        fillInterval();
        gateway.onRequest(OrderRequest.newOrder(1002, 1, Side.BUY, 102 * PRICE_SCALE, 12));

        RequestResult cancel = gateway.onRequest(OrderRequest.cancel(1002));
        assertTrue(cancel.applied());
        assertEquals("Order 1002 cancelled from queue.", cancel.message());

        nextSecond();
        dispatcher.tick();

        assertTrue(sent.stream().noneMatch(s -> s.orderId() == 1002));
        assertTrue(records.stream().noneMatch(r -> r.orderId() == 1002));
    }

    @Test
    void testFifoAcrossDrains() {
        open();
        fillInterval();
        for (int i = 0; i < 5; i++) gateway.onRequest(OrderRequest.newOrder(2000 + i, 2, Side.SELL, 200 * PRICE_SCALE, 20));

        nextSecond();
        dispatcher.tick();
        nextSecond();
        dispatcher.tick();

        List<Long> order = new ArrayList<>();
        for (Sent s : sent) if (s.orderId() >= 2000) order.add(s.orderId());
        assertEquals(List.of(2000L, 2001L, 2002L, 2003L, 2004L), order);
    }

    @Test
    void testQueueKeepsDrainingAfterLogout() {
        open();
        fillInterval();
        gateway.onRequest(OrderRequest.newOrder(42, 1, Side.BUY, 100 * PRICE_SCALE, 1));

        setTime(LocalTime.of(15, 31));
        session.poll();
        dispatcher.tick();

        assertEquals(42, sent.get(sent.size() - 1).orderId(), "Admitted orders still go out");
    }

    // -----------------------------------------------------------------------
    // Stale references
    // -----------------------------------------------------------------------

    @Test
    void testModifyUnknownIgnoredTwice() {
        open();
        RequestResult first  = gateway.modifyOrder(9999, 111 * PRICE_SCALE, 1);
        RequestResult second = gateway.modifyOrder(9999, 111 * PRICE_SCALE, 1);

        assertEquals("Modify request for 9999 ignored: not in queue.", first.message());
        assertEquals(first, second);
        assertFalse(first.applied());
        assertNull(first.status());
    }

    @Test
    void testCancelTwice() {
        open();
        fillInterval();
        gateway.onRequest(OrderRequest.newOrder(5000, 4, Side.SELL, 50 * PRICE_SCALE, 5));

        assertTrue(gateway.cancelOrder(5000).applied());
        RequestResult again = gateway.cancelOrder(5000);
        assertFalse(again.applied());
        assertEquals(RequestType.CANCEL, again.type());
        assertEquals("Cancel request for 5000 ignored: not in queue.", again.message());
        assertFalse(gateway.modifyOrder(5000, 80 * PRICE_SCALE, 9).applied(), "Modify after cancel is ignored");
    }

    @Test
    void testModifyToInvalidValuesRefused() {
        open();
        fillInterval();
        gateway.onRequest(OrderRequest.newOrder(1001, 1, Side.BUY, 101 * PRICE_SCALE, 11));

        RequestResult zeroQty = gateway.modifyOrder(1001, 105 * PRICE_SCALE, 0);
        assertFalse(zeroQty.applied());
        assertEquals("Modify request for 1001 rejected: Quantity must be positive.", zeroQty.message());

        RequestResult badPrice = gateway.onRequest(OrderRequest.modify(1001, -5, 7));
        assertFalse(badPrice.applied());
        assertEquals("Modify request for 1001 rejected: Price must be positive.", badPrice.message());

        assertEquals(OrderStatus.QUEUED, queue.snapshot().get(0).status, "Queued order unchanged");

        nextSecond();
        dispatcher.tick();

        assertEquals(new Sent(1001, 101 * PRICE_SCALE, 11), sent.get(sent.size() - 1));
    }

    @Test
    void testAmendAfterSendIgnored() {
        open();
        Order o = gateway.newOrder(1, Side.BUY, 100 * PRICE_SCALE, 10);
        assertEquals(OrderStatus.SENT, o.status);

        assertFalse(gateway.modifyOrder(o.orderId, 1, 1).applied());
        assertFalse(gateway.cancelOrder(o.orderId).applied());
        assertEquals(100 * PRICE_SCALE, o.price, "Sent order untouched");
    }

    @Test
    void testAmendWorksOutsideSession() {
        open();
        fillInterval();
        gateway.onRequest(OrderRequest.newOrder(77, 1, Side.BUY, 100 * PRICE_SCALE, 1));
        setTime(LocalTime.of(16, 0));
        session.poll();

        assertTrue(gateway.cancelOrder(77).applied());
    }

    // -----------------------------------------------------------------------
    // Validation
    // -----------------------------------------------------------------------

    @Test
    void testInvalidInputsRejected() {
        open();
        assertEquals(RejectReason.INVALID_QTY,   gateway.newOrder(7, Side.BUY, 100 * PRICE_SCALE, 0).rejectReason);
        assertEquals(RejectReason.INVALID_QTY,   gateway.newOrder(7, Side.BUY, 100 * PRICE_SCALE, -5).rejectReason);
        assertEquals(RejectReason.INVALID_PRICE, gateway.newOrder(7, Side.BUY, 0, 10).rejectReason);
        assertEquals(RejectReason.INVALID_PRICE, gateway.newOrder(7, Side.BUY, -10 * PRICE_SCALE, 10).rejectReason);
        assertEquals(RejectReason.INVALID_SIDE,
                gateway.newOrder(new OrderRequest(RequestType.NEW, 7000, 6, null, 100 * PRICE_SCALE, 10)).rejectReason);
        assertTrue(sent.isEmpty());
    }

    @Test
    void testDuplicateOfQueuedIdRejected() {
        open();
        fillInterval();
        gateway.onRequest(OrderRequest.newOrder(6000, 5, Side.BUY, 100 * PRICE_SCALE, 10));

        Order dup = gateway.newOrder(OrderRequest.newOrder(6000, 5, Side.SELL, 200 * PRICE_SCALE, 20));

        assertEquals(RejectReason.DUPLICATE_ORDER_ID, dup.rejectReason);
        assertEquals(1, gateway.queuedCount());
        assertEquals(100 * PRICE_SCALE, queue.snapshot().get(0).price, "First queued order untouched");
    }

    @Test
    void testConcurrentSameIdQueuedOnce() throws Exception {
        open();
        fillInterval();
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 200; round++) {
                CyclicBarrier barrier = new CyclicBarrier(2);
                Callable<RequestResult> submit = () -> {
                    barrier.await(5, TimeUnit.SECONDS);
                    return gateway.onRequest(OrderRequest.newOrder(42, 1, Side.BUY, 100 * PRICE_SCALE, 1));
                };
                Future<RequestResult> a = callers.submit(submit);
                Future<RequestResult> b = callers.submit(submit);
                List<OrderStatus> statuses = List.of(a.get(5, TimeUnit.SECONDS).status(), b.get(5, TimeUnit.SECONDS).status());

                assertTrue(statuses.contains(OrderStatus.QUEUED), "Round " + round + ": " + statuses);
                assertTrue(statuses.contains(OrderStatus.REJECTED), "Round " + round + ": " + statuses);
                assertEquals(1, gateway.queuedCount());
                assertTrue(gateway.cancelOrder(42).applied());
            }
        } finally {
            callers.shutdownNow();
        }
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    @Test
    void testStartAndClose() throws InterruptedException {
        setTime(LocalTime.of(10, 0));
        gateway.start();
        try {
            assertTrue(gateway.awaitOpen(Duration.ofSeconds(1)));
            assertEquals(SessionPhase.OPEN, gateway.phase());
        } finally {
            gateway.close();
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private void open() {
        setTime(LocalTime.of(9, 30));
        assertEquals(SessionPhase.OPEN, session.poll());
    }

    /** Uses up the current second's capacity with throwaway orders. */
    private void fillInterval() {
        for (int i = 0; i < CAP; i++) {
            gateway.newOrder(OrderRequest.newOrder(900_000 + sent.size(), 9, Side.BUY, PRICE_SCALE, 1));
        }
    }

    private void nextSecond() {
        clock.update(clock.time() - clock.time() % 1_000 + 1_000);
    }

    private void setTime(LocalTime time) {
        clock.update(LocalDateTime.of(2024, 1, 2, 0, 0).with(time).toInstant(ZoneOffset.UTC).toEpochMilli());
    }
}
