package com.ordergw.gateway.order;

import com.ordergw.protocol.OrderStatus;
import com.ordergw.protocol.RejectReason;
import com.ordergw.protocol.Side;

/**
 * A client order as tracked by the gateway.
 *
 * Price and qty may only change while the order is owned by the
 * {@link com.ordergw.gateway.queue.PendingQueue}, under its lock. Status is
 * volatile so callers can observe the outcome from other threads.
 */
public final class Order {

    public final long orderId;
    public final int  symbolId;
    public final Side side;
    public final long submittedAtMillis;

    public long price;        // scaled (price * PRICE_SCALE)
    public long qty;

    public volatile OrderStatus  status = OrderStatus.NEW;
    public volatile RejectReason rejectReason;

    public Order(long orderId, int symbolId, Side side, long price, long qty, long submittedAtMillis) {
        this.orderId           = orderId;
        this.symbolId          = symbolId;
        this.side              = side;
        this.price             = price;
        this.qty               = qty;
        this.submittedAtMillis = submittedAtMillis;
    }

    public void reject(RejectReason reason) {
        this.rejectReason = reason;
        this.status       = OrderStatus.REJECTED;
    }

    @Override
    public String toString() {
        return "Order{id=" + orderId + ", symbol=" + symbolId + ", side=" + side
                + ", price=" + price + ", qty=" + qty + ", status=" + status + "}";
    }
}
