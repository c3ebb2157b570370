package com.ordergw.gateway.queue;

import com.ordergw.gateway.order.Order;
import com.ordergw.gateway.throttle.ThrottleGate;
import com.ordergw.protocol.OrderStatus;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FIFO queue of orders deferred by the throttle.
 *
 * Data structure: Long2ObjectLinkedOpenHashMap keyed by order id. The map keeps
 * insertion order, which gives FIFO drain, and O(1) lookup for modify/cancel.
 *
 * Every operation holds this object's monitor, so a modify/cancel racing a drain
 * sees the queue either before or after the whole drain, never half-way.
 */
public final class PendingQueue {

    /** Outcome of {@link #admitOrEnqueue}. */
    public enum Admission {
        ADMITTED,   // gate had capacity, caller sends now
        QUEUED,
        DUPLICATE   // id already queued, nothing changed
    }

    private final Long2ObjectLinkedOpenHashMap<Order> orders = new Long2ObjectLinkedOpenHashMap<>(256);

    /**
     * Appends the order and marks it QUEUED.
     * @throws IllegalStateException if an order with the same id is already queued
     */
    public synchronized void enqueue(Order order) {
        if (orders.containsKey(order.orderId)) {
            throw new IllegalStateException("Order " + order.orderId + " already queued");
        }
        order.status = OrderStatus.QUEUED;
        orders.put(order.orderId, order);
    }

    /**
     * Duplicate check, throttle check and enqueue as one step under the queue lock,
     * so two callers racing on the same id cannot both get past the duplicate check.
     */
    public synchronized Admission admitOrEnqueue(Order order, ThrottleGate gate) {
        if (orders.containsKey(order.orderId)) return Admission.DUPLICATE;
        if (gate.tryAdmit()) return Admission.ADMITTED;
        order.status = OrderStatus.QUEUED;
        orders.put(order.orderId, order);
        return Admission.QUEUED;
    }

    /**
     * Amends price and qty in place. Id and queue position are unchanged.
     * @return false if the id is not queued (nothing is touched)
     */
    public synchronized boolean modify(long orderId, long newPrice, long newQty) {
        Order order = orders.get(orderId);
        if (order == null) return false;
        order.price  = newPrice;
        order.qty    = newQty;
        order.status = OrderStatus.MODIFIED;
        return true;
    }

    /** @return false if the id is not queued */
    public synchronized boolean cancel(long orderId) {
        Order order = orders.remove(orderId);
        if (order == null) return false;
        order.status = OrderStatus.CANCELLED;
        return true;
    }

    /**
     * Pulls orders from the head while the gate admits them. Stops at the first
     * denial so a later order never overtakes an earlier one still waiting.
     * @return admitted orders in FIFO order, already removed from the queue
     */
    public synchronized List<Order> drainAdmissible(ThrottleGate gate) {
        if (orders.isEmpty()) return Collections.emptyList();
        List<Order> admitted = new ArrayList<>();
        while (!orders.isEmpty() && gate.tryAdmit()) {
            admitted.add(orders.removeFirst());
        }
        return admitted;
    }

    public synchronized boolean contains(long orderId) {
        return orders.containsKey(orderId);
    }

    public synchronized int size() {
        return orders.size();
    }

    public synchronized boolean isEmpty() {
        return orders.isEmpty();
    }

    /** Queued orders in FIFO order. The list is a copy; the orders are live. */
    public synchronized List<Order> snapshot() {
        return new ArrayList<>(orders.values());
    }
}
