package com.ordergw.gateway.dispatch;

import com.ordergw.gateway.order.Order;
import com.ordergw.protocol.Verdict;

import java.util.concurrent.CompletableFuture;

/**
 * Transport to the exchange.
 *
 * Called from caller threads (immediate path) and from the dispatcher thread, so
 * implementations must not block: return a future completed with the exchange
 * verdict once the response arrives.
 */
@FunctionalInterface
public interface Sender {

    CompletableFuture<Verdict> send(Order order);
}
