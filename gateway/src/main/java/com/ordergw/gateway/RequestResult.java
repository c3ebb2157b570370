package com.ordergw.gateway;

import com.ordergw.protocol.OrderStatus;
import com.ordergw.protocol.RequestType;

/**
 * Outcome of one client request, as surfaced back to the caller.
 *
 * @param applied false for rejected new orders, for amendments of ids that are
 *                not queued and for modifies with invalid values
 * @param status  order status after the request, or null for amendments that
 *                changed nothing
 */
public record RequestResult(RequestType type, long orderId, boolean applied, OrderStatus status, String message) {

    static RequestResult ignored(RequestType type, long orderId) {
        String verb = type == RequestType.MODIFY ? "Modify" : "Cancel";
        return new RequestResult(type, orderId, false, null,
                verb + " request for " + orderId + " ignored: not in queue.");
    }
}
