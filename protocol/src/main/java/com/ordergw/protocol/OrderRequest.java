package com.ordergw.protocol;

/**
 * Client request as received by the gateway.
 *
 * For MODIFY only orderId, price and qty are significant; for CANCEL only orderId.
 * Price is scaled by {@link Prices#PRICE_SCALE}.
 */
public record OrderRequest(RequestType type, long orderId, int symbolId, Side side, long price, long qty) {

    public static OrderRequest newOrder(long orderId, int symbolId, Side side, long price, long qty) {
        return new OrderRequest(RequestType.NEW, orderId, symbolId, side, price, qty);
    }

    public static OrderRequest modify(long orderId, long price, long qty) {
        return new OrderRequest(RequestType.MODIFY, orderId, 0, null, price, qty);
    }

    public static OrderRequest cancel(long orderId) {
        return new OrderRequest(RequestType.CANCEL, orderId, 0, null, 0, 0);
    }
}
