package com.ordergw.protocol;

public enum RejectReason {
    OUTSIDE_SESSION_WINDOW("Not in allowed time window"),
    INVALID_PRICE         ("Price must be positive"),
    INVALID_QTY           ("Quantity must be positive"),
    INVALID_SIDE          ("Side must be BUY or SELL"),
    DUPLICATE_ORDER_ID    ("Order id already queued");

    public final String text;
    RejectReason(String text) { this.text = text; }
}
