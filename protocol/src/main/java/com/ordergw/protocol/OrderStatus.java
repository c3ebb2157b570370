package com.ordergw.protocol;

public enum OrderStatus {
    NEW,
    QUEUED,
    SENT,
    MODIFIED,   // still queued, price/qty amended
    CANCELLED,
    REJECTED
}
