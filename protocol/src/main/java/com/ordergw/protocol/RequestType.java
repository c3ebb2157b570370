package com.ordergw.protocol;

/**
 * Kind of client request carried by an {@link OrderRequest}.
 */
public enum RequestType {
    NEW,
    MODIFY,
    CANCEL
}
