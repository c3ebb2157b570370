package com.ordergw.protocol;

/** Exchange response to a sent order. */
public enum Verdict {
    ACCEPT,
    REJECT
}
