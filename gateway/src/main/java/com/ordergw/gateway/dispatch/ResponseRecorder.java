package com.ordergw.gateway.dispatch;

import com.ordergw.protocol.ResponseRecord;

/**
 * Append-only sink for exchange responses. Must return promptly: it runs on
 * whichever thread completes the sender's future.
 */
@FunctionalInterface
public interface ResponseRecorder {

    void record(ResponseRecord record);
}
