package com.kmg.lineocr.service;

/**
 * Cooperative cancellation signal, polled by a runner at page boundaries. Observing it never aborts a call
 * that is already in flight.
 */
@FunctionalInterface
public interface CancellationToken {

    boolean isCancellationRequested();
}
