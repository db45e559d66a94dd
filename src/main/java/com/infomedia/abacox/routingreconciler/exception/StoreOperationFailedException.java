package com.infomedia.abacox.routingreconciler.exception;

import org.springframework.http.HttpStatus;

/**
 * Wraps a driver, network or constraint error raised during a store round-trip.
 */
public class StoreOperationFailedException extends ReconciliationException {

    public StoreOperationFailedException(String message, Throwable cause) {
        super("StoreOperationFailed", HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
