package com.infomedia.abacox.routingreconciler.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a store is used while its connection settings are not configured.
 */
public class StoreConnectionMissingException extends ReconciliationException {

    public StoreConnectionMissingException(String message) {
        super("StoreConnectionMissing", HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
