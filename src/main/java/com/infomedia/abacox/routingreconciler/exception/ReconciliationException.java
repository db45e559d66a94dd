package com.infomedia.abacox.routingreconciler.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for every failure a reconciliation request can end with.
 * The {@code kind} is the stable identifier reported to the caller.
 */
@Getter
public abstract class ReconciliationException extends RuntimeException {

    private final String kind;
    private final HttpStatus status;

    protected ReconciliationException(String kind, HttpStatus status, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
    }

    protected ReconciliationException(String kind, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public boolean isInputError() {
        return status.is4xxClientError();
    }
}
