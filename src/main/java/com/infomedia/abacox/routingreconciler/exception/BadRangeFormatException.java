package com.infomedia.abacox.routingreconciler.exception;

import org.springframework.http.HttpStatus;

public class BadRangeFormatException extends ReconciliationException {

    public BadRangeFormatException() {
        super("BadRangeFormat", HttpStatus.BAD_REQUEST, "Bad range format");
    }
}
