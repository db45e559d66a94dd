package com.infomedia.abacox.routingreconciler.exception;

import org.springframework.http.HttpStatus;

public class RangeEndBeforeStartException extends ReconciliationException {

    public RangeEndBeforeStartException() {
        super("RangeEndBeforeStart", HttpStatus.BAD_REQUEST, "Range end < start");
    }
}
