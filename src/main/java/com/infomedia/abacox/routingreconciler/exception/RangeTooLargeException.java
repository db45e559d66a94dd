package com.infomedia.abacox.routingreconciler.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class RangeTooLargeException extends ReconciliationException {

    private final int maxSpan;

    public RangeTooLargeException(int maxSpan) {
        super("RangeTooLarge", HttpStatus.BAD_REQUEST, "Range too large (>" + maxSpan + ")");
        this.maxSpan = maxSpan;
    }
}
