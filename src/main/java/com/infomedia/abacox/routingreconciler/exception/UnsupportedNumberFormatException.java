package com.infomedia.abacox.routingreconciler.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class UnsupportedNumberFormatException extends ReconciliationException {

    private final String rawNumber;

    public UnsupportedNumberFormatException(String rawNumber) {
        super("UnsupportedNumberFormat", HttpStatus.BAD_REQUEST, "Unsupported number format: " + rawNumber);
        this.rawNumber = rawNumber;
    }
}
