package com.supporters.infrastructure.csv;

import com.supporters.domain.DomainException;

public final class PaymentImportException extends DomainException {

    private final int lineNumber;

    public PaymentImportException(int lineNumber, String message, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
