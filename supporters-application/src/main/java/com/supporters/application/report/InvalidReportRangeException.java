package com.supporters.application.report;

import com.supporters.domain.DomainException;

public final class InvalidReportRangeException extends DomainException {

    public InvalidReportRangeException(String message) {
        super(message);
    }

    public InvalidReportRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
