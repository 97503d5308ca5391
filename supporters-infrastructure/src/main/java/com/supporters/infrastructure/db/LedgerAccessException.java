package com.supporters.infrastructure.db;

import com.supporters.domain.DomainException;

/**
 * Storage failure while reading or writing the payment ledger.
 */
public final class LedgerAccessException extends DomainException {

    public LedgerAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
