package com.supporters.domain;

/**
 * Base unchecked exception for supporter lifecycle failures.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
