package com.supporters.application.ports;

/**
 * Abstraction over configuration.
 * Infrastructure provides implementation (file/env).
 */
public interface ConfigPort {

    /** Configured value, or {@code defaultValue} when unset or blank. */
    String get(String key, String defaultValue);
}
