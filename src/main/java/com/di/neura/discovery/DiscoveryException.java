package com.di.neura.discovery;

/**
 * A discovery run failed outside row-local handling; nothing was persisted.
 */
public class DiscoveryException extends RuntimeException {

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
