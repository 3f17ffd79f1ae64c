package com.di.neura.discovery.manifest;

/**
 * Thrown when the manifest snapshot cannot be read or written. Fatal to the
 * run; the previously persisted snapshot is left untouched.
 */
public class ManifestStoreException extends RuntimeException {

    public ManifestStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
