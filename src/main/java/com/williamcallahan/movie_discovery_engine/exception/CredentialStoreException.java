package com.williamcallahan.movie_discovery_engine.exception;

/**
 * Raised when the credential store cannot be read or written
 */
public class CredentialStoreException extends RuntimeException {

    public CredentialStoreException(String message) {
        super(message);
    }

    public CredentialStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
