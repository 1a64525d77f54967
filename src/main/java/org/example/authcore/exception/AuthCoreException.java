package org.example.authcore.exception;

/**
 * Base type for every failure raised by the account and credential core.
 * Subclasses identify the failure kind; the web layer maps each kind to a response.
 */
public abstract class AuthCoreException extends RuntimeException {

    protected AuthCoreException(String message) {
        super(message);
    }

    protected AuthCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
