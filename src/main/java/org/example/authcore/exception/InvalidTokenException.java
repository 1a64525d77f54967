package org.example.authcore.exception;

/**
 * Signature, issuer, subject or expiry check failed on a credential,
 * or a presented activation secret did not match.
 */
public class InvalidTokenException extends AuthCoreException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
