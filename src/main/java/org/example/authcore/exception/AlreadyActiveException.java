package org.example.authcore.exception;

/**
 * Raised when registering or activating an email whose account is already active.
 */
public class AlreadyActiveException extends AuthCoreException {

    public AlreadyActiveException(String message) {
        super(message);
    }
}
