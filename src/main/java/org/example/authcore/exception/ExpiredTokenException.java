package org.example.authcore.exception;

/** The activation window has elapsed. */
public class ExpiredTokenException extends AuthCoreException {

    public ExpiredTokenException(String message) {
        super(message);
    }
}
