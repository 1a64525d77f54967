package org.example.authcore.exception;

/** Activation email could not be delivered. */
public class NotificationException extends AuthCoreException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
