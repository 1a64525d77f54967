package org.example.authcore.exception;

public class SigningException extends AuthCoreException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
