package org.example.authcore.exception;

public class AuthenticationFailedException extends AuthCoreException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
