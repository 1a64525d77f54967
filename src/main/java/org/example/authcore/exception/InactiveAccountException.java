package org.example.authcore.exception;

public class InactiveAccountException extends AuthCoreException {

    public InactiveAccountException(String message) {
        super(message);
    }
}
