package org.example.authcore.exception;

public class AccountNotFoundException extends AuthCoreException {

    public AccountNotFoundException(String message) {
        super(message);
    }
}
