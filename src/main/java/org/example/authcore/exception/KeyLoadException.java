package org.example.authcore.exception;

/**
 * Signing key material could not be read or parsed. Only thrown during startup.
 */
public class KeyLoadException extends AuthCoreException {

    public KeyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
