package org.example.authcore.exception;

/**
 * The credential carried a valid signature but its user id claim was missing
 * or was not a non-negative integer.
 */
public class MalformedClaimException extends AuthCoreException {

    public MalformedClaimException(String message) {
        super(message);
    }
}
