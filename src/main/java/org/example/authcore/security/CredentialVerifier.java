package org.example.authcore.security;

public interface CredentialVerifier {

    /**
     * Verifies signature, issuer, subject and expiry, then returns the bound account id.
     *
     * @throws org.example.authcore.exception.InvalidTokenException if any check fails
     * @throws org.example.authcore.exception.MalformedClaimException if the user id claim is unusable
     */
    long verify(String token, CredentialClass credentialClass);
}
