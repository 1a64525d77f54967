package org.example.authcore.security;

public interface CredentialIssuer {

    /**
     * Signs a new credential of the given class bound to {@code accountId}.
     *
     * @throws org.example.authcore.exception.SigningException if the token cannot be built or signed
     */
    String issue(long accountId, CredentialClass credentialClass);
}
