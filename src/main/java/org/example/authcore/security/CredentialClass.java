package org.example.authcore.security;

import lombok.Getter;

/**
 * Access and refresh credentials are told apart only by their {@code sub} claim,
 * so a token of one class never verifies as the other.
 */
@Getter
public enum CredentialClass {
    ACCESS("access-token"),
    REFRESH("refresh-token");

    private final String subject;

    CredentialClass(String subject) {
        this.subject = subject;
    }
}
