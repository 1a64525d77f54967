package org.example.authcore.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class LoginResult {
    private final long accountId;
    private final String accessToken;
    // Opaque renewal handle; the client replays it verbatim on refresh.
    private final String refreshToken;
}
