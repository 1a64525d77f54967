package org.example.authcore.service;

import org.example.authcore.model.Account;

public interface SessionService {
    Account preRegister(String email, String password);
    void activate(String email, String activationSecret);
    LoginResult login(String email, String password);
    String refresh(String refreshToken);
    Account get(long accountId);
}
