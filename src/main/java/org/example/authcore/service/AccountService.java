package org.example.authcore.service;

import org.example.authcore.model.Account;

/**
 * Account state machine: {@code PENDING --activate--> ACTIVE}. A pending account is
 * replaced, never merged, when the same email registers again.
 */
public interface AccountService {

    /**
     * Creates a fresh pending account, discarding any pending one for the same email.
     *
     * @throws org.example.authcore.exception.AlreadyActiveException if the email belongs to an active account
     */
    Account beginRegistration(String email, String password);

    void activate(Account account, String presentedSecret);

    void authenticate(Account account, String password);
}
