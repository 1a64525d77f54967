package org.example.authcore.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.authcore.exception.AccountNotFoundException;
import org.example.authcore.exception.InactiveAccountException;
import org.example.authcore.model.Account;
import org.example.authcore.repository.AccountRepository;
import org.example.authcore.security.CredentialClass;
import org.example.authcore.security.CredentialIssuer;
import org.example.authcore.security.CredentialVerifier;
import org.example.authcore.service.AccountService;
import org.example.authcore.service.EmailService;
import org.example.authcore.service.LoginResult;
import org.example.authcore.service.SessionService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Coordinates the account state machine with credential issuance. Errors from either side
 * are passed through unchanged; nothing here retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionServiceImpl implements SessionService {

    private final AccountRepository accountRepository;
    private final AccountService accountService;
    private final EmailService emailService;
    private final CredentialIssuer credentialIssuer;
    private final CredentialVerifier credentialVerifier;

    /**
     * Not transactional: when delivery fails the pending row stays behind, and the next
     * pre-registration for the same email replaces it.
     */
    @Override
    public Account preRegister(String email, String password) {
        Account account = accountService.beginRegistration(email, password);
        emailService.sendActivationEmail(account.getEmail(), account.getActivationSecret());
        return account;
    }

    @Override
    @Transactional
    public void activate(String email, String activationSecret) {
        accountService.activate(loadByEmail(email), activationSecret);
    }

    @Override
    @Transactional(readOnly = true)
    public LoginResult login(String email, String password) {
        Account account = loadByEmail(email);
        accountService.authenticate(account, password);

        String accessToken = credentialIssuer.issue(account.getId(), CredentialClass.ACCESS);
        String refreshToken = credentialIssuer.issue(account.getId(), CredentialClass.REFRESH);
        log.info("Account {} logged in", account.getId());
        return new LoginResult(account.getId(), accessToken, refreshToken);
    }

    @Override
    @Transactional(readOnly = true)
    public String refresh(String refreshToken) {
        long accountId = credentialVerifier.verify(refreshToken, CredentialClass.REFRESH);
        Account account = get(accountId);
        if (!account.isActive()) {
            throw new InactiveAccountException("Account is not active");
        }
        return credentialIssuer.issue(account.getId(), CredentialClass.ACCESS);
    }

    @Override
    @Transactional(readOnly = true)
    public Account get(long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException("Account not found"));
    }

    private Account loadByEmail(String email) {
        return accountRepository.findByEmail(email)
                .orElseThrow(() -> new AccountNotFoundException("Account not found"));
    }
}
