package org.example.authcore.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.example.authcore.exception.AlreadyActiveException;
import org.example.authcore.exception.AuthenticationFailedException;
import org.example.authcore.exception.ExpiredTokenException;
import org.example.authcore.exception.InactiveAccountException;
import org.example.authcore.exception.InvalidTokenException;
import org.example.authcore.model.Account;
import org.example.authcore.model.AccountState;
import org.example.authcore.repository.AccountRepository;
import org.example.authcore.service.AccountService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
public class AccountServiceImpl implements AccountService {

    static final int SALT_LENGTH = 30;
    static final int ACTIVATION_SECRET_LENGTH = 8;
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final SecureRandom random = new SecureRandom();

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final Duration activationTtl;

    public AccountServiceImpl(AccountRepository accountRepository,
                              PasswordEncoder passwordEncoder,
                              Clock clock,
                              @Value("${app.activation.ttl:30m}") Duration activationTtl) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.activationTtl = activationTtl;
    }

    @Override
    @Transactional
    public Account beginRegistration(String email, String password) {
        Optional<Account> existing = accountRepository.findByEmail(email);
        if (existing.isPresent()) {
            Account stale = existing.get();
            if (stale.isActive()) {
                throw new AlreadyActiveException("Account already active");
            }
            accountRepository.delete(stale);
            // Flush the delete so the unique email is free before the insert.
            accountRepository.flush();
            log.info("Discarded pending account {} for re-registration", stale.getId());
        }

        String salt = randomString(SALT_LENGTH);
        String activationSecret = randomString(ACTIVATION_SECRET_LENGTH);
        Account account = new Account(email, hash(password, salt), salt, activationSecret, clock.instant());

        Account created = accountRepository.save(account);
        log.info("Created pending account {}", created.getId());
        return created;
    }

    @Override
    @Transactional
    public void activate(Account account, String presentedSecret) {
        if (account.isActive()) {
            throw new AlreadyActiveException("Account already active");
        }
        if (!secretMatches(presentedSecret, account.getActivationSecret())) {
            throw new InvalidTokenException("Activation secret does not match");
        }
        Instant now = clock.instant();
        if (now.isAfter(account.getUpdatedAt().plus(activationTtl))) {
            throw new ExpiredTokenException("Activation secret has expired");
        }

        account.setState(AccountState.ACTIVE);
        account.setUpdatedAt(now);
        accountRepository.save(account);
        log.info("Activated account {}", account.getId());
    }

    @Override
    public void authenticate(Account account, String password) {
        if (!account.isActive()) {
            throw new InactiveAccountException("Account is not active");
        }
        if (password == null || !passwordEncoder.matches(password + account.getSalt(), account.getPasswordHash())) {
            throw new AuthenticationFailedException("Password does not match");
        }
    }

    private String hash(String password, String salt) {
        return passwordEncoder.encode(password + salt);
    }

    private static boolean secretMatches(String presented, String expected) {
        if (presented == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    static String randomString(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
