package org.example.authcore.service.impl;

import org.example.authcore.exception.AccountNotFoundException;
import org.example.authcore.exception.AuthenticationFailedException;
import org.example.authcore.exception.InactiveAccountException;
import org.example.authcore.exception.InvalidTokenException;
import org.example.authcore.exception.NotificationException;
import org.example.authcore.model.Account;
import org.example.authcore.model.AccountState;
import org.example.authcore.repository.AccountRepository;
import org.example.authcore.security.CredentialClass;
import org.example.authcore.security.JwtService;
import org.example.authcore.service.AccountService;
import org.example.authcore.service.EmailService;
import org.example.authcore.service.LoginResult;
import org.example.authcore.support.MutableClock;
import org.example.authcore.support.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionServiceImplTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String EMAIL = "a@x.com";

    @Mock
    private AccountRepository accountRepository;
    @Mock
    private AccountService accountService;
    @Mock
    private EmailService emailService;

    private MutableClock clock;
    private JwtService jwtService;
    private SessionServiceImpl sessionService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        jwtService = new JwtService(TestKeys.EMBEDDED, "auth-core", Duration.ofMinutes(30), Duration.ofHours(72), clock);
        sessionService = new SessionServiceImpl(accountRepository, accountService, emailService, jwtService, jwtService);
    }

    private Account account(long id, AccountState state) {
        Account account = new Account(EMAIL, "hash", "salt", "Ab3dEf7h", T0);
        account.setId(id);
        account.setState(state);
        return account;
    }

    @Test
    void preRegisterMailsActivationSecret() {
        Account pending = account(3L, AccountState.PENDING);
        when(accountService.beginRegistration(EMAIL, "secret1")).thenReturn(pending);

        Account result = sessionService.preRegister(EMAIL, "secret1");

        assertThat(result).isSameAs(pending);
        verify(emailService).sendActivationEmail(EMAIL, "Ab3dEf7h");
    }

    @Test
    void preRegisterFailsWhenMailFails() {
        Account pending = account(3L, AccountState.PENDING);
        when(accountService.beginRegistration(EMAIL, "secret1")).thenReturn(pending);
        doThrow(new NotificationException("smtp down", null)).when(emailService).sendActivationEmail(anyString(), anyString());

        assertThatThrownBy(() -> sessionService.preRegister(EMAIL, "secret1"))
                .isInstanceOf(NotificationException.class);
        verify(accountService).beginRegistration(EMAIL, "secret1");
    }

    @Test
    void activateUnknownEmailIsNotFound() {
        when(accountRepository.findByEmail(EMAIL)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> sessionService.activate(EMAIL, "Ab3dEf7h"))
                .isInstanceOf(AccountNotFoundException.class);
        verify(accountService, never()).activate(any(), anyString());
    }

    @Test
    void activateDelegatesToStateMachine() {
        Account pending = account(3L, AccountState.PENDING);
        when(accountRepository.findByEmail(EMAIL)).thenReturn(Optional.of(pending));

        sessionService.activate(EMAIL, "Ab3dEf7h");

        verify(accountService).activate(pending, "Ab3dEf7h");
    }

    @Test
    void loginIssuesAccessAndRefreshTokens() {
        Account active = account(9L, AccountState.ACTIVE);
        when(accountRepository.findByEmail(EMAIL)).thenReturn(Optional.of(active));

        LoginResult result = sessionService.login(EMAIL, "secret1");

        verify(accountService).authenticate(active, "secret1");
        assertThat(result.getAccountId()).isEqualTo(9L);
        assertThat(jwtService.verify(result.getAccessToken(), CredentialClass.ACCESS)).isEqualTo(9L);
        assertThat(jwtService.verify(result.getRefreshToken(), CredentialClass.REFRESH)).isEqualTo(9L);
    }

    @Test
    void loginPropagatesAuthenticationFailure() {
        Account active = account(9L, AccountState.ACTIVE);
        when(accountRepository.findByEmail(EMAIL)).thenReturn(Optional.of(active));
        doThrow(new AuthenticationFailedException("bad")).when(accountService).authenticate(active, "nope");

        assertThatThrownBy(() -> sessionService.login(EMAIL, "nope"))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void refreshIssuesNewAccessTokenForSameAccount() {
        when(accountRepository.findById(9L)).thenReturn(Optional.of(account(9L, AccountState.ACTIVE)));
        String refreshToken = jwtService.issue(9L, CredentialClass.REFRESH);
        clock.advance(Duration.ofHours(1));

        String accessToken = sessionService.refresh(refreshToken);

        assertThat(jwtService.verify(accessToken, CredentialClass.ACCESS)).isEqualTo(9L);
    }

    @Test
    void refreshRejectsAccessToken() {
        String accessToken = jwtService.issue(9L, CredentialClass.ACCESS);

        assertThatThrownBy(() -> sessionService.refresh(accessToken))
                .isInstanceOf(InvalidTokenException.class);
        verify(accountRepository, never()).findById(any());
    }

    @Test
    void refreshRejectsDeletedAccount() {
        when(accountRepository.findById(9L)).thenReturn(Optional.empty());
        String refreshToken = jwtService.issue(9L, CredentialClass.REFRESH);

        assertThatThrownBy(() -> sessionService.refresh(refreshToken))
                .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void refreshRejectsInactiveAccount() {
        when(accountRepository.findById(9L)).thenReturn(Optional.of(account(9L, AccountState.PENDING)));
        String refreshToken = jwtService.issue(9L, CredentialClass.REFRESH);

        assertThatThrownBy(() -> sessionService.refresh(refreshToken))
                .isInstanceOf(InactiveAccountException.class);
    }
}
