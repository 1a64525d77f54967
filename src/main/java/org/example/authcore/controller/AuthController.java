package org.example.authcore.controller;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.example.authcore.dto.request.ActivateRequest;
import org.example.authcore.dto.request.LoginRequest;
import org.example.authcore.dto.request.PreRegisterRequest;
import org.example.authcore.dto.response.MessageResponse;
import org.example.authcore.dto.response.TokenResponse;
import org.example.authcore.exception.AccountNotFoundException;
import org.example.authcore.exception.AuthenticationFailedException;
import org.example.authcore.exception.InactiveAccountException;
import org.example.authcore.exception.InvalidTokenException;
import org.example.authcore.service.LoginResult;
import org.example.authcore.service.SessionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

@Slf4j
@RestController
@RequestMapping("/api/auth")
@CrossOrigin(origins = "${app.cors.allowed-origins:http://localhost:5173}", allowCredentials = "true")
public class AuthController {

    static final String REFRESH_COOKIE = "refresh-token";
    static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final SessionService sessionService;
    private final Duration refreshTtl;
    private final boolean secureCookie;

    public AuthController(SessionService sessionService,
                          @Value("${app.jwt.refresh-ttl:72h}") Duration refreshTtl,
                          @Value("${app.cookie.secure:false}") boolean secureCookie) {
        this.sessionService = sessionService;
        this.refreshTtl = refreshTtl;
        this.secureCookie = secureCookie;
    }

    @PostMapping("/register/initial")
    public ResponseEntity<MessageResponse> preRegister(@Valid @RequestBody PreRegisterRequest req) {
        sessionService.preRegister(req.getEmail(), req.getPassword());
        return ResponseEntity.ok(new MessageResponse("ok"));
    }

    @PostMapping("/register/complete")
    public ResponseEntity<MessageResponse> activate(@Valid @RequestBody ActivateRequest req) {
        sessionService.activate(req.getEmail(), req.getToken());
        return ResponseEntity.ok(new MessageResponse("activate ok"));
    }

    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest req) {
        LoginResult result;
        try {
            result = sessionService.login(req.getEmail(), req.getPassword());
        } catch (AccountNotFoundException | InactiveAccountException | AuthenticationFailedException e) {
            // One answer for all three so callers cannot tell which emails exist.
            log.debug("Login rejected: {}", e.getMessage());
            return ResponseEntity.status(401).body(new TokenResponse(INVALID_CREDENTIALS, null));
        }

        ResponseCookie cookie = ResponseCookie.from(REFRESH_COOKIE, result.getRefreshToken())
                .httpOnly(true)
                .secure(secureCookie)
                .sameSite("Strict")
                .path("/api/auth")
                .maxAge(refreshTtl)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(new TokenResponse(null, result.getAccessToken()));
    }

    @GetMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@CookieValue(name = REFRESH_COOKIE, required = false) String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new InvalidTokenException("Missing refresh-token cookie");
        }
        return ResponseEntity.ok(new TokenResponse(null, sessionService.refresh(refreshToken)));
    }
}
