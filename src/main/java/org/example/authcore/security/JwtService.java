package org.example.authcore.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.example.authcore.exception.InvalidTokenException;
import org.example.authcore.exception.MalformedClaimException;
import org.example.authcore.exception.SigningException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies RS256-signed credentials. Holds no mutable state after construction.
 */
@Slf4j
@Service
public class JwtService implements CredentialIssuer, CredentialVerifier {

    public static final String USER_ID_CLAIM = "user_id";

    private final SigningKeys keys;
    private final String issuer;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final Clock clock;

    public JwtService(SigningKeys keys,
                      @Value("${app.jwt.issuer:auth-core}") String issuer,
                      @Value("${app.jwt.access-ttl:30m}") Duration accessTtl,
                      @Value("${app.jwt.refresh-ttl:72h}") Duration refreshTtl,
                      Clock clock) {
        this.keys = keys;
        this.issuer = issuer;
        this.accessTtl = accessTtl;
        this.refreshTtl = refreshTtl;
        this.clock = clock;
    }

    @Override
    public String issue(long accountId, CredentialClass credentialClass) {
        Instant now = clock.instant();
        try {
            return Jwts.builder()
                    .issuer(issuer)
                    .subject(credentialClass.getSubject())
                    .issuedAt(Date.from(now))
                    .expiration(Date.from(now.plus(ttl(credentialClass))))
                    .claim(USER_ID_CLAIM, accountId)
                    .signWith(keys.privateKey(), Jwts.SIG.RS256)
                    .compact();
        } catch (JwtException | IllegalArgumentException e) {
            throw new SigningException("Failed to sign " + credentialClass.getSubject(), e);
        }
    }

    @Override
    public long verify(String token, CredentialClass credentialClass) {
        Claims claims = parseAndValidate(token, credentialClass);
        return userId(claims);
    }

    private Duration ttl(CredentialClass credentialClass) {
        return credentialClass == CredentialClass.ACCESS ? accessTtl : refreshTtl;
    }

    private Claims parseAndValidate(String token, CredentialClass credentialClass) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing " + credentialClass.getSubject());
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(keys.publicKey())
                    .requireIssuer(issuer)
                    .requireSubject(credentialClass.getSubject())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected {}: {}", credentialClass.getSubject(), e.getMessage());
            throw new InvalidTokenException("Invalid " + credentialClass.getSubject(), e);
        }
        // The parser only enforces exp when present, and still accepts now == exp.
        if (claims.getExpiration() == null) {
            throw new InvalidTokenException(credentialClass.getSubject() + " has no expiry");
        }
        if (!clock.instant().isBefore(claims.getExpiration().toInstant())) {
            throw new InvalidTokenException(credentialClass.getSubject() + " has expired");
        }
        return claims;
    }

    private static long userId(Claims claims) {
        Object raw = claims.get(USER_ID_CLAIM);
        if (raw == null) {
            throw new MalformedClaimException("Token carries no " + USER_ID_CLAIM);
        }
        if (!(raw instanceof Integer || raw instanceof Long)) {
            throw new MalformedClaimException(USER_ID_CLAIM + " is not an integer: " + raw.getClass().getSimpleName());
        }
        long id = ((Number) raw).longValue();
        if (id < 0) {
            throw new MalformedClaimException(USER_ID_CLAIM + " is negative");
        }
        return id;
    }
}
