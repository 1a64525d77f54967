package org.example.authcore.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "accounts")
@Getter
@Setter
public class Account {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String email;

    @Column(nullable = false)
    private String passwordHash;

    @Column(nullable = false)
    private String salt;

    @Column(nullable = false, length = 8)
    private String activationSecret;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AccountState state = AccountState.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    // Last time credential material was generated; activation expiry is measured from here.
    @Column(nullable = false)
    private Instant updatedAt;

    public Account() {}

    public Account(String email, String passwordHash, String salt, String activationSecret, Instant now) {
        this.email = email;
        this.passwordHash = passwordHash;
        this.salt = salt;
        this.activationSecret = activationSecret;
        this.state = AccountState.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public boolean isActive() {
        return state == AccountState.ACTIVE;
    }
}
