package org.example.authcore.model;

public enum AccountState {
    PENDING,
    ACTIVE
}
