package org.example.authcore.service;

public interface EmailService {
    void sendActivationEmail(String to, String activationSecret);
}
