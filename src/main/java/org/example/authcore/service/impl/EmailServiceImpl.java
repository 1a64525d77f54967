package org.example.authcore.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.example.authcore.exception.NotificationException;
import org.example.authcore.service.EmailService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Slf4j
@Service
public class EmailServiceImpl implements EmailService {

    private final JavaMailSender mailSender;
    private final String frontendUrl;
    private final String fromEmail;
    private final Duration activationTtl;
    // Development only: log the code instead of mailing it when no sender is configured.
    private final boolean logOnly;

    public EmailServiceImpl(JavaMailSender mailSender,
                            @Value("${app.frontend.url:http://localhost:5173}") String frontendUrl,
                            @Value("${spring.mail.username:}") String fromEmail,
                            @Value("${app.activation.ttl:30m}") Duration activationTtl,
                            @Value("${app.mail.log-only:false}") boolean logOnly) {
        this.mailSender = mailSender;
        this.frontendUrl = frontendUrl;
        this.fromEmail = fromEmail;
        this.activationTtl = activationTtl;
        this.logOnly = logOnly;
    }

    @Override
    public void sendActivationEmail(String to, String activationSecret) {
        if (fromEmail == null || fromEmail.isEmpty()) {
            if (logOnly) {
                log.warn("app.mail.log-only is set, activation email to {} not sent. Activation code: {}",
                        to, activationSecret);
                return;
            }
            log.error("spring.mail.username is not configured, cannot send activation email to {}", to);
            throw new NotificationException("No mail sender configured");
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromEmail);
        message.setTo(to);
        message.setSubject("Activate your account");
        message.setText(String.format(
                "Hello,\n\n" +
                "Your activation code is: %s\n\n" +
                "Enter it at %s/register/complete to finish creating your account.\n\n" +
                "The code expires in %d minutes. If you did not sign up, you can ignore this email.\n",
                activationSecret,
                frontendUrl,
                activationTtl.toMinutes()
        ));

        try {
            mailSender.send(message);
        } catch (MailException e) {
            log.error("Failed to send activation email to {}", to, e);
            throw new NotificationException("Activation email could not be delivered", e);
        }
        log.info("Activation email sent to {}", to);
    }
}
