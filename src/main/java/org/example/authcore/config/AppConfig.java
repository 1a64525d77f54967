package org.example.authcore.config;

import lombok.extern.slf4j.Slf4j;
import org.example.authcore.security.SigningKeys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // A failure here aborts startup.
    @Bean
    public SigningKeys signingKeys(@Value("${app.jwt.private-key:classpath:keys/private.pem}") String privateKey,
                                   @Value("${app.jwt.public-key:classpath:keys/public.pem}") String publicKey) {
        SigningKeys keys = SigningKeys.load(privateKey, publicKey);
        log.info("Loaded RSA signing keys from {} and {}", privateKey, publicKey);
        return keys;
    }
}
