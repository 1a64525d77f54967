package org.example.authcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuthCoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(AuthCoreApplication.class, args);
    }
}
