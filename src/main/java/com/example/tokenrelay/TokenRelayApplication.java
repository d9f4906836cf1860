package com.example.tokenrelay;

import com.example.tokenrelay.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Token Relay Application
 *
 * Exchanges a browser session cookie for tokens held by a remote authentication server:
 * - hybrid AES + RSA-OAEP encrypted exchange with the server
 * - bounded LRU cache of session lookups
 * - identity token verification before any token is released
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class TokenRelayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(TokenRelayApplication.class);

    app.setLazyInitialization(false);
    app.setRegisterShutdownHook(true);

    app.run(args);
  }
}
