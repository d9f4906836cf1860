package com.example.tokenrelay.config;

import com.example.tokenrelay.properties.ApplicationProperties;
import java.util.ArrayList;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

/**
 * Decoder for the identity tokens handed out by the authentication server.
 */
@Configuration(proxyBeanMethods = false)
public class JwtDecoderConfig {

  @Bean
  public JwtDecoder idTokenDecoder(ApplicationProperties properties) {
    ApplicationProperties.IdTokenProperties idToken = properties.idToken();

    NimbusJwtDecoder decoder = NimbusJwtDecoder
        .withJwkSetUri(idToken.jwksUri())
        .jwsAlgorithm(SignatureAlgorithm.RS256)
        .build();

    // The timestamp validator reports "Jwt expired at ..." for stale tokens
    List<OAuth2TokenValidator<Jwt>> validators = new ArrayList<>();
    validators.add(new JwtTimestampValidator());

    List<String> issuers = idToken.issuers();
    validators.add(jwt -> {
      String iss = jwt.getClaimAsString("iss");
      return (iss != null && issuers.contains(iss))
          ? OAuth2TokenValidatorResult.success()
          : OAuth2TokenValidatorResult.failure(new OAuth2Error("invalid_token", "Invalid issuer", null));
    });

    String expectedAudience = idToken.audience();
    if (expectedAudience != null && !expectedAudience.isBlank()) {
      validators.add(jwt -> {
        List<String> aud = jwt.getAudience();
        return (aud != null && aud.contains(expectedAudience))
            ? OAuth2TokenValidatorResult.success()
            : OAuth2TokenValidatorResult.failure(new OAuth2Error("invalid_token", "Invalid audience", null));
      });
    }

    decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(validators));
    return decoder;
  }
}
