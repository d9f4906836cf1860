package com.example.tokenrelay.security;

import com.example.tokenrelay.exception.TokenVerificationException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * {@link IdTokenVerifier} backed by the application's {@link JwtDecoder}, which checks signature,
 * timestamps, issuer and audience.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtIdTokenVerifier implements IdTokenVerifier {

  private final JwtDecoder idTokenDecoder;

  @Override
  public Map<String, Object> verify(String idToken) {
    try {
      Jwt jwt = idTokenDecoder.decode(idToken);
      return jwt.getClaims();
    } catch (JwtException e) {
      log.debug("ID token verification failed: {}", e.getMessage());
      throw new TokenVerificationException(e.getMessage(), e);
    }
  }
}
