package com.example.tokenrelay.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.example.tokenrelay.exception.TokenVerificationException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidationException;

@ExtendWith(MockitoExtension.class)
class JwtIdTokenVerifierTest {

  @Mock
  private JwtDecoder idTokenDecoder;

  @InjectMocks
  private JwtIdTokenVerifier verifier;

  @Test
  void verify_validToken_returnsClaims() {
    Jwt jwt = Jwt.withTokenValue("id.token.value")
        .header("alg", "RS256")
        .claim("email", "user@example.com")
        .claim("email_verified", true)
        .issuedAt(Instant.now().minusSeconds(60))
        .expiresAt(Instant.now().plusSeconds(3600))
        .build();
    when(idTokenDecoder.decode("id.token.value")).thenReturn(jwt);

    Map<String, Object> claims = verifier.verify("id.token.value");

    assertThat(claims)
        .containsEntry("email", "user@example.com")
        .containsEntry("email_verified", true);
  }

  @Test
  void verify_expiredToken_keepsExpiryInMessage() {
    when(idTokenDecoder.decode("stale"))
        .thenThrow(new JwtValidationException("Jwt expired at 2024-01-01T00:00:00Z",
            List.of(new OAuth2Error("invalid_token", "Jwt expired at 2024-01-01T00:00:00Z", null))));

    assertThatThrownBy(() -> verifier.verify("stale"))
        .isInstanceOf(TokenVerificationException.class)
        .hasMessageContaining("expired")
        .hasCauseInstanceOf(JwtValidationException.class);
  }

  @Test
  void verify_malformedToken_throws() {
    when(idTokenDecoder.decode("garbage")).thenThrow(new BadJwtException("Malformed token"));

    assertThatThrownBy(() -> verifier.verify("garbage"))
        .isInstanceOf(TokenVerificationException.class)
        .hasMessage("Malformed token");
  }
}
