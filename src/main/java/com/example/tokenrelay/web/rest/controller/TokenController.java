package com.example.tokenrelay.web.rest.controller;

import com.example.tokenrelay.domain.entity.TokenOutcome;
import com.example.tokenrelay.properties.ApplicationProperties;
import com.example.tokenrelay.service.TokenResolver;
import com.example.tokenrelay.util.CookieUtil;
import com.example.tokenrelay.web.rest.dto.BlockedResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Token relay endpoint. Success bodies are the bare token text; rejections are JSON.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class TokenController implements TokenAPI {

  private final TokenResolver tokenResolver;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<?> getToken(String tokenType, HttpServletRequest request) {
    String sessionId = CookieUtil.getCookieValue(request, properties.session().cookieName())
        .orElse(null);

    TokenOutcome outcome = tokenResolver.resolve(sessionId, tokenType);

    if (outcome instanceof TokenOutcome.Success success) {
      log.debug("Returning {} for session {}", success.tokenType().parameterName(),
                CookieUtil.maskSessionId(sessionId));
      return ResponseEntity.ok()
          .contentType(MediaType.TEXT_PLAIN)
          .body(success.value());
    }

    TokenOutcome.Rejection rejection = (TokenOutcome.Rejection) outcome;
    log.debug("Blocking token request for session {}: {} ({})",
              CookieUtil.maskSessionId(sessionId), rejection.reason(), rejection.httpStatus());
    return ResponseEntity.status(rejection.httpStatus())
        .contentType(MediaType.APPLICATION_JSON)
        .body(BlockedResponse.of(rejection.reason()));
  }
}
