package com.example.tokenrelay.service;

import com.example.tokenrelay.cache.BoundedLruCache;
import com.example.tokenrelay.domain.entity.AuthData;
import com.example.tokenrelay.domain.entity.AuthLookup;
import com.example.tokenrelay.domain.entity.RejectionReason;
import com.example.tokenrelay.domain.entity.TokenOutcome;
import com.example.tokenrelay.domain.entity.TokenType;
import com.example.tokenrelay.properties.ApplicationProperties;
import com.example.tokenrelay.security.IdTokenVerifier;
import com.example.tokenrelay.util.CookieUtil;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns a session id and a requested token type into exactly one {@link TokenOutcome}.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>malformed or missing session id → 200 BAD_SESSION_ID</li>
 *   <li>session unknown to the authentication server → REJECTED_REQUEST (status configurable)</li>
 *   <li>any other lookup failure → 500 UNKNOWN</li>
 *   <li>expired identity token → 200 TOKEN_EXPIRED; other verification failures → 500 UNKNOWN</li>
 *   <li>email not verified → 500 BAD_EMAIL</li>
 *   <li>unsupported token type → 500 with a message naming the allowed values</li>
 *   <li>otherwise the requested field</li>
 * </ol>
 */
@Slf4j
@Service
public class TokenResolver {

  static final String EMAIL_VERIFIED_CLAIM = "email_verified";

  private static final int STATUS_OK = 200;
  private static final int STATUS_INTERNAL_ERROR = 500;

  private final BoundedLruCache<String, AuthLookup> sessionCache;
  private final IdTokenVerifier idTokenVerifier;
  private final Pattern sessionIdFormat;
  private final int rejectedRequestStatus;

  @Autowired
  public TokenResolver(BoundedLruCache<String, AuthLookup> sessionCache,
                       IdTokenVerifier idTokenVerifier,
                       ApplicationProperties properties) {
    this(sessionCache, idTokenVerifier, Pattern.compile(properties.session().idPattern()),
         properties.relay().rejectedRequestStatus());
  }

  public TokenResolver(BoundedLruCache<String, AuthLookup> sessionCache,
                       IdTokenVerifier idTokenVerifier,
                       Pattern sessionIdFormat,
                       int rejectedRequestStatus) {
    this.sessionCache = sessionCache;
    this.idTokenVerifier = idTokenVerifier;
    this.sessionIdFormat = sessionIdFormat;
    this.rejectedRequestStatus = rejectedRequestStatus;
  }

  /**
   * @param sessionId value of the session cookie, may be null
   * @param requestedTokenType {@code token_type} parameter; null or blank means {@code id_token}
   */
  public TokenOutcome resolve(String sessionId, String requestedTokenType) {
    if (!CookieUtil.isValidSessionId(sessionId, sessionIdFormat)) {
      log.debug("Rejecting request with missing or malformed session id");
      return TokenOutcome.rejection(STATUS_OK, RejectionReason.BAD_SESSION_ID);
    }

    AuthLookup lookup;
    try {
      lookup = sessionCache.get(sessionId);
    } catch (RuntimeException e) {
      log.error("Session lookup failed for session {}", CookieUtil.maskSessionId(sessionId), e);
      return TokenOutcome.rejection(STATUS_INTERNAL_ERROR, RejectionReason.UNKNOWN);
    }

    if (lookup instanceof AuthLookup.Rejected) {
      log.debug("Session {} is not recognized by the authentication server",
                CookieUtil.maskSessionId(sessionId));
      return TokenOutcome.rejection(rejectedRequestStatus, RejectionReason.REJECTED_REQUEST);
    }
    AuthData authData = ((AuthLookup.Found) lookup).authData();

    Optional<TokenOutcome> claimFailure = checkClaims(sessionId, authData);
    if (claimFailure.isPresent()) {
      return claimFailure.get();
    }

    String typeName = requestedTokenType == null || requestedTokenType.isBlank()
        ? TokenType.DEFAULT.parameterName()
        : requestedTokenType;
    Optional<TokenType> tokenType = TokenType.fromParameter(typeName);
    if (tokenType.isEmpty()) {
      log.warn("Unsupported token_type requested: {}", typeName);
      return TokenOutcome.unsupportedTokenType(typeName);
    }

    TokenType selected = tokenType.get();
    return authData.field(selected.parameterName())
        .map(value -> TokenOutcome.success(selected, value))
        .orElseGet(() -> {
          log.warn("Session data for {} has no {} field", CookieUtil.maskSessionId(sessionId),
                   selected.parameterName());
          return TokenOutcome.rejection(STATUS_INTERNAL_ERROR, RejectionReason.UNKNOWN);
        });
  }

  private Optional<TokenOutcome> checkClaims(String sessionId, AuthData authData) {
    Optional<String> idToken = authData.idToken();
    if (idToken.isEmpty()) {
      log.warn("Session data for {} has no id_token", CookieUtil.maskSessionId(sessionId));
      return Optional.of(TokenOutcome.rejection(STATUS_INTERNAL_ERROR, RejectionReason.UNKNOWN));
    }

    Map<String, Object> claims;
    try {
      claims = idTokenVerifier.verify(idToken.get());
    } catch (RuntimeException e) {
      if (isExpiry(e)) {
        log.info("ID token for session {} has expired", CookieUtil.maskSessionId(sessionId));
        return Optional.of(TokenOutcome.rejection(STATUS_OK, RejectionReason.TOKEN_EXPIRED));
      }
      log.warn("ID token verification failed for session {}: {}",
               CookieUtil.maskSessionId(sessionId), e.getMessage());
      return Optional.of(TokenOutcome.rejection(STATUS_INTERNAL_ERROR, RejectionReason.UNKNOWN));
    }

    if (!isEmailVerified(claims == null ? null : claims.get(EMAIL_VERIFIED_CLAIM))) {
      log.warn("Email not verified for session {}", CookieUtil.maskSessionId(sessionId));
      return Optional.of(TokenOutcome.rejection(STATUS_INTERNAL_ERROR, RejectionReason.BAD_EMAIL));
    }
    return Optional.empty();
  }

  private static boolean isExpiry(RuntimeException e) {
    String message = e.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains("expired");
  }

  // Absent counts as unverified; some issuers send the claim as a string.
  private static boolean isEmailVerified(Object claim) {
    if (claim instanceof Boolean verified) {
      return verified;
    }
    return claim instanceof String text && Boolean.parseBoolean(text);
  }
}
