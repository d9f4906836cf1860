package com.example.tokenrelay.security;

import java.util.Map;

/**
 * Verifies an identity token and exposes its claims.
 */
@FunctionalInterface
public interface IdTokenVerifier {

  /**
   * @return the verified claims, including {@code email_verified}
   * @throws com.example.tokenrelay.exception.TokenVerificationException if the token is expired,
   *     badly signed, issued by an unexpected party, or otherwise invalid. An expiry failure
   *     carries "expired" in its message.
   */
  Map<String, Object> verify(String idToken);
}
