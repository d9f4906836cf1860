package com.example.tokenrelay.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.WebUtils;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cookie and session id helpers for the inbound request.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final int MASK_PREFIX_LENGTH = 8;

  /**
   * Upper bound on a session id in UTF-8 bytes, whatever the configured pattern allows.
   */
  public static final int MAX_SESSION_ID_BYTES = 128;

  /**
   * Extract cookie by name using Spring's WebUtils
   *
   * @param request HTTP request
   * @param name cookie name
   * @return Optional containing the cookie if found
   */
  public static Optional<Cookie> getCookie(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }

    try {
      Cookie cookie = WebUtils.getCookie(request, name);
      return Optional.ofNullable(cookie);
    } catch (Exception e) {
      log.debug("Error retrieving cookie '{}': {}", name, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Get decoded cookie value safely
   *
   * @param request HTTP request
   * @param name cookie name
   * @return Optional containing the decoded, non-empty cookie value
   */
  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    return getCookie(request, name)
        .map(Cookie::getValue)
        .filter(value -> value != null && !value.isEmpty())
        .map(CookieUtil::decodeCookieValue);
  }

  /**
   * Validate session ID format
   *
   * @param sessionId the session ID to validate
   * @param format full-match pattern for well-formed ids
   * @return true if valid format
   */
  public static boolean isValidSessionId(String sessionId, Pattern format) {
    if (sessionId == null || sessionId.trim().isEmpty()) {
      return false;
    }
    if (sessionId.getBytes(StandardCharsets.UTF_8).length > MAX_SESSION_ID_BYTES) {
      return false;
    }
    return format.matcher(sessionId).matches();
  }

  /**
   * Loggable form of a session id: the first characters followed by "...".
   */
  public static String maskSessionId(String sessionId) {
    if (sessionId == null) {
      return "null";
    }
    if (sessionId.length() <= MASK_PREFIX_LENGTH) {
      return "***";
    }
    return sessionId.substring(0, MASK_PREFIX_LENGTH) + "...";
  }

  /**
   * Decode cookie value safely
   */
  private static String decodeCookieValue(String encodedValue) {
    try {
      return URLDecoder.decode(encodedValue, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      log.debug("Failed to decode cookie value: {}", e.getMessage());
      return encodedValue; // Return as-is if decoding fails
    }
  }
}
