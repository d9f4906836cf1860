package com.example.tokenrelay.util;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.http.Cookie;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class CookieUtilTest {

  private static final Pattern FORMAT = Pattern.compile("^[A-Za-z0-9._-]{1,128}$");

  @Test
  void getCookieValue_presentCookie_isDecoded() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.setCookies(new Cookie("session_id", "abc%2D123"));

    assertThat(CookieUtil.getCookieValue(request, "session_id")).contains("abc-123");
  }

  @Test
  void getCookieValue_missingOrEmpty_isEmpty() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    assertThat(CookieUtil.getCookieValue(request, "session_id")).isEmpty();

    request.setCookies(new Cookie("session_id", ""));
    assertThat(CookieUtil.getCookieValue(request, "session_id")).isEmpty();
    assertThat(CookieUtil.getCookieValue(null, "session_id")).isEmpty();
  }

  @Test
  void isValidSessionId_checksFormat() {
    assertThat(CookieUtil.isValidSessionId("abc.DEF_123-x", FORMAT)).isTrue();
    assertThat(CookieUtil.isValidSessionId(null, FORMAT)).isFalse();
    assertThat(CookieUtil.isValidSessionId(" ", FORMAT)).isFalse();
    assertThat(CookieUtil.isValidSessionId("has space", FORMAT)).isFalse();
    assertThat(CookieUtil.isValidSessionId("x".repeat(129), FORMAT)).isFalse();
  }

  @Test
  void isValidSessionId_overByteLimit_rejectedEvenIfPatternAllows() {
    Pattern anything = Pattern.compile(".+");

    assertThat(CookieUtil.isValidSessionId("x".repeat(CookieUtil.MAX_SESSION_ID_BYTES), anything)).isTrue();
    assertThat(CookieUtil.isValidSessionId("x".repeat(CookieUtil.MAX_SESSION_ID_BYTES + 1), anything)).isFalse();
    // 43 three-byte characters is 129 bytes
    assertThat(CookieUtil.isValidSessionId("€".repeat(43), anything)).isFalse();
  }

  @Test
  void maskSessionId_hidesAllButPrefix() {
    assertThat(CookieUtil.maskSessionId(null)).isEqualTo("null");
    assertThat(CookieUtil.maskSessionId("short")).isEqualTo("***");
    assertThat(CookieUtil.maskSessionId("0123456789abcdef")).isEqualTo("01234567...");
  }
}
