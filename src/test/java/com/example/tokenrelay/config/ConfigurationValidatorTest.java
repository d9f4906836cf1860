package com.example.tokenrelay.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.tokenrelay.properties.ApplicationProperties;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigurationValidatorTest {

  @Test
  void afterPropertiesSet_validConfiguration_passes() {
    ConfigurationValidator validator = new ConfigurationValidator(
        properties("https://auth.example.com", "^[A-Za-z0-9._-]{1,128}$", 100, 20));

    assertThatCode(validator::afterPropertiesSet).doesNotThrowAnyException();
  }

  @Test
  void afterPropertiesSet_plainHttpOnLocalhost_passes() {
    ConfigurationValidator validator = new ConfigurationValidator(
        properties("http://localhost:8081", "^[a-z]+$", 100, 20));

    assertThatCode(validator::afterPropertiesSet).doesNotThrowAnyException();
  }

  @Test
  void afterPropertiesSet_listsEveryViolation() {
    ConfigurationValidator validator = new ConfigurationValidator(
        properties("http://auth.example.com", "([unclosed", 10, 20));

    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("3 error(s)")
        .hasMessageContaining("must use HTTPS")
        .hasMessageContaining("Session id pattern does not compile")
        .hasMessageContaining("max requests per host");
  }

  @Test
  void afterPropertiesSet_malformedUrl_fails() {
    ConfigurationValidator validator = new ConfigurationValidator(
        properties("auth.example.com", "^[a-z]+$", 100, 20));

    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Auth server URL is invalid");
  }

  private static ApplicationProperties properties(String authServerUrl, String idPattern,
                                                  int maxRequests, int maxRequestsPerHost) {
    return new ApplicationProperties(
        new ApplicationProperties.AuthServerProperties(authServerUrl, "/session"),
        new ApplicationProperties.KeyProperties("classpath:keys/relay.pem", "classpath:keys/server.pem"),
        new ApplicationProperties.IdTokenProperties(
            "https://www.googleapis.com/oauth2/v3/certs",
            List.of("https://accounts.google.com", "accounts.google.com"),
            null),
        new ApplicationProperties.SessionProperties("session_id", idPattern),
        new ApplicationProperties.RelayProperties(200),
        new ApplicationProperties.OkHttpProperties(new ApplicationProperties.OkHttpProperties.ClientProperties(
            20, 5, maxRequests, maxRequestsPerHost,
            Duration.ofSeconds(3), Duration.ofSeconds(5), Duration.ofSeconds(5))),
        new ApplicationProperties.CacheProperties(
            new ApplicationProperties.CacheProperties.SessionCacheProperties(128)));
  }
}
