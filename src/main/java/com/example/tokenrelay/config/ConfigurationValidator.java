package com.example.tokenrelay.config;

import com.example.tokenrelay.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration validator that enforces rules beyond basic JSR-303 validation.
 * Fails startup with every violation listed at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_INVALID_URI = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_MUST_BE_POSITIVE = "%s must be positive.";
  private static final String PROTOCOL_HTTP = "http://";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final String PATH_PREFIX_SLASH = "/";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration rules...");
    List<String> errors = new ArrayList<>();

    validateAuthServerConfig(errors);
    validateIdTokenConfig(errors);
    validateSessionConfig(errors);
    validateHttpConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateAuthServerConfig(List<String> errors) {
    String url = properties.authServer().url();
    if (!isValidUrl(url)) {
      errors.add(ERROR_INVALID_URL.formatted("Auth server URL", url));
    }
    validateHttpsRequired(url, "Auth server URL", errors);

    if (!properties.authServer().tokenPath().startsWith(PATH_PREFIX_SLASH)) {
      errors.add("Auth server token path must start with a '/': " + properties.authServer().tokenPath());
    }
  }

  private void validateIdTokenConfig(List<String> errors) {
    String jwksUri = properties.idToken().jwksUri();
    validateUri(jwksUri, "JWKS URI", errors);
    validateHttpsRequired(jwksUri, "JWKS URI", errors);
  }

  private void validateSessionConfig(List<String> errors) {
    try {
      Pattern.compile(properties.session().idPattern());
    } catch (PatternSyntaxException e) {
      errors.add("Session id pattern does not compile: " + properties.session().idPattern());
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
    validatePositive(client.connectTimeout(), "Connect timeout", errors);
    validatePositive(client.readTimeout(), "Read timeout", errors);
    validatePositive(client.writeTimeout(), "Write timeout", errors);
  }

  private void validatePositive(Duration duration, String fieldName, List<String> errors) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted(fieldName));
    }
  }

  private boolean isValidUrl(String url) {
    try {
      new URL(url);
      return true;
    } catch (MalformedURLException e) {
      return false;
    }
  }

  private void validateUri(String uri, String fieldName, List<String> errors) {
    try {
      new URI(uri);
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URI.formatted(fieldName, uri));
    }
  }

  private void validateHttpsRequired(String uri, String fieldName, List<String> errors) {
    if (uri != null && uri.startsWith(PROTOCOL_HTTP)
        && !uri.contains(HOST_LOCALHOST) && !uri.contains(HOST_LOOPBACK)) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, uri));
    }
  }
}
