package com.example.tokenrelay.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the token relay.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid AuthServerProperties authServer,
    @NotNull @Valid KeyProperties keys,
    @NotNull @Valid IdTokenProperties idToken,
    @NotNull @Valid SessionProperties session,
    @NotNull @Valid RelayProperties relay,
    @NotNull @Valid OkHttpProperties http,
    @NotNull @Valid CacheProperties cache
) {

  /**
   * Remote authentication server holding the session data
   */
  public record AuthServerProperties(
      @NotBlank String url,
      @DefaultValue("/session") @NotBlank String tokenPath
  ) {}

  /**
   * PEM key files, as Spring resource locations (file:, classpath:)
   */
  public record KeyProperties(
      @NotBlank String privateKeyPath,
      @NotBlank String authServerPublicKeyPath
  ) {}

  /**
   * Identity token verification
   */
  public record IdTokenProperties(
      @DefaultValue("https://www.googleapis.com/oauth2/v3/certs") @NotBlank String jwksUri,
      @DefaultValue({"https://accounts.google.com", "accounts.google.com"}) @NotEmpty List<String> issuers,
      String audience
  ) {}

  /**
   * Inbound session cookie handling
   */
  public record SessionProperties(
      @DefaultValue("session_id") @NotBlank String cookieName,
      @DefaultValue("^[A-Za-z0-9._-]{1,128}$") @NotBlank String idPattern
  ) {}

  /**
   * Outcome rendering
   */
  public record RelayProperties(
      @DefaultValue("200") @Min(100) @Max(599) int rejectedRequestStatus
  ) {}

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration writeTimeout
    ) {}
  }

  /**
   * Session cache sizing
   */
  public record CacheProperties(
      @NotNull @Valid SessionCacheProperties session
  ) {
    public record SessionCacheProperties(
        @DefaultValue("128") @Positive int maxSize
    ) {}
  }
}
