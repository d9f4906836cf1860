package com.example.tokenrelay.domain.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decrypted session data returned by the authentication server.
 * Holds at least {@code id_token}, {@code access_token} and {@code email}; extra fields are kept
 * as received.
 */
public record AuthData(Map<String, Object> fields) {

  public static final String ID_TOKEN = "id_token";
  public static final String ACCESS_TOKEN = "access_token";
  public static final String EMAIL = "email";

  public AuthData {
    fields = fields == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * String value of a field, empty when the field is absent or JSON null.
   */
  public Optional<String> field(String name) {
    return Optional.ofNullable(fields.get(name)).map(String::valueOf);
  }

  public Optional<String> idToken() {
    return field(ID_TOKEN);
  }

  @Override
  public String toString() {
    // Token values stay out of logs.
    return "AuthData" + fields.keySet();
  }
}
