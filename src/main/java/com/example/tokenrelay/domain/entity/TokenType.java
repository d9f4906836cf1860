package com.example.tokenrelay.domain.entity;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fields a caller may ask the relay for, named as in the {@code token_type} request parameter.
 */
public enum TokenType {
  ACCESS_TOKEN(AuthData.ACCESS_TOKEN),
  ID_TOKEN(AuthData.ID_TOKEN),
  EMAIL(AuthData.EMAIL);

  public static final TokenType DEFAULT = ID_TOKEN;

  /**
   * Allowed parameter values rendered as a JSON array, e.g. {@code ["access_token","id_token","email"]}.
   */
  public static final String ALLOWED_VALUES = Arrays.stream(values())
      .map(type -> "\"" + type.parameterName + "\"")
      .collect(Collectors.joining(",", "[", "]"));

  private final String parameterName;

  TokenType(String parameterName) {
    this.parameterName = parameterName;
  }

  public String parameterName() {
    return parameterName;
  }

  /**
   * Exact, case-sensitive match on the parameter name.
   */
  public static Optional<TokenType> fromParameter(String value) {
    return Arrays.stream(values())
        .filter(type -> type.parameterName.equals(value))
        .findFirst();
  }
}
