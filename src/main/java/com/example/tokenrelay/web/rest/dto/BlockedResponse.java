package com.example.tokenrelay.web.rest.dto;

/**
 * Body of every rejected token request: {@code {"status":"BLOCKED","reason":...}}.
 */
public record BlockedResponse(
    String status,
    String reason
) {

  public static final String BLOCKED = "BLOCKED";

  public static BlockedResponse of(String reason) {
    return new BlockedResponse(BLOCKED, reason);
  }
}
