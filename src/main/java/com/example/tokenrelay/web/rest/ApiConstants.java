package com.example.tokenrelay.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String TOKEN_BASE = "/token";
    public static final String HEALTH_BASE = "/health";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  public static final class ApiParam {
    public static final String TOKEN_TYPE = "token_type";
    public static final String DEFAULT_TOKEN_TYPE = "id_token";

    private ApiParam() {}
  }

  private ApiConstants() {}
}
