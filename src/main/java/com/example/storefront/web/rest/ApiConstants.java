package com.example.storefront.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String STORE_BASE = "/api/v1/store";
    public static final String HEALTH_BASE = "/health";

    // Store paths
    public static final String USER_ID = "/{userId}";
    public static final String DIAGNOSTICS = "/{userId}/diagnostics";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
