package com.example.storefront.domain.entity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The two authorization parameter sets the provider accepts for cookie reauthentication.
 * They differ only in the requested {@code scope}.
 */
public enum AuthVariant {
  SCOPE_A("account openid"),
  SCOPE_B("openid link");

  public static final String CLIENT_ID = "play-valorant-web-prod";
  public static final String NONCE = "1";
  public static final String REDIRECT_URI = "https://playvalorant.com/opt_in";
  public static final String RESPONSE_TYPE = "token id_token";
  public static final String PROMPT = "none";

  private final String scope;

  AuthVariant(String scope) {
    this.scope = scope;
  }

  public String scope() {
    return scope;
  }

  /**
   * Parameters in the order the web client sends them.
   */
  public Map<String, String> parameters() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("client_id", CLIENT_ID);
    params.put("nonce", NONCE);
    params.put("redirect_uri", REDIRECT_URI);
    params.put("response_type", RESPONSE_TYPE);
    params.put("scope", scope);
    params.put("prompt", PROMPT);
    return params;
  }
}
