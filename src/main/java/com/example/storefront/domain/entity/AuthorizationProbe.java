package com.example.storefront.domain.entity;

/**
 * What one auth variant observed: the legacy POST status, the authorize GET status
 * ({@link #NOT_SENT} when the POST already produced tokens) and whether a bot challenge answered.
 */
public record AuthorizationProbe(
    AuthVariant variant,
    int legacyStatus,
    int authorizeStatus,
    boolean challenged,
    AuthTokens tokens
) {

  public static final int NOT_SENT = -1;

  public boolean succeeded() {
    return tokens != null;
  }
}
