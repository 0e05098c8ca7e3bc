package com.example.storefront.domain.entity;

/**
 * The bundles available for one user. Either side may be {@code null}, never both.
 */
public record ResolvedCredentials(
    String userId,
    CredentialBundle primary,
    CredentialBundle legacy
) {

  public boolean hasPrimary() {
    return primary != null;
  }

  public boolean hasLegacy() {
    return legacy != null;
  }

  /**
   * The stored user agent, which only the primary store records.
   */
  public String storedUserAgent() {
    return primary != null && primary.hasUserAgent() ? primary.userAgent() : null;
  }
}
