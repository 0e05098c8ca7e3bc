package com.example.storefront.domain.entity;

import java.util.List;

/**
 * One concrete reauthentication attempt. Ephemeral: built and discarded within a single call.
 *
 * @param ordinal           Position in the attempt matrix, starting at 1
 * @param source            Credential bundle the cookie jar is seeded from
 * @param agentChoice       Whether the stored or the default user agent is sent
 * @param userAgentOverride The stored agent to send, or {@code null} to send the configured default
 * @param cookieScope       Which of the bundle's cookies are seeded
 * @param authVariants      Variants tried in order within this attempt
 */
public record AttemptSpec(
    int ordinal,
    CredentialBundle source,
    UserAgentChoice agentChoice,
    String userAgentOverride,
    CookieScope cookieScope,
    List<AuthVariant> authVariants
) {

  public String label() {
    return source.source() + " + " + agentChoice + "-UA + " + cookieScope;
  }

  @Override
  public String toString() {
    return "#" + ordinal + " " + label();
  }
}
