package com.example.storefront.domain.entity;

import java.util.List;

/**
 * Result of executing one {@link AttemptSpec}: either tokens, or the evidence of why not.
 */
public record AttemptOutcome(AttemptSpec attempt, List<AuthorizationProbe> probes) {

  public boolean succeeded() {
    return probes.stream().anyMatch(AuthorizationProbe::succeeded);
  }

  public boolean challenged() {
    return probes.stream().anyMatch(AuthorizationProbe::challenged);
  }

  public AuthTokens tokens() {
    return probes.stream()
        .filter(AuthorizationProbe::succeeded)
        .map(AuthorizationProbe::tokens)
        .findFirst()
        .orElse(null);
  }

  public AuthVariant winningVariant() {
    return probes.stream()
        .filter(AuthorizationProbe::succeeded)
        .map(AuthorizationProbe::variant)
        .findFirst()
        .orElse(null);
  }
}
