package com.example.storefront.service;

import com.example.storefront.domain.entity.AttemptSpec;
import com.example.storefront.domain.entity.AuthVariant;
import com.example.storefront.domain.entity.CookieScope;
import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.ResolvedCredentials;
import com.example.storefront.domain.entity.UserAgentChoice;
import com.example.storefront.exception.InvalidCredentialsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Builds the ordered reauthentication attempt matrix:
 * source (primary, legacy) x user agent (stored, default) x cookie scope (full, ssid only).
 * Each attempt tries both auth variants. The order is a pure function of the available bundles.
 * A bundle holding nothing but the ssid gets no full-scope attempts, since both jars would be identical.
 */
@Slf4j
@Component
public class AttemptPlanner {

  static final List<AuthVariant> AUTH_VARIANTS = List.of(AuthVariant.SCOPE_A, AuthVariant.SCOPE_B);
  private static final List<CookieScope> COOKIE_SCOPES = List.of(CookieScope.FULL, CookieScope.SSID_ONLY);

  /**
   * @throws InvalidCredentialsException if no available bundle has an ssid
   */
  public List<AttemptSpec> plan(ResolvedCredentials credentials) {
    List<CredentialBundle> sources = Stream.of(credentials.primary(), credentials.legacy())
        .filter(Objects::nonNull)
        .filter(bundle -> {
          if (!bundle.hasSsid()) {
            log.warn("{} credentials for user {} have no ssid; source skipped", bundle.source(), credentials.userId());
            return false;
          }
          return true;
        })
        .toList();
    if (sources.isEmpty()) {
      throw new InvalidCredentialsException("Stored credentials for user " + credentials.userId() + " have no ssid");
    }

    String storedUserAgent = credentials.storedUserAgent();
    List<AttemptSpec> attempts = new ArrayList<>();
    for (CredentialBundle source : sources) {
      if (storedUserAgent != null) {
        addScopes(attempts, source, UserAgentChoice.STORED, storedUserAgent);
      }
      addScopes(attempts, source, UserAgentChoice.DEFAULT, null);
    }
    return List.copyOf(attempts);
  }

  private static void addScopes(List<AttemptSpec> attempts, CredentialBundle source,
                                UserAgentChoice agentChoice, String userAgentOverride) {
    for (CookieScope scope : COOKIE_SCOPES) {
      if (scope == CookieScope.FULL && !source.hasSecondaryCookies()) {
        continue;
      }
      attempts.add(new AttemptSpec(attempts.size() + 1, source, agentChoice, userAgentOverride, scope, AUTH_VARIANTS));
    }
  }
}
