package com.example.storefront.service;

import com.example.storefront.adapter.riot.session.SessionContext;
import com.example.storefront.adapter.riot.session.SessionContextFactory;
import com.example.storefront.domain.entity.AttemptOutcome;
import com.example.storefront.domain.entity.AttemptSpec;
import com.example.storefront.domain.entity.AuthVariant;
import com.example.storefront.domain.entity.AuthorizationProbe;
import com.example.storefront.domain.entity.CookieScope;
import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.CredentialSourceType;
import com.example.storefront.domain.entity.ResolvedCredentials;
import com.example.storefront.domain.entity.TokenSet;
import com.example.storefront.domain.entity.UserAgentChoice;
import com.example.storefront.exception.CredentialsNotFoundException;
import com.example.storefront.exception.InvalidCredentialsException;
import com.example.storefront.exception.StorefrontException;
import com.example.storefront.properties.ApplicationProperties;
import com.example.storefront.util.MaskingUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Operator troubleshooting report. Runs the whole attempt matrix without stopping at the first
 * success, probes shards with the first working session and prints every credential masked.
 * Never writes to either credential store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticReporter {

  static final String OK = "OK";
  static final String CHALLENGE = "CHALLENGE";
  static final String FAIL = "FAIL";

  static final String HINT_NETWORK =
      "All attempts were challenged by bot protection. Change the egress network path (different IP or host).";
  static final String HINT_EXPIRED =
      "No attempt succeeded. The ssid has likely expired; log in again and re-capture the cookies.";
  static final String HINT_STALE_SECONDARY =
      "Only ssid-only attempts succeed. The secondary cookies (clid/sub/csid/tdid) are stale; store the ssid alone.";
  static final String HINT_STORED_AGENT =
      "Only attempts with the stored user agent succeed. Always send the capturing browser's user agent.";
  static final String HINT_KEY_MISSING =
      "No credential encryption key is configured. Set a fixed app.credentials.primary.encryption-key.";

  private final CredentialResolver credentialResolver;
  private final ReauthenticationEngine reauthenticationEngine;
  private final SessionContextFactory sessionContextFactory;
  private final TokenPipeline tokenPipeline;
  private final StorefrontFetcher storefrontFetcher;
  private final EncryptionService encryptionService;
  private final ApplicationProperties properties;

  public String runDiagnostics(String userId) {
    List<String> lines = new ArrayList<>();
    lines.add("Reauthentication diagnostics for user " + userId);

    boolean keyMissing = credentialResolver.isEnabled(CredentialSourceType.PRIMARY) && !encryptionService.isConfigured();
    if (keyMissing) {
      lines.add("WARNING: credential encryption key is not configured");
    }

    ResolvedCredentials credentials;
    try {
      credentials = credentialResolver.resolve(userId);
    } catch (CredentialsNotFoundException e) {
      lines.add("No credentials on record for this user.");
      appendHints(lines, List.of(), keyMissing);
      return render(lines);
    }
    lines.add(describe("primary", credentials.primary()));
    lines.add(describe("legacy ", credentials.legacy()));

    List<AttemptSpec> attempts;
    try {
      attempts = reauthenticationEngine.planAttempts(credentials);
    } catch (InvalidCredentialsException e) {
      lines.add("No credentials with an ssid; nothing to attempt. " + e.getHint());
      appendHints(lines, List.of(), keyMissing);
      return render(lines);
    }

    lines.add("");
    lines.add("Attempts:");
    List<AttemptOutcome> outcomes = new ArrayList<>();
    List<String> probeLines = List.of();
    for (AttemptSpec attempt : attempts) {
      try (SessionContext session = sessionContextFactory.open(attempt)) {
        AttemptOutcome outcome = reauthenticationEngine.tryAttempt(attempt, session);
        outcomes.add(outcome);
        lines.add("  " + describe(outcome));
        if (outcome.succeeded() && probeLines.isEmpty()) {
          probeLines = probeShards(new AuthenticatedSession(attempt, outcome.winningVariant(), session,
                                                            outcome.tokens()));
        }
      }
    }

    if (!probeLines.isEmpty()) {
      lines.add("");
      lines.addAll(probeLines);
    }
    appendHints(lines, outcomes, keyMissing);
    log.info("Diagnostics for user {} ran {} attempts, {} succeeded", userId, outcomes.size(),
             outcomes.stream().filter(AttemptOutcome::succeeded).count());
    return render(lines);
  }

  private List<String> probeShards(AuthenticatedSession authenticated) {
    List<String> lines = new ArrayList<>();
    lines.add("Shard probe (session from attempt " + authenticated.attempt() + "):");
    final TokenSet tokens;
    final String clientVersion;
    try {
      tokens = tokenPipeline.complete(authenticated);
      clientVersion = tokenPipeline.clientVersion();
    } catch (StorefrontException e) {
      lines.add("  token pipeline failed: " + e.getMessage());
      return lines;
    }

    lines.add("  discovered shard: " + tokens.shard());
    for (String shard : properties.riot().knownShards()) {
      lines.add("  storefront v2 on " + shard + ": " + probe(() -> storefrontFetcher.probeShard(
          authenticated.session(), tokens, shard, clientVersion)));
    }
    lines.add("  wallet on " + tokens.shard() + ": " + probe(() -> storefrontFetcher.probeWallet(
        authenticated.session(), tokens, clientVersion)));
    return lines;
  }

  private static String probe(StatusProbe probe) {
    try {
      return String.valueOf(probe.status());
    } catch (StorefrontException e) {
      return "error (" + e.getMessage() + ")";
    }
  }

  private static void appendHints(List<String> lines, List<AttemptOutcome> outcomes, boolean keyMissing) {
    List<String> hints = new ArrayList<>();
    List<AttemptOutcome> successes = outcomes.stream().filter(AttemptOutcome::succeeded).toList();

    if (!outcomes.isEmpty()) {
      if (outcomes.stream().allMatch(AttemptOutcome::challenged) && successes.isEmpty()) {
        hints.add(HINT_NETWORK);
      } else if (successes.isEmpty()) {
        hints.add(HINT_EXPIRED);
      }
      boolean ssidOnlyWorks = successes.stream().anyMatch(o -> o.attempt().cookieScope() == CookieScope.SSID_ONLY);
      boolean fullTried = outcomes.stream().anyMatch(o -> o.attempt().cookieScope() == CookieScope.FULL);
      boolean fullWorks = successes.stream().anyMatch(o -> o.attempt().cookieScope() == CookieScope.FULL);
      if (ssidOnlyWorks && fullTried && !fullWorks) {
        hints.add(HINT_STALE_SECONDARY);
      }
      boolean defaultAgentTried = outcomes.stream()
          .anyMatch(o -> o.attempt().agentChoice() == UserAgentChoice.DEFAULT);
      if (!successes.isEmpty() && defaultAgentTried
          && successes.stream().allMatch(o -> o.attempt().agentChoice() == UserAgentChoice.STORED)) {
        hints.add(HINT_STORED_AGENT);
      }
    }
    if (keyMissing) {
      hints.add(HINT_KEY_MISSING);
    }

    if (!hints.isEmpty()) {
      lines.add("");
      lines.add("Hints:");
      hints.forEach(hint -> lines.add("  - " + hint));
    }
  }

  private static String describe(String label, CredentialBundle bundle) {
    if (bundle == null) {
      return label + ": none";
    }
    return label + ": ssid=" + MaskingUtils.mask(bundle.ssid())
        + " cookies=" + bundle.cookies(CookieScope.FULL).keySet()
        + " userAgent=" + MaskingUtils.mask(bundle.userAgent());
  }

  private static String describe(AttemptOutcome outcome) {
    AttemptSpec attempt = outcome.attempt();
    StringJoiner post = new StringJoiner("/");
    StringJoiner get = new StringJoiner("/");
    for (AuthVariant variant : attempt.authVariants()) {
      AuthorizationProbe probe = outcome.probes().stream()
          .filter(p -> p.variant() == variant)
          .findFirst()
          .orElse(null);
      post.add(probe == null ? "-" : status(probe.legacyStatus()));
      get.add(probe == null ? "-" : status(probe.authorizeStatus()));
    }
    String result = outcome.succeeded() ? OK : outcome.challenged() ? CHALLENGE : FAIL;
    return String.format("%s | ua=%s | ssid=%s | POST=%s GET=%s | %s",
                         attempt, attempt.agentChoice(), MaskingUtils.mask(attempt.source().ssid()),
                         post, get, result);
  }

  private static String status(int status) {
    return status == AuthorizationProbe.NOT_SENT ? "-" : String.valueOf(status);
  }

  private static String render(List<String> lines) {
    return String.join("\n", lines) + "\n";
  }

  @FunctionalInterface
  private interface StatusProbe {
    int status();
  }
}
