package com.example.storefront.service;

import com.example.storefront.adapter.riot.RiotAuthClient;
import com.example.storefront.adapter.riot.session.SessionContext;
import com.example.storefront.adapter.riot.session.SessionContextFactory;
import com.example.storefront.domain.entity.AttemptOutcome;
import com.example.storefront.domain.entity.AttemptSpec;
import com.example.storefront.domain.entity.AuthVariant;
import com.example.storefront.domain.entity.AuthorizationProbe;
import com.example.storefront.domain.entity.ResolvedCredentials;
import com.example.storefront.exception.ChallengeBlockedException;
import com.example.storefront.exception.CredentialsExpiredException;
import com.example.storefront.exception.CredentialsNotFoundException;
import com.example.storefront.exception.InvalidCredentialsException;
import com.example.storefront.exception.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

/**
 * Turns stored credentials into a working provider session.
 *
 * <p>Attempts from {@link AttemptPlanner} run strictly in order, each on its own {@link SessionContext}.
 * The first attempt whose reauthentication yields tokens is handed to the caller's continuation on
 * that same session. If the continuation fails with an {@link UpstreamException} the engine moves
 * on to the next attempt. When nothing succeeds the failure is classified:
 * <ul>
 *   <li>{@link ChallengeBlockedException} if any response carried a bot-challenge signature</li>
 *   <li>the last {@link UpstreamException} if some attempt got past reauthentication</li>
 *   <li>{@link CredentialsExpiredException} otherwise</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReauthenticationEngine {

  private final CredentialResolver credentialResolver;
  private final AttemptPlanner attemptPlanner;
  private final SessionContextFactory sessionContextFactory;
  private final RiotAuthClient riotAuthClient;

  /**
   * @param continuation work to run on the winning session, such as the token pipeline and storefront fetch
   * @throws CredentialsNotFoundException if the user has no credentials in any source
   * @throws InvalidCredentialsException  if no credentials carry an ssid; no request is sent
   * @throws CancellationException        if the calling thread is interrupted between attempts
   */
  public <T> T authenticate(String userId, Function<AuthenticatedSession, T> continuation) {
    List<AttemptSpec> attempts = planAttempts(credentialResolver.resolve(userId));
    log.info("Reauthenticating user {} with {} attempts", userId, attempts.size());

    boolean challenged = false;
    UpstreamException lastUpstream = null;

    for (AttemptSpec attempt : attempts) {
      checkCancelled(attempt);
      try (SessionContext session = sessionContextFactory.open(attempt)) {
        AttemptOutcome outcome = tryAttempt(attempt, session);
        challenged |= outcome.challenged();
        if (!outcome.succeeded()) {
          continue;
        }

        log.info("Attempt {} reauthenticated user {} with {}", attempt, userId, outcome.winningVariant());
        try {
          return continuation.apply(
              new AuthenticatedSession(attempt, outcome.winningVariant(), session, outcome.tokens()));
        } catch (UpstreamException e) {
          lastUpstream = e;
          log.warn("Attempt {} failed after reauthentication (status {}): {}", attempt, e.getStatus(),
                   e.getMessage());
        }
      }
    }

    if (challenged) {
      log.warn("All {} attempts failed for user {}; at least one was challenged", attempts.size(), userId);
      throw new ChallengeBlockedException("Reauthentication was blocked by a bot challenge");
    }
    if (lastUpstream != null) {
      log.warn("All {} attempts failed for user {}; last failure was upstream", attempts.size(), userId);
      throw lastUpstream;
    }
    log.warn("All {} attempts failed for user {}; credentials look expired", attempts.size(), userId);
    throw new CredentialsExpiredException("Every reauthentication attempt was rejected");
  }

  public List<AttemptSpec> planAttempts(ResolvedCredentials credentials) {
    return attemptPlanner.plan(credentials);
  }

  /**
   * Runs each auth variant of the attempt in order, stopping at the first that yields tokens.
   */
  public AttemptOutcome tryAttempt(AttemptSpec attempt, SessionContext session) {
    List<AuthorizationProbe> probes = new ArrayList<>();
    for (AuthVariant variant : attempt.authVariants()) {
      AuthorizationProbe probe = riotAuthClient.probe(session, variant);
      probes.add(probe);
      if (probe.succeeded()) {
        break;
      }
    }
    return new AttemptOutcome(attempt, List.copyOf(probes));
  }

  private static void checkCancelled(AttemptSpec next) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Reauthentication cancelled before attempt " + next);
    }
  }
}
