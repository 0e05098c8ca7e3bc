package com.example.storefront.service;

import com.example.storefront.adapter.riot.RiotAuthClient;
import com.example.storefront.adapter.riot.session.SessionContext;
import com.example.storefront.adapter.valorantapi.ValorantApiClient;
import com.example.storefront.domain.entity.TokenSet;
import com.example.storefront.exception.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Reauthentication tokens to a complete {@link TokenSet}: entitlement exchange, shard discovery
 * and, when the credentials did not carry one, identity resolution. Any failure ends the current
 * attempt; tokens are never reused on another session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenPipeline {

  static final String CLIENT_PLATFORM_JSON =
      "{\"platformType\":\"PC\",\"platformOS\":\"Windows\","
          + "\"platformOSVersion\":\"10.0.19042.1.256.64bit\",\"platformChipset\":\"Unknown\"}";
  private static final String CLIENT_PLATFORM_TOKEN =
      Base64.getEncoder().encodeToString(CLIENT_PLATFORM_JSON.getBytes(StandardCharsets.UTF_8));

  private final RiotAuthClient riotAuthClient;
  private final ValorantApiClient valorantApiClient;

  /**
   * @throws UpstreamException if any step fails or a token comes back empty
   */
  public TokenSet complete(AuthenticatedSession authenticated) {
    SessionContext session = authenticated.session();
    String accessToken = authenticated.tokens().accessToken();
    String idToken = authenticated.tokens().idToken();

    String entitlementsToken = exchangeEntitlement(session, accessToken);
    String shard = discoverShard(session, accessToken, idToken);
    String puuid = authenticated.attempt().source().hasPuuid()
        ? authenticated.attempt().source().puuid()
        : resolveIdentity(session, accessToken);

    TokenSet tokens = new TokenSet(accessToken, idToken, entitlementsToken, shard, puuid);
    if (!tokens.isComplete()) {
      throw new UpstreamException("Token pipeline produced an incomplete token set");
    }
    log.debug("Attempt {} completed token pipeline: {}", authenticated.attempt(), tokens);
    return tokens;
  }

  public String exchangeEntitlement(SessionContext session, String accessToken) {
    return riotAuthClient.exchangeEntitlement(session, accessToken);
  }

  public String discoverShard(SessionContext session, String accessToken, String idToken) {
    String shard = riotAuthClient.discoverShard(session, accessToken, idToken);
    log.debug("Discovered shard {}", shard);
    return shard;
  }

  public String resolveIdentity(SessionContext session, String accessToken) {
    return riotAuthClient.fetchSubject(session, accessToken);
  }

  /**
   * Current game client version; cached process-wide by the metadata client.
   */
  public String clientVersion() {
    return valorantApiClient.fetchClientVersion();
  }

  /**
   * Base64 of a fixed desktop platform descriptor, sent as {@code X-Riot-ClientPlatform}.
   */
  public static String clientPlatformToken() {
    return CLIENT_PLATFORM_TOKEN;
  }
}
