package com.example.storefront.service;

import com.example.storefront.adapter.riot.RiotStoreClient;
import com.example.storefront.adapter.riot.RiotStoreClient.StoreResponse;
import com.example.storefront.adapter.riot.session.SessionContext;
import com.example.storefront.domain.entity.TokenSet;
import com.example.storefront.exception.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Fetches the storefront, falling back from the current endpoint generation to the prior one
 * when the current one is missing (404) or refuses the method (405).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorefrontFetcher {

  private static final Set<Integer> FALLBACK_STATUSES = Set.of(404, 405);

  private final RiotStoreClient riotStoreClient;
  private final ObjectMapper objectMapper;

  /**
   * @return the parsed storefront body, unmodified
   * @throws UpstreamException on any other non-success status; a 403 is {@link UpstreamException#isForbidden()}
   */
  public JsonNode fetchCatalog(SessionContext session, TokenSet tokens, String clientVersion) {
    String platform = TokenPipeline.clientPlatformToken();
    StoreResponse response = riotStoreClient.storefrontV3(session, tokens, tokens.shard(), clientVersion, platform);

    if (FALLBACK_STATUSES.contains(response.status())) {
      log.info("Storefront v3 returned {} on shard {}; falling back to v2", response.status(), tokens.shard());
      response = riotStoreClient.storefrontV2(session, tokens, tokens.shard(), clientVersion, platform);
    }

    if (!response.isSuccessful()) {
      throw new UpstreamException("Storefront request failed with status " + response.status(), response.status());
    }
    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new UpstreamException("Storefront returned a malformed body", e);
    }
  }

  /**
   * Prior-generation storefront status on an arbitrary shard. Diagnostic use only.
   */
  public int probeShard(SessionContext session, TokenSet tokens, String shard, String clientVersion) {
    return riotStoreClient.storefrontV2(session, tokens, shard, clientVersion, TokenPipeline.clientPlatformToken())
        .status();
  }

  public int probeWallet(SessionContext session, TokenSet tokens, String clientVersion) {
    return riotStoreClient.wallet(session, tokens, tokens.shard(), clientVersion, TokenPipeline.clientPlatformToken())
        .status();
  }
}
