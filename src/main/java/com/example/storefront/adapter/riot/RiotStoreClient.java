package com.example.storefront.adapter.riot;

import com.example.storefront.adapter.riot.session.SessionContext;
import com.example.storefront.domain.entity.TokenSet;
import com.example.storefront.exception.UpstreamException;
import com.example.storefront.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Client for the regional game-data hosts ({@code pd.<shard>.a.pvp.net}).
 * Returns status and body as received; negotiation between endpoint generations is the caller's job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiotStoreClient {

  public static final String ENTITLEMENTS_HEADER = "X-Riot-Entitlements-JWT";
  public static final String CLIENT_VERSION_HEADER = "X-Riot-ClientVersion";
  public static final String CLIENT_PLATFORM_HEADER = "X-Riot-ClientPlatform";

  private final ApplicationProperties properties;

  public record StoreResponse(int status, String body) {
    public boolean isSuccessful() {
      return status >= 200 && status < 300;
    }
  }

  /**
   * Current generation: {@code POST /store/v3/storefront/{puuid}} with an empty JSON body.
   */
  public StoreResponse storefrontV3(SessionContext session, TokenSet tokens, String shard,
                                    String clientVersion, String clientPlatform) {
    Request request = authorized(tokens, clientVersion, clientPlatform)
        .url(properties.riot().storeBaseUrl(shard) + "/store/v3/storefront/" + tokens.puuid())
        .post(RequestBody.create("{}", RiotAuthClient.JSON))
        .build();
    return execute(session, request, "Storefront v3");
  }

  /**
   * Prior generation: {@code GET /store/v2/storefront/{puuid}}.
   */
  public StoreResponse storefrontV2(SessionContext session, TokenSet tokens, String shard,
                                    String clientVersion, String clientPlatform) {
    Request request = authorized(tokens, clientVersion, clientPlatform)
        .url(properties.riot().storeBaseUrl(shard) + "/store/v2/storefront/" + tokens.puuid())
        .get()
        .build();
    return execute(session, request, "Storefront v2");
  }

  public StoreResponse wallet(SessionContext session, TokenSet tokens, String shard,
                              String clientVersion, String clientPlatform) {
    Request request = authorized(tokens, clientVersion, clientPlatform)
        .url(properties.riot().storeBaseUrl(shard) + "/store/v1/wallet/" + tokens.puuid())
        .get()
        .build();
    return execute(session, request, "Wallet");
  }

  private Request.Builder authorized(TokenSet tokens, String clientVersion, String clientPlatform) {
    return new Request.Builder()
        .header("Authorization", "Bearer " + tokens.accessToken())
        .header(ENTITLEMENTS_HEADER, tokens.entitlementsToken())
        .header(CLIENT_VERSION_HEADER, clientVersion)
        .header(CLIENT_PLATFORM_HEADER, clientPlatform);
  }

  private StoreResponse execute(SessionContext session, Request request, String operation) {
    try (Response response = session.client().newCall(request).execute()) {
      String body = RiotAuthClient.bodyOf(response);
      log.debug("{} on {} -> {}", operation, request.url().host(), response.code());
      return new StoreResponse(response.code(), body);
    } catch (IOException e) {
      throw new UpstreamException(operation + " failed due to network error", e);
    }
  }
}
