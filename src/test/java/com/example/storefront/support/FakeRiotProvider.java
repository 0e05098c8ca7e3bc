package com.example.storefront.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Scriptable stand-in for the identity provider, the regional store hosts and the public metadata feed.
 * Every reauthentication request is recorded as an {@link AuthCall}.
 */
public class FakeRiotProvider extends Dispatcher {

  public static final String ACCESS_TOKEN = "access-token-0123456789";
  public static final String ID_TOKEN = "id-token-0123456789";
  public static final String ENTITLEMENTS_TOKEN = "entitlements-token-0123456789";
  public static final String CLIENT_VERSION = "release-09.00-shipping-28-2569981";
  public static final String USERINFO_PUUID = "0b1c2d3e-puuid-from-userinfo";

  public static final String SKIN_PARENT = "0a6a1a3e-4c1b-4f77-9d63-2b1c5d9e1f01";
  public static final String SKIN_LEVEL = "5d3c6f1e-7a2b-4e1c-8f9d-3c2b1a0e9d02";
  public static final String SKIN_CHROMA = "9e8d7c6b-5a4f-4e3d-8c2b-1a0f9e8d7c03";
  public static final String SKIN_NAME = "Prime Vandal";
  public static final String SKIN_ICON = "https://media.valorant-api.com/weaponskinlevels/level.png";
  public static final String WEAPON_SKIN_TYPE = "e7c63390-eda7-46e0-bb7a-a6abdacd2433";
  public static final String VP = "85ad13f7-3d1b-5128-9eb2-7cd8ee0b5741";

  public static final String SKINS_JSON = "{\"status\":200,\"data\":[{"
      + "\"uuid\":\"" + SKIN_PARENT + "\",\"displayName\":\"" + SKIN_NAME + "\",\"displayIcon\":null,"
      + "\"levels\":[{\"uuid\":\"" + SKIN_LEVEL + "\",\"displayIcon\":\"" + SKIN_ICON + "\"}],"
      + "\"chromas\":[{\"uuid\":\"" + SKIN_CHROMA + "\"}]}]}";

  public static final String CATALOG_JSON = "{\"SkinsPanelLayout\":{\"SingleItemStoreOffers\":[{"
      + "\"OfferID\":\"" + SKIN_LEVEL + "\",\"Cost\":{\"" + VP + "\":1775},"
      + "\"Rewards\":[{\"ItemTypeID\":\"" + WEAPON_SKIN_TYPE + "\",\"ItemID\":\"" + SKIN_LEVEL.toUpperCase()
      + "\",\"Quantity\":1}]}]}}";

  private static final String CHALLENGE_BODY = "<!DOCTYPE html><html><head><title>Just a moment...</title></head></html>";
  private static final String TOKEN_REDIRECT = "https://playvalorant.com/opt_in#access_token=" + ACCESS_TOKEN
      + "&scope=openid&iss=https%3A%2F%2Fauth.riotgames.com&id_token=" + ID_TOKEN
      + "&token_type=Bearer&session_state=abc&expires_in=3600";
  private static final String LOGIN_REDIRECT = "https://authenticate.riotgames.com/?client_id=play-valorant-web-prod";

  /**
   * One reauthentication request as the provider saw it.
   */
  public record AuthCall(String method, String ssid, String userAgent, boolean fullJar, String scope) {
    public boolean isScopeB() {
      return "openid link".equals(scope);
    }
  }

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<AuthCall> authCalls = Collections.synchronizedList(new ArrayList<>());

  private volatile Predicate<AuthCall> acceptLegacy = call -> false;
  private volatile Predicate<AuthCall> acceptAuthorize = call -> false;
  private volatile boolean challengeAll;
  private volatile String shard = "ap";
  private volatile int storefrontV3Status = 200;
  private volatile int storefrontV2Status = 200;
  private volatile int walletStatus = 200;
  private volatile String catalogJson = CATALOG_JSON;

  public FakeRiotProvider acceptLegacyWhen(Predicate<AuthCall> predicate) {
    this.acceptLegacy = predicate;
    return this;
  }

  public FakeRiotProvider acceptAuthorizeWhen(Predicate<AuthCall> predicate) {
    this.acceptAuthorize = predicate;
    return this;
  }

  public FakeRiotProvider challengeEverything() {
    this.challengeAll = true;
    return this;
  }

  public FakeRiotProvider shard(String shard) {
    this.shard = shard;
    return this;
  }

  public FakeRiotProvider storefrontStatuses(int v3Status, int v2Status) {
    this.storefrontV3Status = v3Status;
    this.storefrontV2Status = v2Status;
    return this;
  }

  public FakeRiotProvider catalog(String catalogJson) {
    this.catalogJson = catalogJson;
    return this;
  }

  public List<AuthCall> authCalls() {
    synchronized (authCalls) {
      return List.copyOf(authCalls);
    }
  }

  @Override
  public MockResponse dispatch(RecordedRequest request) {
    HttpUrl url = request.getRequestUrl();
    String path = url.encodedPath();
    String method = request.getMethod();

    if (path.equals(TestProperties.AUTH_PATH + "/api/v1/authorization") && "POST".equals(method)) {
      AuthCall call = record(request, "POST", scopeFromBody(request));
      if (challengeAll) {
        return challenge();
      }
      if (acceptLegacy.test(call)) {
        return json(200, "{\"type\":\"response\",\"response\":{\"mode\":\"fragment\",\"parameters\":{\"uri\":\""
            + TOKEN_REDIRECT + "\"}}}");
      }
      return json(200, "{\"type\":\"auth\",\"country\":\"jpn\"}");
    }
    if (path.equals(TestProperties.AUTH_PATH + "/authorize") && "GET".equals(method)) {
      AuthCall call = record(request, "GET", url.queryParameter("scope"));
      if (challengeAll) {
        return challenge();
      }
      return new MockResponse().setResponseCode(303)
          .setHeader("Location", acceptAuthorize.test(call) ? TOKEN_REDIRECT : LOGIN_REDIRECT);
    }
    if (path.equals(TestProperties.AUTH_PATH + "/userinfo")) {
      return bearerOnly(request, "{\"sub\":\"" + USERINFO_PUUID + "\",\"country\":\"jpn\"}");
    }
    if (path.equals(TestProperties.ENTITLEMENTS_PATH) && "POST".equals(method)) {
      return bearerOnly(request, "{\"entitlements_token\":\"" + ENTITLEMENTS_TOKEN + "\"}");
    }
    if (path.equals(TestProperties.GEO_PATH) && "PUT".equals(method)) {
      return bearerOnly(request, "{\"token\":\"geo\",\"affinities\":{\"pbe\":\"na\",\"live\":\"" + shard + "\"}}");
    }
    if (path.startsWith(TestProperties.STORE_PATH)) {
      return store(request, path, method);
    }
    if (path.equals(TestProperties.VALORANT_API_PATH + "/v1/version")) {
      return json(200, "{\"status\":200,\"data\":{\"riotClientVersion\":\"" + CLIENT_VERSION + "\"}}");
    }
    if (path.equals(TestProperties.VALORANT_API_PATH + "/v1/weapons/skins")) {
      return json(200, SKINS_JSON);
    }
    return new MockResponse().setResponseCode(404);
  }

  private MockResponse store(RecordedRequest request, String path, String method) {
    if (request.getHeader("X-Riot-Entitlements-JWT") == null || request.getHeader("X-Riot-ClientVersion") == null
        || request.getHeader("X-Riot-ClientPlatform") == null) {
      return new MockResponse().setResponseCode(400);
    }
    String requestShard = path.substring(TestProperties.STORE_PATH.length()).split("/")[0];
    if (path.contains("/store/v3/storefront/") && "POST".equals(method)) {
      return storeResponse(storefrontV3Status);
    }
    if (path.contains("/store/v2/storefront/") && "GET".equals(method)) {
      return requestShard.equals(shard) ? storeResponse(storefrontV2Status) : new MockResponse().setResponseCode(404);
    }
    if (path.contains("/store/v1/wallet/")) {
      return json(walletStatus, "{\"Balances\":{\"" + VP + "\":100}}");
    }
    return new MockResponse().setResponseCode(404);
  }

  private MockResponse storeResponse(int status) {
    return status == 200 ? json(200, catalogJson) : new MockResponse().setResponseCode(status);
  }

  private MockResponse bearerOnly(RecordedRequest request, String body) {
    if (!("Bearer " + ACCESS_TOKEN).equals(request.getHeader("Authorization"))) {
      return new MockResponse().setResponseCode(401);
    }
    return json(200, body);
  }

  private AuthCall record(RecordedRequest request, String method, String scope) {
    Map<String, String> cookies = cookies(request.getHeader("Cookie"));
    AuthCall call = new AuthCall(method, cookies.get("ssid"), request.getHeader("User-Agent"),
                                 cookies.containsKey("clid"), scope);
    authCalls.add(call);
    return call;
  }

  private String scopeFromBody(RecordedRequest request) {
    try {
      JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
      return body.path("scope").asText(null);
    } catch (IOException e) {
      return null;
    }
  }

  private static Map<String, String> cookies(String header) {
    Map<String, String> cookies = new LinkedHashMap<>();
    if (header == null) {
      return cookies;
    }
    for (String pair : header.split(";")) {
      int eq = pair.indexOf('=');
      if (eq > 0) {
        cookies.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
      }
    }
    return cookies;
  }

  private static MockResponse challenge() {
    return new MockResponse().setResponseCode(403)
        .setHeader("cf-mitigated", "challenge")
        .setHeader("Content-Type", "text/html")
        .setBody(CHALLENGE_BODY);
  }

  private static MockResponse json(int status, String body) {
    return new MockResponse().setResponseCode(status)
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }
}
