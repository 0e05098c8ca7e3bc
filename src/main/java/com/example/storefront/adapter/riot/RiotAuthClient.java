package com.example.storefront.adapter.riot;

import com.example.storefront.adapter.riot.session.SessionContext;
import com.example.storefront.domain.entity.AuthTokens;
import com.example.storefront.domain.entity.AuthVariant;
import com.example.storefront.domain.entity.AuthorizationProbe;
import com.example.storefront.exception.UpstreamException;
import com.example.storefront.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the identity provider: cookie reauthentication, entitlement exchange,
 * geo affinity and userinfo. Every call runs on the attempt's own {@link SessionContext}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiotAuthClient {

  static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final String BEARER = "Bearer ";
  private static final String EMPTY_JSON = "{}";

  private final ApplicationProperties properties;
  private final ObjectMapper objectMapper;

  /**
   * Runs one auth variant: the legacy POST first, then the redirect-based GET when the POST
   * produced no tokens. Transport failures and unexpected statuses are recorded, not thrown.
   */
  public AuthorizationProbe probe(SessionContext session, AuthVariant variant) {
    Map<String, String> params = variant.parameters();
    boolean challenged = false;

    int legacyStatus;
    try (Response response = session.client().newCall(legacyAuthorizationRequest(params)).execute()) {
      legacyStatus = response.code();
      String body = bodyOf(response);
      challenged = ChallengeDetector.isChallenge(response, body);
      if (response.isSuccessful() && !challenged) {
        Optional<AuthTokens> tokens = TokenFragmentParser.parse(redirectUriOf(body));
        if (tokens.isPresent()) {
          log.debug("Attempt {} {}: legacy authorization returned tokens", session.attempt(), variant);
          return new AuthorizationProbe(variant, legacyStatus, AuthorizationProbe.NOT_SENT, false, tokens.get());
        }
      }
    } catch (IOException e) {
      log.warn("Attempt {} {}: legacy authorization failed in transport: {}", session.attempt(), variant,
               e.getMessage());
      legacyStatus = AuthorizationProbe.NOT_SENT;
    }

    int authorizeStatus;
    try (Response response = session.client().newCall(authorizeRequest(params)).execute()) {
      authorizeStatus = response.code();
      String body = bodyOf(response);
      boolean authorizeChallenged = ChallengeDetector.isChallenge(response, body);
      challenged = challenged || authorizeChallenged;
      if (response.isRedirect() && !authorizeChallenged) {
        Optional<AuthTokens> tokens = TokenFragmentParser.parse(response.header("Location"));
        if (tokens.isPresent()) {
          log.debug("Attempt {} {}: authorize redirect returned tokens", session.attempt(), variant);
          return new AuthorizationProbe(variant, legacyStatus, authorizeStatus, challenged, tokens.get());
        }
      }
    } catch (IOException e) {
      log.warn("Attempt {} {}: authorize failed in transport: {}", session.attempt(), variant, e.getMessage());
      authorizeStatus = AuthorizationProbe.NOT_SENT;
    }

    log.info("Attempt {} {}: no tokens (POST={}, GET={}, challenge={})", session.attempt(), variant,
             legacyStatus, authorizeStatus, challenged);
    return new AuthorizationProbe(variant, legacyStatus, authorizeStatus, challenged, null);
  }

  public String exchangeEntitlement(SessionContext session, String accessToken) {
    Request request = new Request.Builder()
        .url(properties.riot().entitlementsUrl())
        .header("Authorization", BEARER + accessToken)
        .post(RequestBody.create(EMPTY_JSON, JSON))
        .build();

    JsonNode body = executeForJson(session, request, "Entitlement exchange");
    return requireText(body.path("entitlements_token"), "Entitlement exchange response has no entitlements_token");
  }

  public String discoverShard(SessionContext session, String accessToken, String idToken) {
    Request request = new Request.Builder()
        .url(properties.riot().geoUrl())
        .header("Authorization", BEARER + accessToken)
        .put(RequestBody.create(writeJson(Map.of("id_token", idToken)), JSON))
        .build();

    JsonNode body = executeForJson(session, request, "Shard discovery");
    return requireText(body.path("affinities").path("live"), "Shard discovery response has no live affinity");
  }

  public String fetchSubject(SessionContext session, String accessToken) {
    Request request = new Request.Builder()
        .url(properties.riot().userInfoUrl())
        .header("Authorization", BEARER + accessToken)
        .get()
        .build();

    JsonNode body = executeForJson(session, request, "Identity resolution");
    return requireText(body.path("sub"), "Userinfo response has no subject");
  }

  private Request legacyAuthorizationRequest(Map<String, String> params) {
    return new Request.Builder()
        .url(properties.riot().legacyAuthorizationUrl())
        .header("Content-Type", JSON.toString())
        .post(RequestBody.create(writeJson(params), JSON))
        .build();
  }

  private Request authorizeRequest(Map<String, String> params) {
    HttpUrl.Builder url = HttpUrl.get(properties.riot().authorizeUrl()).newBuilder();
    params.forEach(url::addQueryParameter);
    return new Request.Builder()
        .url(url.build())
        .get()
        .build();
  }

  private JsonNode executeForJson(SessionContext session, Request request, String operation) {
    try (Response response = session.client().newCall(request).execute()) {
      String body = bodyOf(response);
      if (!response.isSuccessful()) {
        throw new UpstreamException(operation + " failed with status " + response.code(), response.code());
      }
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new UpstreamException(operation + " returned a malformed body", e);
    } catch (IOException e) {
      throw new UpstreamException(operation + " failed due to network error", e);
    }
  }

  /**
   * The legacy endpoint answers {@code {"response":{"parameters":{"uri":"...#access_token=..."}}}}.
   */
  private String redirectUriOf(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      JsonNode uri = objectMapper.readTree(body).path("response").path("parameters").path("uri");
      return uri.isTextual() ? uri.asText() : null;
    } catch (JsonProcessingException e) {
      log.debug("Legacy authorization body is not JSON");
      return null;
    }
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize request body", e);
    }
  }

  private static String requireText(JsonNode node, String message) {
    if (!node.isTextual() || node.asText().isBlank()) {
      throw new UpstreamException(message);
    }
    return node.asText();
  }

  static String bodyOf(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }
}
