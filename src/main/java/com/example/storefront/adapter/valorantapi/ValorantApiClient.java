package com.example.storefront.adapter.valorantapi;

import com.example.storefront.adapter.valorantapi.dto.VersionResponse;
import com.example.storefront.adapter.valorantapi.dto.WeaponSkinResponse;
import com.example.storefront.exception.UpstreamException;
import com.example.storefront.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A resilient and cached client for the public, unauthenticated game metadata feed.
 * Reads go through a Caffeine cache whose {@code get(key, loader)} collapses concurrent misses
 * into one fetch. Calls are protected by the "valorantApi" circuit breaker, whose fallback
 * serves the last value fetched successfully.
 */
@Slf4j
@Component
public class ValorantApiClient {

  private static final String VALORANT_API_BREAKER = "valorantApi";
  private static final String VERSION_KEY = "version";

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String baseUrl;
  private final Cache<String, String> versionCache;
  private final Cache<String, List<WeaponSkinResponse.WeaponSkin>> skinCache;
  private final Map<String, Object> lastKnown = new ConcurrentHashMap<>();

  public ValorantApiClient(@Qualifier("publicApiOkHttpClient") OkHttpClient httpClient,
                           ObjectMapper objectMapper,
                           ApplicationProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.baseUrl = properties.valorantApi().baseUrl();
    this.versionCache = Caffeine.newBuilder()
        .maximumSize(1)
        .expireAfterWrite(properties.valorantApi().cacheTtl())
        .build();
    this.skinCache = Caffeine.newBuilder()
        .maximumSize(16)
        .expireAfterWrite(properties.valorantApi().cacheTtl())
        .build();
    log.info("Initialized Valorant API client for: {}", baseUrl);
  }

  /**
   * Current game client version, sent as {@code X-Riot-ClientVersion}.
   *
   * @throws UpstreamException if the feed cannot be read and nothing was fetched before
   */
  @CircuitBreaker(name = VALORANT_API_BREAKER, fallbackMethod = "fetchClientVersionFallback")
  public String fetchClientVersion() {
    return versionCache.get(VERSION_KEY, key -> {
      VersionResponse response = get(HttpUrl.get(baseUrl + "/v1/version"), VersionResponse.class);
      if (response.data() == null || response.data().riotClientVersion() == null
          || response.data().riotClientVersion().isBlank()) {
        throw new UpstreamException("Version feed has no riotClientVersion");
      }
      String version = response.data().riotClientVersion();
      lastKnown.put(key, version);
      log.info("Fetched client version {}", version);
      return version;
    });
  }

  public String fetchClientVersionFallback(Throwable ex) {
    Object stale = lastKnown.get(VERSION_KEY);
    if (stale != null) {
      log.warn("Version feed unavailable ({}). Returning STALE client version.", ex.getMessage());
      return (String) stale;
    }
    throw asUpstream("Version feed is unavailable and no cached value exists", ex);
  }

  /**
   * Full weapon-skin feed in the given language, with levels and chromas.
   */
  @CircuitBreaker(name = VALORANT_API_BREAKER, fallbackMethod = "fetchSkinsFallback")
  public List<WeaponSkinResponse.WeaponSkin> fetchSkins(String language) {
    return skinCache.get(language, key -> {
      HttpUrl url = HttpUrl.get(baseUrl + "/v1/weapons/skins").newBuilder()
          .addQueryParameter("language", key)
          .build();
      WeaponSkinResponse response = get(url, WeaponSkinResponse.class);
      if (response.data() == null) {
        throw new UpstreamException("Skin feed has no data array");
      }
      List<WeaponSkinResponse.WeaponSkin> skins = List.copyOf(response.data());
      lastKnown.put(skinKey(key), skins);
      log.info("Fetched {} weapon skins for language {}", skins.size(), key);
      return skins;
    });
  }

  @SuppressWarnings("unchecked")
  public List<WeaponSkinResponse.WeaponSkin> fetchSkinsFallback(String language, Throwable ex) {
    Object stale = lastKnown.get(skinKey(language));
    if (stale != null) {
      log.warn("Skin feed unavailable ({}). Returning STALE skins for language {}.", ex.getMessage(), language);
      return (List<WeaponSkinResponse.WeaponSkin>) stale;
    }
    throw asUpstream("Skin feed is unavailable and no cached value exists for language " + language, ex);
  }

  private <T> T get(HttpUrl url, Class<T> type) {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new UpstreamException("Metadata feed " + url.encodedPath() + " returned status " + response.code(),
                                    response.code());
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new UpstreamException("Metadata feed " + url.encodedPath() + " returned an empty body");
      }
      return objectMapper.readValue(body.string(), type);
    } catch (IOException e) {
      throw new UpstreamException("Metadata feed " + url.encodedPath() + " could not be read", e);
    }
  }

  private static String skinKey(String language) {
    return "skins:" + language;
  }

  private static UpstreamException asUpstream(String message, Throwable ex) {
    if (ex instanceof UpstreamException upstream) {
      return upstream;
    }
    return new UpstreamException(message, ex);
  }
}
