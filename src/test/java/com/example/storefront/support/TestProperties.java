package com.example.storefront.support;

import com.example.storefront.properties.ApplicationProperties;
import okhttp3.mockwebserver.MockWebServer;

import java.time.Duration;
import java.util.List;

/**
 * Application properties with every provider endpoint routed to one {@link MockWebServer}.
 */
public final class TestProperties {

  public static final String AUTH_PATH = "/auth";
  public static final String ENTITLEMENTS_PATH = "/entitlements/api/token/v1";
  public static final String GEO_PATH = "/geo/pas/v1/product/valorant";
  public static final String STORE_PATH = "/pd/";
  public static final String VALORANT_API_PATH = "/vapi";
  public static final String DEFAULT_AGENT = "DefaultAgent/1.0";
  public static final List<String> SHARDS = List.of("ap", "na", "eu", "kr", "pbe");

  private TestProperties() {}

  public static ApplicationProperties forServer(MockWebServer server) {
    return forServer(server, 1, null);
  }

  public static ApplicationProperties forServer(MockWebServer server, int retryAttempts, String encryptionKey) {
    return build(baseUrl(server), server.getHostName(), retryAttempts, encryptionKey,
                 new ApplicationProperties.CredentialProperties.LegacyFileProperties(true, null, null));
  }

  /**
   * Properties for credential store tests that never reach the network.
   */
  public static ApplicationProperties forCredentialStores(String encryptionKey, String overrideDir, String userDir) {
    return build("http://localhost", "localhost", 1, encryptionKey,
                 new ApplicationProperties.CredentialProperties.LegacyFileProperties(true, overrideDir, userDir));
  }

  private static ApplicationProperties build(String base, String cookieDomain, int retryAttempts, String encryptionKey,
                                             ApplicationProperties.CredentialProperties.LegacyFileProperties legacy) {
    return new ApplicationProperties(
        new ApplicationProperties.RiotProperties(
            base + AUTH_PATH,
            base + ENTITLEMENTS_PATH,
            base + GEO_PATH,
            base + STORE_PATH + "%s",
            cookieDomain,
            "https://playvalorant.com",
            "https://playvalorant.com/opt_in",
            DEFAULT_AGENT,
            "ja,en-US;q=0.9",
            SHARDS),
        new ApplicationProperties.ValorantApiProperties(base + VALORANT_API_PATH, "ja-JP", Duration.ofMinutes(10)),
        new ApplicationProperties.OkHttpProperties(
            new ApplicationProperties.OkHttpProperties.ClientProperties(
                5, 1, Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(10)),
            new ApplicationProperties.OkHttpProperties.RetryProperties(
                retryAttempts, Duration.ofMillis(10), 1.0, List.of(409, 429, 500, 502, 503, 504))),
        new ApplicationProperties.CredentialProperties(
            new ApplicationProperties.CredentialProperties.PrimaryStoreProperties(true, "credentials:", encryptionKey),
            legacy));
  }

  public static String baseUrl(MockWebServer server) {
    String url = server.url("/").toString();
    return url.substring(0, url.length() - 1);
  }
}
