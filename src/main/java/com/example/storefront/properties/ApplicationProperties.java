package com.example.storefront.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the Storefront service.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid @DefaultValue RiotProperties riot,
    @NotNull @Valid @DefaultValue ValorantApiProperties valorantApi,
    @NotNull @Valid @DefaultValue OkHttpProperties http,
    @NotNull @Valid @DefaultValue CredentialProperties credentials
) {

  public static final String DEFAULT_USER_AGENT =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
          + "Chrome/120.0.0.0 Safari/537.36";

  /**
   * Identity provider and game service endpoints
   */
  public record RiotProperties(
      @DefaultValue("https://auth.riotgames.com") @NotBlank String authBaseUrl,
      @DefaultValue("https://entitlements.auth.riotgames.com/api/token/v1") @NotBlank String entitlementsUrl,
      @DefaultValue("https://riot-geo.pas.si.riotgames.com/pas/v1/product/valorant") @NotBlank String geoUrl,
      @DefaultValue("https://pd.%s.a.pvp.net") @NotBlank String storeHostTemplate,
      @DefaultValue("riotgames.com") @NotBlank String cookieDomain,
      @DefaultValue("https://playvalorant.com") @NotBlank String webOrigin,
      @DefaultValue("https://playvalorant.com/opt_in") @NotBlank String webReferer,
      @DefaultValue(DEFAULT_USER_AGENT) @NotBlank String defaultUserAgent,
      @DefaultValue("ja,en-US;q=0.9,en;q=0.8") String acceptLanguage,
      @DefaultValue({"ap", "na", "eu", "kr", "pbe"}) @NotEmpty List<String> knownShards
  ) {

    public String legacyAuthorizationUrl() {
      return authBaseUrl + "/api/v1/authorization";
    }

    public String authorizeUrl() {
      return authBaseUrl + "/authorize";
    }

    public String userInfoUrl() {
      return authBaseUrl + "/userinfo";
    }

    public String storeBaseUrl(String shard) {
      return String.format(storeHostTemplate, shard);
    }
  }

  /**
   * Public, unauthenticated game metadata feed
   */
  public record ValorantApiProperties(
      @DefaultValue("https://valorant-api.com") @NotBlank String baseUrl,
      @DefaultValue("ja-JP") @NotBlank String language,
      @DefaultValue("10m") @DurationUnit(ChronoUnit.MINUTES) Duration cacheTtl
  ) {}

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid @DefaultValue ClientProperties client,
      @NotNull @Valid @DefaultValue RetryProperties retry
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("15s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout,
        @DefaultValue("15s") @DurationUnit(ChronoUnit.SECONDS) Duration writeTimeout,
        @DefaultValue("20s") @DurationUnit(ChronoUnit.SECONDS) Duration callTimeout
    ) {}

    public record RetryProperties(
        @DefaultValue("3") @Min(1) @Max(4) int maxAttempts,
        @DefaultValue("300ms") @DurationUnit(ChronoUnit.MILLIS) Duration initialInterval,
        @DefaultValue("2.0") @DecimalMin("1.0") double multiplier,
        @DefaultValue({"409", "429", "500", "502", "503", "504"}) List<Integer> retryableStatuses
    ) {}
  }

  /**
   * Credential store configuration
   */
  public record CredentialProperties(
      @NotNull @Valid @DefaultValue PrimaryStoreProperties primary,
      @NotNull @Valid @DefaultValue LegacyFileProperties legacyFile
  ) {
    public record PrimaryStoreProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("credentials:") @NotBlank String keyPrefix,
        String encryptionKey
    ) {}

    public record LegacyFileProperties(
        @DefaultValue("true") boolean enabled,
        String overrideDir,
        String userDir
    ) {}
  }
}
