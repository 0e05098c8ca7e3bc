package com.example.storefront.config;

import com.example.storefront.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Configuration validator that enforces business rules and constraints
 * beyond basic JSR-303 validation. Fails fast at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final String PROTOCOL_HTTP = "http://";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final String SHARD_PLACEHOLDER = "%s";
  private static final Pattern SHARD_PATTERN = Pattern.compile("[a-z]{2,4}");
  private static final int AES_256_KEY_BYTES = 32;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateRiotConfig(errors);
    validateValorantApiConfig(errors);
    validateHttpConfig(errors);
    validateCredentialConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateRiotConfig(List<String> errors) {
    ApplicationProperties.RiotProperties riot = properties.riot();
    validateEndpoint(riot.authBaseUrl(), "Auth base URL", errors);
    validateEndpoint(riot.entitlementsUrl(), "Entitlements URL", errors);
    validateEndpoint(riot.geoUrl(), "Geo URL", errors);

    if (!riot.storeHostTemplate().contains(SHARD_PLACEHOLDER)) {
      errors.add("Store host template must contain a '%s' shard placeholder: " + riot.storeHostTemplate());
    } else {
      validateEndpoint(riot.storeBaseUrl("na"), "Store host template", errors);
    }

    if (riot.authBaseUrl().endsWith("/")) {
      errors.add("Auth base URL must not end with '/': " + riot.authBaseUrl());
    }
    for (String shard : riot.knownShards()) {
      if (!SHARD_PATTERN.matcher(shard).matches()) {
        errors.add("Known shard must be a short lower-case region code: " + shard);
      }
    }
  }

  private void validateValorantApiConfig(List<String> errors) {
    ApplicationProperties.ValorantApiProperties api = properties.valorantApi();
    validateEndpoint(api.baseUrl(), "Valorant API base URL", errors);
    if (api.cacheTtl().compareTo(Duration.ofSeconds(10)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Valorant API cache TTL", "10 seconds"));
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.callTimeout().compareTo(client.readTimeout()) < 0) {
      errors.add("HTTP call timeout must be greater than or equal to the read timeout.");
    }

    ApplicationProperties.OkHttpProperties.RetryProperties retry = properties.http().retry();
    if (retry.initialInterval().compareTo(Duration.ofMillis(50)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("HTTP retry initial interval", "50ms"));
    }
    long worstCaseBackoffMs = 0;
    double interval = retry.initialInterval().toMillis();
    for (int i = 1; i < retry.maxAttempts(); i++) {
      worstCaseBackoffMs += (long) interval;
      interval *= retry.multiplier();
    }
    if (worstCaseBackoffMs > 10_000) {
      errors.add("Total HTTP retry backoff (%dms) exceeds 10 seconds. Reduce attempts or interval."
                     .formatted(worstCaseBackoffMs));
    }
    for (Integer status : retry.retryableStatuses()) {
      if (status == null || status < 400 || status > 599) {
        errors.add("Retryable status must be a 4xx or 5xx code: " + status);
      }
    }
  }

  private void validateCredentialConfig(List<String> errors) {
    ApplicationProperties.CredentialProperties credentials = properties.credentials();
    if (!credentials.primary().enabled() && !credentials.legacyFile().enabled()) {
      errors.add("At least one credential store must be enabled.");
    }

    String key = credentials.primary().encryptionKey();
    if (credentials.primary().enabled() && key != null && !key.isBlank()) {
      try {
        if (Base64.getDecoder().decode(key.trim()).length != AES_256_KEY_BYTES) {
          errors.add("Credential encryption key must decode to 32 bytes (AES-256).");
        }
      } catch (IllegalArgumentException e) {
        errors.add("Credential encryption key is not valid base64.");
      }
    }
  }

  private void validateEndpoint(String url, String fieldName, List<String> errors) {
    if (!isValidUrl(url)) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, url));
      return;
    }
    if (url.startsWith(PROTOCOL_HTTP) && !url.contains(HOST_LOCALHOST) && !url.contains(HOST_LOOPBACK)) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, url));
    }
  }

  private boolean isValidUrl(String url) {
    try {
      URI uri = new URI(url);
      uri.toURL();
      return uri.getHost() != null;
    } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
      return false;
    }
  }
}
