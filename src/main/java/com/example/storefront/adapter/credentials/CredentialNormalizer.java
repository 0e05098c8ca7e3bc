package com.example.storefront.adapter.credentials;

import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.CredentialSourceType;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Maps raw key/value pairs from either store onto a {@link CredentialBundle}.
 * Each field has a fixed precedence list of accepted keys; the first non-blank value wins.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CredentialNormalizer {

  static final List<String> SSID_KEYS = List.of("ssid", "RIOT_SSID", "SSID");
  static final List<String> CLID_KEYS = List.of("clid", "RIOT_CLID", "CLID");
  static final List<String> SUB_KEYS = List.of("sub", "RIOT_SUB", "SUB");
  static final List<String> CSID_KEYS = List.of("csid", "RIOT_CSID", "CSID");
  static final List<String> TDID_KEYS = List.of("tdid", "RIOT_TDID", "TDID");
  static final List<String> PUUID_KEYS = List.of("puuid", "RIOT_PUUID", "PUUID");
  static final List<String> USER_AGENT_KEYS = List.of("user_agent", "ua", "userAgent", "USER_AGENT");

  /**
   * @param recordUserAgent user agent stored beside the payload, preferred over any payload key;
   *                        ignored for the legacy source, which never carries one
   */
  public static CredentialBundle normalize(CredentialSourceType source, Map<String, String> raw,
                                           String recordUserAgent) {
    String userAgent = null;
    if (source == CredentialSourceType.PRIMARY) {
      userAgent = sanitize(recordUserAgent);
      if (userAgent == null) {
        userAgent = firstPresent(raw, USER_AGENT_KEYS);
      }
    }
    return new CredentialBundle(
        source,
        firstPresent(raw, SSID_KEYS),
        firstPresent(raw, CLID_KEYS),
        firstPresent(raw, SUB_KEYS),
        firstPresent(raw, CSID_KEYS),
        firstPresent(raw, TDID_KEYS),
        firstPresent(raw, PUUID_KEYS),
        userAgent);
  }

  /**
   * Trims whitespace and one pair of surrounding quotes. Blank becomes {@code null}.
   */
  public static String sanitize(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    if (trimmed.length() >= 2) {
      char first = trimmed.charAt(0);
      char last = trimmed.charAt(trimmed.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
      }
    }
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static String firstPresent(Map<String, String> raw, List<String> keys) {
    for (String key : keys) {
      String value = sanitize(raw.get(key));
      if (value != null) {
        return value;
      }
    }
    return null;
  }
}
