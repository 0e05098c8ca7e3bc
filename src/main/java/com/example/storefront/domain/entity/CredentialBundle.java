package com.example.storefront.domain.entity;

import com.example.storefront.util.MaskingUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized, immutable view of one credential source.
 * Optional values are {@code null} when absent, never blank.
 */
public record CredentialBundle(
    CredentialSourceType source,
    String ssid,
    String clid,
    String sub,
    String csid,
    String tdid,
    String puuid,
    String userAgent
) {

  public static final String SSID = "ssid";
  public static final String CLID = "clid";
  public static final String SUB = "sub";
  public static final String CSID = "csid";
  public static final String TDID = "tdid";

  public boolean hasSsid() {
    return isPresent(ssid);
  }

  public boolean hasPuuid() {
    return isPresent(puuid);
  }

  public boolean hasUserAgent() {
    return isPresent(userAgent);
  }

  /**
   * Whether any cookie besides the ssid is present, i.e. whether a full jar differs from an ssid-only one.
   */
  public boolean hasSecondaryCookies() {
    return isPresent(clid) || isPresent(sub) || isPresent(csid) || isPresent(tdid);
  }

  /**
   * Cookie name/value pairs to seed for the given scope, in a stable order.
   */
  public Map<String, String> cookies(CookieScope scope) {
    Map<String, String> cookies = new LinkedHashMap<>();
    putIfPresent(cookies, SSID, ssid);
    if (scope == CookieScope.FULL) {
      putIfPresent(cookies, CLID, clid);
      putIfPresent(cookies, SUB, sub);
      putIfPresent(cookies, CSID, csid);
      putIfPresent(cookies, TDID, tdid);
    }
    return cookies;
  }

  @Override
  public String toString() {
    return "CredentialBundle[source=" + source
        + ", ssid=" + MaskingUtils.mask(ssid)
        + ", puuid=" + MaskingUtils.mask(puuid)
        + ", userAgent=" + (hasUserAgent() ? "stored" : "none") + "]";
  }

  private static void putIfPresent(Map<String, String> cookies, String name, String value) {
    if (isPresent(value)) {
      cookies.put(name, value);
    }
  }

  private static boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }
}
