package com.example.storefront.adapter.riot.session;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cookie jar owned by exactly one attempt.
 * Seeded from the credential bundle, then updated by whatever the provider sets during the attempt.
 */
public class AttemptCookieJar implements CookieJar {

  private final List<Cookie> cookies = new ArrayList<>();

  public synchronized void add(Cookie cookie) {
    cookies.removeIf(existing -> existing.name().equals(cookie.name())
        && existing.domain().equals(cookie.domain())
        && existing.path().equals(cookie.path())
        && existing.hostOnly() == cookie.hostOnly());
    cookies.add(cookie);
  }

  /**
   * A cookie set by the provider replaces every same-name copy visible to the responding URL,
   * including seeded copies scoped to a different domain.
   */
  @Override
  public synchronized void saveFromResponse(HttpUrl url, List<Cookie> responseCookies) {
    for (Cookie cookie : responseCookies) {
      cookies.removeIf(existing -> existing.name().equals(cookie.name()) && existing.matches(url));
      add(cookie);
    }
  }

  /**
   * Returns matching cookies, one per name. Seeded wildcard-domain and host-only copies
   * carry the same value; a rotated cookie has already replaced both.
   */
  @Override
  public synchronized List<Cookie> loadForRequest(HttpUrl url) {
    long now = System.currentTimeMillis();
    cookies.removeIf(cookie -> cookie.expiresAt() < now);
    Map<String, Cookie> byName = new LinkedHashMap<>();
    for (Cookie cookie : cookies) {
      if (cookie.matches(url)) {
        byName.putIfAbsent(cookie.name(), cookie);
      }
    }
    return new ArrayList<>(byName.values());
  }

  public synchronized List<String> names() {
    return cookies.stream().map(Cookie::name).distinct().toList();
  }

  public synchronized void clear() {
    cookies.clear();
  }
}
