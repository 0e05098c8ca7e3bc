package com.example.storefront.adapter.riot.session;

import com.example.storefront.domain.entity.AttemptSpec;
import okhttp3.OkHttpClient;

/**
 * HTTP client state owned exclusively by one attempt: browser-like headers plus its own cookie jar.
 * Closing it discards the jar; the shared connection pool is left untouched.
 */
public class SessionContext implements AutoCloseable {

  private final AttemptSpec attempt;
  private final OkHttpClient client;
  private final AttemptCookieJar cookieJar;
  private final String userAgent;

  SessionContext(AttemptSpec attempt, OkHttpClient client, AttemptCookieJar cookieJar, String userAgent) {
    this.attempt = attempt;
    this.client = client;
    this.cookieJar = cookieJar;
    this.userAgent = userAgent;
  }

  public AttemptSpec attempt() {
    return attempt;
  }

  public OkHttpClient client() {
    return client;
  }

  public AttemptCookieJar cookieJar() {
    return cookieJar;
  }

  public String userAgent() {
    return userAgent;
  }

  @Override
  public void close() {
    cookieJar.clear();
  }
}
