package com.example.storefront.adapter.riot.session;

import com.example.storefront.domain.entity.AttemptSpec;
import com.example.storefront.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Cookie;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds a fresh {@link SessionContext} per attempt from the shared provider client.
 * Cookies are seeded on both the wildcard domain and the authentication host so that
 * the legacy and current authorization endpoints both see them.
 */
@Slf4j
@Component
public class SessionContextFactory {

  private static final String ACCEPT = "application/json, text/plain, */*";

  private final OkHttpClient riotOkHttpClient;
  private final ApplicationProperties.RiotProperties riot;
  private final String authHost;
  private final boolean secureCookies;

  public SessionContextFactory(@Qualifier("riotOkHttpClient") OkHttpClient riotOkHttpClient,
                               ApplicationProperties properties) {
    this.riotOkHttpClient = riotOkHttpClient;
    this.riot = properties.riot();
    HttpUrl authUrl = HttpUrl.get(riot.authBaseUrl());
    this.authHost = authUrl.host();
    this.secureCookies = authUrl.isHttps();
  }

  public SessionContext open(AttemptSpec attempt) {
    String userAgent = attempt.userAgentOverride() != null
        ? attempt.userAgentOverride()
        : riot.defaultUserAgent();

    AttemptCookieJar cookieJar = new AttemptCookieJar();
    Map<String, String> cookies = attempt.source().cookies(attempt.cookieScope());
    cookies.forEach((name, value) -> {
      cookieJar.add(cookie(name, value).domain(riot.cookieDomain()).build());
      cookieJar.add(cookie(name, value).hostOnlyDomain(authHost).build());
    });
    log.debug("Opened session for attempt {} with cookies {}", attempt, cookies.keySet());

    OkHttpClient client = riotOkHttpClient.newBuilder()
        .cookieJar(cookieJar)
        .addInterceptor(browserHeaders(userAgent))
        .build();
    return new SessionContext(attempt, client, cookieJar, userAgent);
  }

  private Cookie.Builder cookie(String name, String value) {
    Cookie.Builder builder = new Cookie.Builder()
        .name(name)
        .value(value)
        .path("/")
        .httpOnly();
    if (secureCookies) {
      builder.secure();
    }
    return builder;
  }

  private Interceptor browserHeaders(String userAgent) {
    return chain -> {
      Request original = chain.request();
      Request.Builder builder = original.newBuilder()
          .header("User-Agent", userAgent);
      setIfAbsent(original, builder, "Accept", ACCEPT);
      setIfAbsent(original, builder, "Origin", riot.webOrigin());
      setIfAbsent(original, builder, "Referer", riot.webReferer());
      if (riot.acceptLanguage() != null && !riot.acceptLanguage().isBlank()) {
        setIfAbsent(original, builder, "Accept-Language", riot.acceptLanguage());
      }
      return chain.proceed(builder.build());
    };
  }

  private static void setIfAbsent(Request original, Request.Builder builder, String name, String value) {
    if (original.header(name) == null) {
      builder.header(name, value);
    }
  }
}
