package com.example.storefront.config;

import com.example.storefront.adapter.http.TransientRetryInterceptor;
import com.example.storefront.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp Client Configuration
 *
 * One shared connection pool for the provider and the public metadata feed.
 * Per-attempt provider clients are derived from {@code riotOkHttpClient} so they reuse it.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

  private final ApplicationProperties properties;

  /**
   * Shared connection pool to reduce connection establishment overhead
   */
  @Bean
  public ConnectionPool sharedConnectionPool() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(), TimeUnit.MINUTES);
  }

  /**
   * Base client for the identity provider and game services.
   * Redirects are never followed: the authorization redirect carries the tokens.
   * Has no cookie jar; {@code SessionContextFactory} adds one per attempt.
   */
  @Bean(name = "riotOkHttpClient")
  public OkHttpClient riotOkHttpClient(ConnectionPool connectionPool) {
    return baseBuilder(connectionPool)
        .addInterceptor(new TransientRetryInterceptor("riot", properties.http().retry()))
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }

  /**
   * Client for the public metadata feed
   */
  @Bean(name = "publicApiOkHttpClient")
  public OkHttpClient publicApiOkHttpClient(ConnectionPool connectionPool) {
    return baseBuilder(connectionPool)
        .addInterceptor(new TransientRetryInterceptor("valorantApi", properties.http().retry()))
        .build();
  }

  private OkHttpClient.Builder baseBuilder(ConnectionPool connectionPool) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(client.connectTimeout())
        .readTimeout(client.readTimeout())
        .writeTimeout(client.writeTimeout())
        .callTimeout(client.callTimeout())
        .retryOnConnectionFailure(true);
  }
}
