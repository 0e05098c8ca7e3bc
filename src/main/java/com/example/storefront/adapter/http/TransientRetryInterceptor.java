package com.example.storefront.adapter.http;

import com.example.storefront.properties.ApplicationProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.Set;

/**
 * Retries a single HTTP call on transient failures: IO errors and the configured statuses
 * (409, 429 and 5xx by default), with exponential backoff.
 * Sits below the reauthentication attempt matrix and never changes credentials or headers.
 */
@Slf4j
public class TransientRetryInterceptor implements Interceptor {

  private final Retry retry;

  public TransientRetryInterceptor(String name, ApplicationProperties.OkHttpProperties.RetryProperties properties) {
    Set<Integer> retryableStatuses = Set.copyOf(properties.retryableStatuses());
    RetryConfig config = RetryConfig.<Response>custom()
        .maxAttempts(properties.maxAttempts())
        .intervalFunction(IntervalFunction.ofExponentialBackoff(
            properties.initialInterval(), properties.multiplier()))
        .retryOnResult(response -> retryableStatuses.contains(response.code()))
        .retryExceptions(IOException.class)
        .build();
    this.retry = Retry.of(name, config);
  }

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    Retry.Context<Response> context = retry.context();
    while (true) {
      try {
        Response response = chain.proceed(request);
        if (!context.onResult(response)) {
          context.onComplete();
          return response;
        }
        log.debug("Transient status {} from {} {}, retrying", response.code(), request.method(),
                  request.url().encodedPath());
        response.close();
      } catch (IOException e) {
        onError(context, e);
        log.debug("IO failure on {} {}, retrying: {}", request.method(), request.url().encodedPath(),
                  e.getMessage());
      }
    }
  }

  private static void onError(Retry.Context<Response> context, IOException e) throws IOException {
    try {
      context.onError(e);
    } catch (IOException rethrown) {
      throw rethrown;
    } catch (Exception other) {
      throw new IOException(other);
    }
  }
}
