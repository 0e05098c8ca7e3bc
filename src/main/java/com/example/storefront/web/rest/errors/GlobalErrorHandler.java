package com.example.storefront.web.rest.errors;

import com.example.storefront.exception.ErrorKind;
import com.example.storefront.exception.StorefrontException;
import com.example.storefront.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Global Error Handler
 *
 * One JSON body shape for every failure: {@code timestamp, status, error, message, hint, path}.
 * Exception messages are built without tokens or cookie values, so they are safe to return.
 */
@Slf4j
@RestControllerAdvice
public class GlobalErrorHandler {

  @ExceptionHandler(StorefrontException.class)
  public ResponseEntity<Map<String, Object>> handleStorefrontException(
      StorefrontException ex, WebRequest request) {
    HttpStatus status = statusOf(ex);
    if (status.is5xxServerError()) {
      log.warn("Storefront request failed with {}: {}", ex.getKind(), ex.getMessage());
    } else {
      log.info("Storefront request rejected with {}: {}", ex.getKind(), ex.getMessage());
    }

    Map<String, Object> body = createErrorBody(
        status,
        errorCode(ex),
        ex.getMessage(),
        ex.getHint(),
        request);
    return new ResponseEntity<>(body, status);
  }

  @ExceptionHandler(CancellationException.class)
  public ResponseEntity<Map<String, Object>> handleCancellation(
      CancellationException ex, WebRequest request) {
    log.info("Request cancelled: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.SERVICE_UNAVAILABLE,
        "cancelled",
        "The request was cancelled",
        null,
        request);
    return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.METHOD_NOT_ALLOWED,
        "method_not_allowed",
        String.format("Method %s not supported", ex.getMethod()),
        null,
        request);
    return new ResponseEntity<>(body, HttpStatus.METHOD_NOT_ALLOWED);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal_error",
        "An error occurred processing your request",
        null,
        request);
    return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  static HttpStatus statusOf(StorefrontException ex) {
    if (ex instanceof UpstreamException upstream && upstream.isForbidden()) {
      return HttpStatus.FORBIDDEN;
    }
    return switch (ex.getKind()) {
      case INVALID_CREDENTIALS -> HttpStatus.UNPROCESSABLE_ENTITY;
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case CREDENTIALS_EXPIRED -> HttpStatus.UNAUTHORIZED;
      case CHALLENGE_BLOCKED -> HttpStatus.SERVICE_UNAVAILABLE;
      case UPSTREAM_ERROR -> HttpStatus.BAD_GATEWAY;
    };
  }

  private static String errorCode(StorefrontException ex) {
    if (ex instanceof UpstreamException upstream && upstream.isForbidden()) {
      return "upstream_forbidden";
    }
    ErrorKind kind = ex.getKind();
    return kind.name().toLowerCase(Locale.ROOT);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, String hint, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    if (hint != null) {
      body.put("hint", hint);
    }
    body.put("path", extractPath(request));
    return body;
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
