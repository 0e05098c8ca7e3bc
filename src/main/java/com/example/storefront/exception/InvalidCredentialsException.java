package com.example.storefront.exception;

public class InvalidCredentialsException extends StorefrontException {

  private static final String HINT = "The stored session is missing its ssid cookie. Capture the session again.";

  public InvalidCredentialsException(String message) {
    super(ErrorKind.INVALID_CREDENTIALS, message, HINT);
  }
}
