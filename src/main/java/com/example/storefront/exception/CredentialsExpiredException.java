package com.example.storefront.exception;

public class CredentialsExpiredException extends StorefrontException {

  private static final String HINT =
      "The session was rejected on every attempt. Log in again in the browser and re-capture the cookies.";

  public CredentialsExpiredException(String message) {
    super(ErrorKind.CREDENTIALS_EXPIRED, message, HINT);
  }
}
