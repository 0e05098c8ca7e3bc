package com.example.storefront.exception;

public class CredentialsNotFoundException extends StorefrontException {

  private static final String HINT = "No session is on record for this user. Capture and register a session first.";

  public CredentialsNotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message, HINT);
  }
}
