package com.example.storefront.exception;

/**
 * Base class for every failure surfaced to callers of the storefront service.
 * Messages and hints never carry raw tokens, cookies or provider markup.
 */
public abstract class StorefrontException extends RuntimeException {

  private final ErrorKind kind;
  private final String hint;

  protected StorefrontException(ErrorKind kind, String message, String hint) {
    super(message);
    this.kind = kind;
    this.hint = hint;
  }

  protected StorefrontException(ErrorKind kind, String message, String hint, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.hint = hint;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getHint() {
    return hint;
  }
}
