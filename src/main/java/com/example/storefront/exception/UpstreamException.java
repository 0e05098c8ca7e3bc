package com.example.storefront.exception;

/**
 * The provider was reached but answered with an unexpected payload or a non-retryable status.
 * A status of {@code 403} from the storefront is kept distinct: the credentials were accepted
 * but are not privileged enough, or are actively blocked.
 */
public class UpstreamException extends StorefrontException {

  public static final int NO_STATUS = -1;

  private static final String HINT = "The provider returned an unexpected response. Try again later.";
  private static final String FORBIDDEN_HINT =
      "The provider refused the storefront request for this account. The session may be restricted or blocked.";

  private final int status;

  public UpstreamException(String message) {
    this(message, NO_STATUS);
  }

  public UpstreamException(String message, int status) {
    super(ErrorKind.UPSTREAM_ERROR, message, status == 403 ? FORBIDDEN_HINT : HINT);
    this.status = status;
  }

  public UpstreamException(String message, Throwable cause) {
    super(ErrorKind.UPSTREAM_ERROR, message, HINT, cause);
    this.status = NO_STATUS;
  }

  public int getStatus() {
    return status;
  }

  public boolean isForbidden() {
    return status == 403;
  }
}
