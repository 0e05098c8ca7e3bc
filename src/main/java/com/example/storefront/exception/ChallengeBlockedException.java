package com.example.storefront.exception;

/**
 * Raised when anti-automation defenses intercepted at least one reauthentication attempt.
 * The remedy is a different egress network path, not new credentials.
 */
public class ChallengeBlockedException extends StorefrontException {

  private static final String HINT =
      "Requests were intercepted by a bot challenge. Retry later or from a different network path.";

  public ChallengeBlockedException(String message) {
    super(ErrorKind.CHALLENGE_BLOCKED, message, HINT);
  }
}
