package com.example.storefront.exception;

/**
 * Caller-facing failure taxonomy.
 */
public enum ErrorKind {
  INVALID_CREDENTIALS,
  CREDENTIALS_EXPIRED,
  CHALLENGE_BLOCKED,
  UPSTREAM_ERROR,
  NOT_FOUND
}
